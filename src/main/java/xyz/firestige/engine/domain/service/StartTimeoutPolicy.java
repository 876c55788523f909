package xyz.firestige.engine.domain.service;

import java.time.Duration;

/**
 * 启动超时计算：(基准 + 余量) * 倍数
 */
public final class StartTimeoutPolicy {

    public static final StartTimeoutPolicy DEFAULT = new StartTimeoutPolicy(Duration.ofSeconds(10), 4);

    private final Duration margin;
    private final int multiplier;

    public StartTimeoutPolicy(Duration margin, int multiplier) {
        if (margin == null || margin.isNegative()) {
            throw new IllegalArgumentException("margin must not be negative");
        }
        if (multiplier < 1) {
            throw new IllegalArgumentException("multiplier must be >= 1");
        }
        this.margin = margin;
        this.multiplier = multiplier;
    }

    public Duration compute(Duration base) {
        return base.plus(margin).multipliedBy(multiplier);
    }

    public Duration getMargin() {
        return margin;
    }

    public int getMultiplier() {
        return multiplier;
    }
}
