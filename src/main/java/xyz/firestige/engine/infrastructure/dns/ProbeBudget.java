package xyz.firestige.engine.infrastructure.dns;

import java.time.Duration;

/**
 * 探测预算：固定间隔、有限次数
 */
public record ProbeBudget(int maxAttempts, Duration interval) {

    /**
     * CNAME 校验：5s x 30，约 2.5 分钟
     */
    public static final ProbeBudget CNAME_DEFAULT = new ProbeBudget(30, Duration.ofSeconds(5));

    /**
     * 域名可解析：3s x 100，约 5 分钟
     */
    public static final ProbeBudget DOMAIN_DEFAULT = new ProbeBudget(100, Duration.ofSeconds(3));

    public ProbeBudget {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0");
        }
        if (interval == null || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
    }
}
