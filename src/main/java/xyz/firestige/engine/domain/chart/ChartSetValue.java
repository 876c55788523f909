package xyz.firestige.engine.domain.chart;

import java.util.Objects;

/**
 * helm --set 键值对
 */
public final class ChartSetValue {

    private final String key;
    private final String value;

    private ChartSetValue(String key, String value) {
        this.key = Objects.requireNonNull(key, "key");
        this.value = value == null ? "" : value;
    }

    public static ChartSetValue of(String key, String value) {
        return new ChartSetValue(key, value);
    }

    public String getKey() {
        return key;
    }

    public String getValue() {
        return value;
    }

    /**
     * helm 参数形式 key=value
     */
    public String toArgument() {
        return key + "=" + value;
    }

    @Override
    public String toString() {
        return toArgument();
    }
}
