package xyz.firestige.engine.infrastructure.metrics;

/**
 * 空实现，未接入监控系统时使用
 */
public class NoopMetricsRegistry implements MetricsRegistry {

    @Override
    public void incrementCounter(String name) {
    }

    @Override
    public void setGauge(String name, double value) {
    }
}
