package xyz.firestige.engine.infrastructure.metrics;

import io.micrometer.core.instrument.MeterRegistry;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 基于 Micrometer 的指标实现，容器中存在 MeterRegistry 时启用
 */
public class MicrometerMetricsRegistry implements MetricsRegistry {

    private final MeterRegistry registry;
    private final ConcurrentMap<String, GaugeValue> gauges = new ConcurrentHashMap<>();

    public MicrometerMetricsRegistry(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void incrementCounter(String name) {
        registry.counter(name).increment();
    }

    @Override
    public void setGauge(String name, double value) {
        // registry 对 gauge 对象只持有弱引用，需在此保留强引用
        GaugeValue holder = gauges.computeIfAbsent(name, n -> {
            GaugeValue g = new GaugeValue();
            registry.gauge(n, g, GaugeValue::get);
            return g;
        });
        holder.set(value);
    }

    static class GaugeValue {
        private volatile double value;

        double get() {
            return value;
        }

        void set(double value) {
            this.value = value;
        }
    }
}
