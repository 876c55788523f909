package xyz.firestige.engine.domain.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.engine.domain.shared.exception.EngineException;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * 服务资源规格，渲染进事务后不可变
 * <p>
 * CPU 使用 Kubernetes 表示法（"500m"、"1"、"1.5"）。
 */
public final class Sizing {

    private static final Logger log = LoggerFactory.getLogger(Sizing.class);

    private final String cpuRequest;
    private final String cpuBurst;
    private final int ramMib;
    private final int minInstances;
    private final int maxInstances;

    private Sizing(String cpuRequest, String cpuBurst, int ramMib, int minInstances, int maxInstances) {
        this.cpuRequest = Objects.requireNonNull(cpuRequest, "cpuRequest");
        this.cpuBurst = cpuBurst == null ? cpuRequest : cpuBurst;
        this.ramMib = ramMib;
        this.minInstances = minInstances;
        this.maxInstances = maxInstances;
    }

    public static Sizing of(String cpuRequest, String cpuBurst, int ramMib, int minInstances, int maxInstances) {
        return new Sizing(cpuRequest, cpuBurst, ramMib, minInstances, maxInstances);
    }

    /**
     * 单实例规格，突发 CPU 等于请求值
     */
    public static Sizing single(String cpu, int ramMib) {
        return new Sizing(cpu, cpu, ramMib, 1, 1);
    }

    /**
     * 解析 CPU 数量为 millicore
     *
     * @throws IllegalArgumentException 无法解析
     */
    public static long parseCpuMillis(String quantity) {
        if (quantity == null || quantity.isBlank()) {
            throw new IllegalArgumentException("cpu quantity cannot be empty");
        }
        String value = quantity.trim();
        try {
            if (value.endsWith("m")) {
                return Long.parseLong(value.substring(0, value.length() - 1));
            }
            return new BigDecimal(value).movePointRight(3).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new IllegalArgumentException("invalid cpu quantity: " + quantity, e);
        }
    }

    /**
     * 校验规格
     *
     * @param scaling 是否校验实例数区间（无状态应用）
     * @throws EngineException VALIDATION_ERROR
     */
    public void validate(String serviceName, boolean scaling) {
        long request;
        try {
            request = parseCpuMillis(cpuRequest);
            parseCpuMillis(cpuBurst);
        } catch (IllegalArgumentException e) {
            throw EngineException.validation("Invalid CPU value for " + serviceName + ": " + e.getMessage());
        }
        if (request <= 0) {
            throw EngineException.validation("CPU request for " + serviceName + " must be greater than 0");
        }
        if (ramMib <= 0) {
            throw EngineException.validation("Memory for " + serviceName + " must be greater than 0");
        }
        if (scaling && (minInstances < 1 || minInstances > maxInstances)) {
            throw EngineException.validation("Instance bounds for " + serviceName
                    + " must satisfy 1 <= min <= max, got min=" + minInstances + " max=" + maxInstances);
        }
    }

    /**
     * 突发 CPU 不得小于请求值，小于时提升到请求值
     */
    public String effectiveCpuBurst() {
        long request = parseCpuMillis(cpuRequest);
        long burst = parseCpuMillis(cpuBurst);
        if (burst < request) {
            log.warn("CPU 突发值 {} 小于请求值 {}，已提升为请求值", cpuBurst, cpuRequest);
            return cpuRequest;
        }
        return cpuBurst;
    }

    public String getCpuRequest() {
        return cpuRequest;
    }

    public String getCpuBurst() {
        return cpuBurst;
    }

    public int getRamMib() {
        return ramMib;
    }

    public int getMinInstances() {
        return minInstances;
    }

    public int getMaxInstances() {
        return maxInstances;
    }

    @Override
    public String toString() {
        return "Sizing{cpu=" + cpuRequest + "/" + cpuBurst + ", ram=" + ramMib + "Mi, instances=" + minInstances + ".." + maxInstances + "}";
    }
}
