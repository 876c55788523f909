package xyz.firestige.engine.domain.shared.vo;

import java.util.Objects;
import java.util.UUID;

/**
 * 执行 ID 值对象
 * <p>
 * 每次部署尝试唯一，用于关联进度事件并隔离工作目录。
 */
public final class ExecutionId {

    private final String value;

    private ExecutionId(String value) {
        this.value = value;
    }

    public static ExecutionId of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ExecutionId 不能为空");
        }
        if (value.contains("/") || value.contains("..")) {
            throw new IllegalArgumentException("ExecutionId 不能包含路径分隔符: " + value);
        }
        return new ExecutionId(value);
    }

    public static ExecutionId generate() {
        return new ExecutionId(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value.equals(((ExecutionId) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
