package xyz.firestige.engine.domain.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 模板渲染上下文
 */
public final class RenderContext {

    private final Map<String, Object> values = new LinkedHashMap<>();

    public RenderContext put(String key, Object value) {
        values.put(key, value);
        return this;
    }

    public RenderContext putAll(Map<String, ?> other) {
        values.putAll(other);
        return this;
    }

    public Object get(String key) {
        return values.get(key);
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString() {
        return "RenderContext" + values.keySet();
    }
}
