package xyz.firestige.engine.domain.cluster;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;

/**
 * 集群 Secret 视图，data 保持 base64 编码
 */
public final class KubernetesSecret {

    private final String name;
    private final Map<String, String> data;

    public KubernetesSecret(String name, Map<String, String> data) {
        this.name = name;
        this.data = data == null ? Map.of() : Map.copyOf(data);
    }

    public String getName() {
        return name;
    }

    public Map<String, String> getData() {
        return data;
    }

    public boolean hasData() {
        return !data.isEmpty();
    }

    public Optional<String> decoded(String key) {
        String encoded = data.get(key);
        if (encoded == null) {
            return Optional.empty();
        }
        return Optional.of(new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8));
    }
}
