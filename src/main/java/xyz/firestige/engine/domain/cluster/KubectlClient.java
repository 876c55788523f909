package xyz.firestige.engine.domain.cluster;

import java.nio.file.Path;
import java.util.List;

/**
 * 集群控制面调用
 */
public interface KubectlClient {

    void apply(Path manifest);

    /**
     * kubectl get &lt;kind&gt; -n &lt;namespace&gt; -o yaml
     */
    String getResourceYaml(String kind, String namespace);

    void createSecretFromFile(String namespace, String secretName, String key, Path file);

    void deleteSecret(String namespace, String secretName);

    List<KubernetesSecret> getSecrets(String namespace);

    void scale(String namespace, WorkloadKind kind, String selector, int replicas);

    boolean arePodsReady(String namespace, String selector);

    void createNamespaceIfAbsent(String namespace);
}
