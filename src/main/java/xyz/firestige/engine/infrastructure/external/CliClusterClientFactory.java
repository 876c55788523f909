package xyz.firestige.engine.infrastructure.external;

import com.fasterxml.jackson.databind.ObjectMapper;
import xyz.firestige.engine.domain.cluster.CloudProviderSettings;
import xyz.firestige.engine.domain.cluster.HelmClient;
import xyz.firestige.engine.domain.cluster.KubectlClient;
import xyz.firestige.engine.domain.cluster.KubernetesCluster;
import xyz.firestige.engine.infrastructure.external.command.CommandRunner;
import xyz.firestige.engine.infrastructure.external.helm.CliHelmClient;
import xyz.firestige.engine.infrastructure.external.kubectl.CliKubectlClient;

import java.nio.file.Path;
import java.time.Duration;

/**
 * 按 kubeconfig 创建命令行客户端，每个集群一组
 */
public class CliClusterClientFactory {

    private final CommandRunner runner;
    private final ObjectMapper objectMapper;
    private final String helmBinary;
    private final String kubectlBinary;
    private final Duration timeoutBuffer;

    public CliClusterClientFactory(CommandRunner runner, ObjectMapper objectMapper,
                                   String helmBinary, String kubectlBinary, Duration timeoutBuffer) {
        this.runner = runner;
        this.objectMapper = objectMapper;
        this.helmBinary = helmBinary;
        this.kubectlBinary = kubectlBinary;
        this.timeoutBuffer = timeoutBuffer;
    }

    public HelmClient helm(Path kubeconfig) {
        return new CliHelmClient(runner, objectMapper, helmBinary, kubeconfig, timeoutBuffer);
    }

    public KubectlClient kubectl(Path kubeconfig) {
        return new CliKubectlClient(runner, objectMapper, kubectlBinary, kubeconfig);
    }

    /**
     * 预先填好 helm / kubectl 的集群构建器
     */
    public KubernetesCluster.Builder cluster(String id, CloudProviderSettings provider, Path kubeconfig) {
        return KubernetesCluster.builder(id)
                .provider(provider)
                .kubeconfig(kubeconfig)
                .helm(helm(kubeconfig))
                .kubectl(kubectl(kubeconfig));
    }
}
