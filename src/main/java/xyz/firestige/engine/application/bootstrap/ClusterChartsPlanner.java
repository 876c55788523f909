package xyz.firestige.engine.application.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.engine.domain.chart.ChartInfo;
import xyz.firestige.engine.domain.chart.ChartLevel;
import xyz.firestige.engine.domain.chart.ChartNamespaces;
import xyz.firestige.engine.domain.shared.exception.EngineException;
import xyz.firestige.engine.domain.shared.exception.ErrorType;
import xyz.firestige.engine.domain.shared.exception.FailureInfo;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 集群基础组件的分层安装计划
 * <p>
 * 固定六层，读取其他组件产出状态的组件必须位于其生产者之后的层级：
 * <ol>
 *   <li>storage-class, coredns-config</li>
 *   <li>container-registry-secret, cert-manager（指标：kube-prometheus-stack）</li>
 *   <li>（日志：promtail）</li>
 *   <li>metrics-server, external-dns（指标：prometheus-adapter, kube-state-metrics；日志：loki）</li>
 *   <li>ingress-nginx（未禁用时：pleco）</li>
 *   <li>cert-manager-configs, cluster-agent, shell-agent, deployment-engine, pod-recycler, token-rotate（指标或日志：grafana）</li>
 * </ol>
 * 条件组件只追加到所属层级，是否启用不影响其他组件所在层级；空层级也会保留。
 */
public class ClusterChartsPlanner {

    private static final Logger log = LoggerFactory.getLogger(ClusterChartsPlanner.class);

    public static final int LEVEL_COUNT = 6;

    private final ObjectMapper objectMapper;

    public ClusterChartsPlanner(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 生成安装计划
     *
     * @param outputsFile 前置基础设施步骤渲染的输出文件
     * @param prerequisites 配置与特性开关
     * @param libRoot chart 所在根目录
     * @param providerDirectory 云厂商专属 chart 目录名
     * @throws EngineException 输出文件缺失或无法解析（CONFIGURATION_ERROR），此时不返回任何层级
     */
    public List<ChartLevel> plan(Path outputsFile, ChartsConfigPrerequisites prerequisites, Path libRoot, String providerDirectory) {
        InfrastructureOutputs outputs = readOutputs(outputsFile);

        ChartPaths paths = new ChartPaths(libRoot, providerDirectory);
        String prometheusUrl = "http://prometheus-operated." + ChartNamespaces.PROMETHEUS + ".svc";
        String lokiUrl = "http://loki." + ChartNamespaces.LOGGING + ".svc:3100";

        ChartInfo storageClass = ChartInfo.builder("storage-class")
                .path(paths.provider("storage-class"))
                .namespace(ChartNamespaces.KUBE_SYSTEM)
                .build();

        ChartInfo corednsConfig = ChartInfo.builder("coredns-config")
                .path(paths.provider("coredns-config"))
                .namespace(ChartNamespaces.KUBE_SYSTEM)
                .value("managed_dns", prerequisites.getManagedDnsName())
                .value("managed_dns_resolvers", "{" + String.join("\\,", prerequisites.getManagedDnsResolvers()) + "}")
                .build();

        ChartInfo registrySecret = ChartInfo.builder("container-registry-secret")
                .path(paths.provider("container-registry-secret"))
                .namespace(ChartNamespaces.KUBE_SYSTEM)
                .value("secret_name", prerequisites.getRegistrySecretName())
                .value("secret_namespace", ChartNamespaces.KUBE_SYSTEM)
                .build();

        ChartInfo certManager = ChartInfo.builder("cert-manager")
                .path(paths.common("cert-manager"))
                .namespace(ChartNamespaces.CERT_MANAGER)
                .value("installCRDs", "true")
                .value("replicaCount", "1")
                .value("extraArgs", "{--dns01-recursive-nameservers-only,--dns01-recursive-nameservers=1.1.1.1:53\\,8.8.8.8:53}")
                // 依赖 prometheus 会形成环
                .value("prometheus.servicemonitor.enabled", "false")
                .value("resources.requests.cpu", "100m")
                .value("resources.limits.cpu", "200m")
                .backupResource("cert")
                .backupResource("issuer")
                .backupResource("clusterissuer")
                .build();

        ChartInfo kubePrometheusStack = ChartInfo.builder("kube-prometheus-stack")
                .path(paths.common("kube-prometheus-stack"))
                .namespace(ChartNamespaces.PROMETHEUS)
                .timeoutSeconds(480)
                .value("prometheus.prometheusSpec.externalUrl", prometheusUrl)
                .value("prometheus.prometheusSpec.retention", "15d")
                .build();

        ChartInfo promtail = ChartInfo.builder("promtail")
                .path(paths.common("promtail"))
                .namespace(ChartNamespaces.KUBE_SYSTEM)
                .lastBreakingVersion("0.24.0")
                .value("loki.serviceName", lokiUrl)
                .build();

        ChartInfo metricsServer = ChartInfo.builder("metrics-server")
                .path(paths.common("metrics-server"))
                .namespace(ChartNamespaces.KUBE_SYSTEM)
                .value("resources.requests.cpu", "250m")
                .value("resources.limits.cpu", "250m")
                .build();

        ChartInfo externalDns = ChartInfo.builder("external-dns")
                .path(paths.common("external-dns"))
                .namespace(ChartNamespaces.KUBE_SYSTEM)
                .value("provider", prerequisites.getExternalDnsProvider())
                .value("domainFilters", "{" + prerequisites.getManagedDnsName() + "}")
                .value("txtOwnerId", prerequisites.getClusterId())
                .value("txtPrefix", "engine-" + prerequisites.getClusterId())
                .build();

        ChartInfo prometheusAdapter = ChartInfo.builder("prometheus-adapter")
                .path(paths.common("prometheus-adapter"))
                .namespace(ChartNamespaces.PROMETHEUS)
                .value("prometheus.url", prometheusUrl)
                .build();

        ChartInfo kubeStateMetrics = ChartInfo.builder("kube-state-metrics")
                .path(paths.common("kube-state-metrics"))
                .namespace(ChartNamespaces.PROMETHEUS)
                .value("prometheus.monitor.enabled", "true")
                .build();

        ChartInfo loki = ChartInfo.builder("loki")
                .path(paths.common("loki"))
                .namespace(ChartNamespaces.LOGGING)
                .value("config.storage_config.aws.endpoint", outputs.getLogStorageHost())
                .value("config.storage_config.aws.region", outputs.getLogStorageRegion())
                .value("config.storage_config.aws.bucketnames", outputs.getLogStorageBucketName())
                .value("config.storage_config.aws.access_key_id", outputs.getLogStorageAccessId())
                .value("config.storage_config.aws.secret_access_key", outputs.getLogStorageSecretKey())
                .build();

        ChartInfo ingressNginx = ChartInfo.builder("ingress-nginx")
                .path(paths.common("ingress-nginx"))
                .namespace(ChartNamespaces.NGINX_INGRESS)
                .timeoutSeconds(800)
                .value("controller.ingressClass", "nginx-engine")
                .value("controller.metrics.enabled", String.valueOf(prerequisites.isMetricsHistoryEnabled()))
                .build();

        ChartInfo pleco = ChartInfo.builder("pleco")
                .path(paths.common("pleco"))
                .namespace(ChartNamespaces.KUBE_SYSTEM)
                .value("environmentVariables.CLOUD_PROVIDER", prerequisites.getCloudProvider())
                .value("environmentVariables.LOG_LEVEL", "debug")
                .build();

        ChartInfo certManagerConfigs = ChartInfo.builder("cert-manager-configs")
                .path(paths.common("cert-manager-configs"))
                .namespace(ChartNamespaces.CERT_MANAGER)
                .value("externalDnsProvider", prerequisites.getExternalDnsProvider())
                .value("acme.letsEncrypt.emailReport", prerequisites.getAcmeEmail())
                .value("acme.letsEncrypt.acmeUrl", prerequisites.getAcmeUrl())
                .value("provider." + prerequisites.getExternalDnsProvider() + ".apiToken", prerequisites.getDnsProviderApiToken())
                .value("provider." + prerequisites.getExternalDnsProvider() + ".email", prerequisites.getDnsProviderEmail())
                .build();

        ChartInfo clusterAgent = ChartInfo.builder("cluster-agent")
                .path(paths.common("cluster-agent"))
                .namespace(ChartNamespaces.ENGINE_SYSTEM)
                .value("image.tag", prerequisites.getAgentVersion())
                .value("environmentVariables.ORGANIZATION_ID", prerequisites.getOrganizationId())
                .value("environmentVariables.CLUSTER_ID", prerequisites.getClusterId())
                .build();

        ChartInfo shellAgent = ChartInfo.builder("shell-agent")
                .path(paths.common("shell-agent"))
                .namespace(ChartNamespaces.ENGINE_SYSTEM)
                .value("image.tag", prerequisites.getAgentVersion())
                .value("environmentVariables.CLUSTER_ID", prerequisites.getClusterId())
                .build();

        ChartInfo deploymentEngine = ChartInfo.builder("deployment-engine")
                .path(paths.common("deployment-engine"))
                .namespace(ChartNamespaces.ENGINE_SYSTEM)
                .timeoutSeconds(900)
                .action(prerequisites.getEngineLocation().chartAction())
                .value("image.tag", prerequisites.getEngineVersion())
                .value("autoscaler.min_replicas", "1")
                .value("autoscaler.max_replicas", prerequisites.isTestCluster() ? "1" : "10")
                .value("environmentVariables.ORGANIZATION_ID", prerequisites.getOrganizationId())
                .value("environmentVariables.CLUSTER_ID", prerequisites.getClusterId())
                .build();

        ChartInfo podRecycler = ChartInfo.builder("pod-recycler")
                .path(paths.provider("pod-recycler"))
                .namespace(ChartNamespaces.KUBE_SYSTEM)
                .value("environmentVariables.CLUSTER_ID", prerequisites.getClusterId())
                .build();

        ChartInfo tokenRotate = ChartInfo.builder("token-rotate")
                .path(paths.provider("token-rotate"))
                .namespace(ChartNamespaces.KUBE_SYSTEM)
                .value("environmentVariables.CLUSTER_ID", prerequisites.getClusterId())
                .build();

        ChartInfo grafana = ChartInfo.builder("grafana")
                .path(paths.common("grafana"))
                .namespace(ChartNamespaces.PROMETHEUS)
                .value("datasources.prometheus.enabled", String.valueOf(prerequisites.isMetricsHistoryEnabled()))
                .value("datasources.loki.enabled", String.valueOf(prerequisites.isLogHistoryEnabled()))
                .build();

        List<ChartInfo> level1 = new ArrayList<>(List.of(storageClass, corednsConfig));
        List<ChartInfo> level2 = new ArrayList<>(List.of(registrySecret, certManager));
        List<ChartInfo> level3 = new ArrayList<>();
        List<ChartInfo> level4 = new ArrayList<>(List.of(metricsServer, externalDns));
        List<ChartInfo> level5 = new ArrayList<>(List.of(ingressNginx));
        List<ChartInfo> level6 = new ArrayList<>(List.of(
                certManagerConfigs, clusterAgent, shellAgent, deploymentEngine, podRecycler, tokenRotate));

        if (prerequisites.isMetricsHistoryEnabled()) {
            level2.add(kubePrometheusStack);
            level4.add(prometheusAdapter);
            level4.add(kubeStateMetrics);
        }
        if (prerequisites.isLogHistoryEnabled()) {
            level3.add(promtail);
            level4.add(loki);
        }
        if (prerequisites.isMetricsHistoryEnabled() || prerequisites.isLogHistoryEnabled()) {
            level6.add(grafana);
        }
        if (!prerequisites.isLifecycleDaemonDisabled()) {
            level5.add(pleco);
        }

        List<ChartLevel> levels = List.of(
                new ChartLevel(1, level1),
                new ChartLevel(2, level2),
                new ChartLevel(3, level3),
                new ChartLevel(4, level4),
                new ChartLevel(5, level5),
                new ChartLevel(6, level6));
        ChartLevel.requireUniqueNames(levels);
        log.info("集群组件安装计划生成完成: cluster={}, levels={}", prerequisites.getClusterId(), levels);
        return levels;
    }

    private InfrastructureOutputs readOutputs(Path outputsFile) {
        String fileName = outputsFile.getFileName().toString();
        InputStream in;
        try {
            in = Files.newInputStream(outputsFile);
        } catch (NoSuchFileException e) {
            String safe = "Can't deploy helm charts as the infrastructure outputs file has not been rendered. Are you running in dry run mode?";
            throw new EngineException(FailureInfo.of(ErrorType.CONFIGURATION_ERROR, safe, safe + ", error: " + e, fileName), e);
        } catch (IOException e) {
            String safe = "Can't read infrastructure outputs file " + fileName;
            throw new EngineException(FailureInfo.of(ErrorType.CONFIGURATION_ERROR, safe, safe + ", error: " + e, fileName), e);
        }
        try (InputStream stream = in) {
            return objectMapper.readValue(stream, InfrastructureOutputs.class);
        } catch (IOException e) {
            String safe = "Error while parsing infrastructure outputs file " + fileName;
            throw new EngineException(FailureInfo.of(ErrorType.CONFIGURATION_ERROR, safe, safe + ", error: " + e.getMessage(), fileName), e);
        }
    }

    /**
     * chart 路径：通用 chart 在 common/charts 下，云厂商专属 chart 在 &lt;provider&gt;/charts 下
     */
    private static final class ChartPaths {
        private final Path libRoot;
        private final String providerDirectory;

        private ChartPaths(Path libRoot, String providerDirectory) {
            this.libRoot = libRoot;
            this.providerDirectory = providerDirectory;
        }

        String common(String chart) {
            return libRoot.resolve("common").resolve("charts").resolve(chart).toString();
        }

        String provider(String chart) {
            return libRoot.resolve(providerDirectory).resolve("charts").resolve(chart).toString();
        }
    }
}
