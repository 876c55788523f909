package xyz.firestige.engine.infrastructure.chart;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.engine.domain.chart.ChartInfo;
import xyz.firestige.engine.domain.cluster.KubectlClient;
import xyz.firestige.engine.domain.cluster.KubernetesSecret;
import xyz.firestige.engine.domain.shared.exception.EngineException;
import xyz.firestige.engine.domain.shared.exception.ErrorType;
import xyz.firestige.engine.domain.shared.exception.FailureInfo;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * chart 升级前后的资源备份与恢复
 * <p>
 * 备份保存在命名空间内的 Secret 中，名称为 "&lt;chart&gt;-&lt;resource&gt;-q-backup"。
 * 已存在的备份不会被覆盖，重复执行不会产生新的备份。
 */
public class ChartBackupService {

    private static final Logger log = LoggerFactory.getLogger(ChartBackupService.class);

    public static final String BACKUP_SUFFIX = "-q-backup";

    private static final List<String> SERVER_MANAGED_METADATA =
            List.of("resourceVersion", "uid", "creationTimestamp", "managedFields", "selfLink", "generation");

    private final YAMLMapper yamlMapper;

    public ChartBackupService(YAMLMapper yamlMapper) {
        this.yamlMapper = yamlMapper;
    }

    public static String backupSecretName(String chartName, String resource) {
        return chartName + "-" + resource + BACKUP_SUFFIX;
    }

    /**
     * 升级前为 chart 声明的每种资源创建备份
     *
     * @return 新创建的备份 Secret 名称
     */
    public List<String> prepare(KubectlClient kubectl, ChartInfo chart, Path workspace) {
        if (chart.getBackupResources().isEmpty()) {
            return List.of();
        }
        Set<String> existing = kubectl.getSecrets(chart.getNamespace()).stream()
                .map(KubernetesSecret::getName)
                .collect(Collectors.toSet());

        List<String> created = new ArrayList<>();
        for (String resource : chart.getBackupResources()) {
            String secretName = backupSecretName(chart.getName(), resource);
            if (existing.contains(secretName)) {
                log.info("备份已存在，保留原备份: chart={}, secret={}", chart.getName(), secretName);
                continue;
            }
            String content;
            try {
                content = kubectl.getResourceYaml(resource, chart.getNamespace());
            } catch (EngineException e) {
                // 全新集群上 CRD 尚未安装，资源类型不存在
                log.warn("读取资源失败，跳过备份: chart={}, resource={}, error={}",
                        chart.getName(), resource, e.getFailureInfo().getRawMessage());
                continue;
            }
            if (isEmptyResource(content)) {
                log.debug("没有需要备份的资源: chart={}, resource={}", chart.getName(), resource);
                continue;
            }
            Path file = workspace.resolve(secretName + ".yaml");
            try {
                Files.createDirectories(workspace);
                Files.writeString(file, cleanup(content), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new EngineException(FailureInfo.of(ErrorType.EXECUTION_ERROR,
                        "Unable to back up " + resource + " before upgrading " + chart.getName(), e.getMessage(), chart.getName()), e);
            }
            kubectl.createSecretFromFile(chart.getNamespace(), secretName, resource, file);
            created.add(secretName);
            log.info("已创建备份: chart={}, secret={}", chart.getName(), secretName);
        }
        return created;
    }

    /**
     * 升级成功后恢复 chart 的备份并删除备份 Secret
     *
     * @return 已处理的备份数量
     */
    public int apply(KubectlClient kubectl, ChartInfo chart, Path workspace) {
        if (chart.getBackupResources().isEmpty()) {
            return 0;
        }
        Set<String> expected = chart.getBackupResources().stream()
                .map(resource -> backupSecretName(chart.getName(), resource))
                .collect(Collectors.toSet());

        int handled = 0;
        for (KubernetesSecret secret : kubectl.getSecrets(chart.getNamespace())) {
            if (!expected.contains(secret.getName())) {
                continue;
            }
            if (!secret.hasData()) {
                kubectl.deleteSecret(chart.getNamespace(), secret.getName());
                handled++;
                continue;
            }
            for (Map.Entry<String, String> entry : secret.getData().entrySet()) {
                Optional<String> content = secret.decoded(entry.getKey());
                if (content.isEmpty() || content.get().isBlank()) {
                    continue;
                }
                Path file = workspace.resolve(secret.getName() + "-" + entry.getKey() + ".yaml");
                try {
                    Files.createDirectories(workspace);
                    Files.writeString(file, content.get(), StandardCharsets.UTF_8);
                } catch (IOException e) {
                    throw new EngineException(FailureInfo.of(ErrorType.EXECUTION_ERROR,
                            "Unable to restore backup of " + chart.getName(), e.getMessage(), chart.getName()), e);
                }
                kubectl.apply(file);
            }
            kubectl.deleteSecret(chart.getNamespace(), secret.getName());
            handled++;
            log.info("已恢复备份: chart={}, secret={}", chart.getName(), secret.getName());
        }
        return handled;
    }

    static boolean isEmptyResource(String content) {
        if (content == null || content.isBlank()) {
            return true;
        }
        return content.toLowerCase().contains("no resources found") || content.contains("items: []");
    }

    /**
     * 去掉服务端维护的字段，使快照可以重新 apply
     */
    String cleanup(String yaml) throws IOException {
        JsonNode root = yamlMapper.readTree(yaml);
        if (root == null || !root.isObject()) {
            return yaml;
        }
        stripServerFields((ObjectNode) root);
        JsonNode items = root.get("items");
        if (items != null && items.isArray()) {
            for (JsonNode item : items) {
                if (item.isObject()) {
                    stripServerFields((ObjectNode) item);
                }
            }
        }
        return yamlMapper.writeValueAsString(root);
    }

    private static void stripServerFields(ObjectNode node) {
        node.remove("status");
        JsonNode metadata = node.get("metadata");
        if (metadata instanceof ObjectNode meta) {
            meta.remove(SERVER_MANAGED_METADATA);
        }
    }
}
