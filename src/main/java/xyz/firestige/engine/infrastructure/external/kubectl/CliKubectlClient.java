package xyz.firestige.engine.infrastructure.external.kubectl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import xyz.firestige.engine.domain.cluster.KubectlClient;
import xyz.firestige.engine.domain.cluster.KubernetesSecret;
import xyz.firestige.engine.domain.cluster.WorkloadKind;
import xyz.firestige.engine.domain.shared.exception.CommandException;
import xyz.firestige.engine.infrastructure.external.command.CommandResult;
import xyz.firestige.engine.infrastructure.external.command.CommandRunner;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 通过 kubectl 命令行实现的控制面客户端
 */
public class CliKubectlClient implements KubectlClient {

    private static final Duration TIMEOUT = Duration.ofSeconds(120);

    private final CommandRunner runner;
    private final ObjectMapper objectMapper;
    private final String binary;
    private final Path kubeconfig;

    public CliKubectlClient(CommandRunner runner, ObjectMapper objectMapper, String binary, Path kubeconfig) {
        this.runner = runner;
        this.objectMapper = objectMapper;
        this.binary = binary;
        this.kubeconfig = kubeconfig;
    }

    @Override
    public void apply(Path manifest) {
        run(List.of(binary, "apply", "-f", manifest.toString()), "Failed to apply " + manifest.getFileName());
    }

    @Override
    public String getResourceYaml(String kind, String namespace) {
        return run(List.of(binary, "get", kind, "--namespace", namespace, "-o", "yaml"),
                "Failed to read " + kind + " in " + namespace).stdout();
    }

    @Override
    public void createSecretFromFile(String namespace, String secretName, String key, Path file) {
        run(List.of(binary, "create", "secret", "generic", secretName, "--namespace", namespace,
                "--from-file=" + key + "=" + file), "Failed to create secret " + secretName);
    }

    @Override
    public void deleteSecret(String namespace, String secretName) {
        run(List.of(binary, "delete", "secret", secretName, "--namespace", namespace, "--ignore-not-found"),
                "Failed to delete secret " + secretName);
    }

    @Override
    public List<KubernetesSecret> getSecrets(String namespace) {
        CommandResult result = run(List.of(binary, "get", "secrets", "--namespace", namespace, "-o", "json"),
                "Failed to list secrets in " + namespace);
        try {
            JsonNode items = objectMapper.readTree(result.stdout()).path("items");
            List<KubernetesSecret> secrets = new ArrayList<>();
            for (JsonNode item : items) {
                Map<String, String> data = new LinkedHashMap<>();
                Iterator<Map.Entry<String, JsonNode>> fields = item.path("data").fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    data.put(field.getKey(), field.getValue().asText());
                }
                secrets.add(new KubernetesSecret(item.path("metadata").path("name").asText(), data));
            }
            return secrets;
        } catch (IOException e) {
            throw new CommandException(List.of(binary, "get", "secrets"), 0, "Unable to read secret list", e.getMessage());
        }
    }

    @Override
    public void scale(String namespace, WorkloadKind kind, String selector, int replicas) {
        run(List.of(binary, "scale", kind.getResourceName(), "--namespace", namespace, "-l", selector,
                "--replicas=" + replicas), "Failed to scale " + kind.getResourceName() + " " + selector);
    }

    @Override
    public boolean arePodsReady(String namespace, String selector) {
        CommandResult result = run(List.of(binary, "get", "pods", "--namespace", namespace, "-l", selector, "-o", "json"),
                "Failed to read pods " + selector);
        try {
            JsonNode items = objectMapper.readTree(result.stdout()).path("items");
            if (!items.elements().hasNext()) {
                return false;
            }
            for (JsonNode pod : items) {
                boolean ready = false;
                for (JsonNode condition : pod.path("status").path("conditions")) {
                    if ("Ready".equals(condition.path("type").asText()) && "True".equals(condition.path("status").asText())) {
                        ready = true;
                    }
                }
                if (!ready) {
                    return false;
                }
            }
            return true;
        } catch (IOException e) {
            throw new CommandException(List.of(binary, "get", "pods"), 0, "Unable to read pod status", e.getMessage());
        }
    }

    @Override
    public void createNamespaceIfAbsent(String namespace) {
        CommandResult result = runner.run(List.of(binary, "create", "namespace", namespace), environment(), null, TIMEOUT);
        if (!result.isSuccess() && !result.stderr().contains("AlreadyExists")) {
            throw new CommandException(List.of(binary, "create", "namespace", namespace), result.exitCode(),
                    "Failed to create namespace " + namespace, result.stderr());
        }
    }

    private CommandResult run(List<String> cmd, String safeMessage) {
        CommandResult result = runner.run(cmd, environment(), null, TIMEOUT);
        if (!result.isSuccess()) {
            throw new CommandException(cmd, result.exitCode(), safeMessage, result.stderr());
        }
        return result;
    }

    private Map<String, String> environment() {
        return kubeconfig == null ? Map.of() : Map.of("KUBECONFIG", kubeconfig.toString());
    }
}
