package xyz.firestige.engine.infrastructure.external.helm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.engine.domain.chart.ChartInfo;
import xyz.firestige.engine.domain.chart.ChartSetValue;
import xyz.firestige.engine.domain.cluster.HelmClient;
import xyz.firestige.engine.domain.cluster.HelmDeploymentStatus;
import xyz.firestige.engine.domain.shared.exception.CommandException;
import xyz.firestige.engine.domain.version.VersionsNumber;
import xyz.firestige.engine.infrastructure.external.command.CommandResult;
import xyz.firestige.engine.infrastructure.external.command.CommandRunner;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 通过 helm 命令行实现的包管理器客户端
 */
public class CliHelmClient implements HelmClient {

    private static final Logger log = LoggerFactory.getLogger(CliHelmClient.class);

    private static final Pattern CHART_VERSION = Pattern.compile("-(v?\\d+(\\.\\d+){0,2}([-+][0-9A-Za-z.-]+)?)$");
    private static final Duration SHORT_TIMEOUT = Duration.ofSeconds(60);

    private final CommandRunner runner;
    private final ObjectMapper objectMapper;
    private final String binary;
    private final Path kubeconfig;
    private final Duration timeoutBuffer;

    public CliHelmClient(CommandRunner runner, ObjectMapper objectMapper, String binary, Path kubeconfig, Duration timeoutBuffer) {
        this.runner = runner;
        this.objectMapper = objectMapper;
        this.binary = binary;
        this.kubeconfig = kubeconfig;
        this.timeoutBuffer = timeoutBuffer;
    }

    @Override
    public HelmDeploymentStatus upgrade(ChartInfo chart, List<Path> valuesFiles) {
        List<String> cmd = new ArrayList<>();
        cmd.add(binary);
        cmd.add("upgrade");
        cmd.add("--install");
        cmd.add(chart.getName());
        cmd.add(chart.getPath());
        cmd.add("--namespace");
        cmd.add(chart.getNamespace());
        cmd.add("--create-namespace");
        cmd.add("--timeout");
        cmd.add(Math.max(1, chart.getTimeout().toSeconds()) + "s");
        cmd.add("--history-max");
        cmd.add("50");
        if (chart.isAtomic()) {
            cmd.add("--atomic");
        }
        if (chart.isWaitForResources()) {
            cmd.add("--wait");
        }
        for (String file : chart.getValuesFiles()) {
            cmd.add("-f");
            cmd.add(file);
        }
        for (Path file : valuesFiles) {
            cmd.add("-f");
            cmd.add(file.toString());
        }
        for (ChartSetValue value : chart.getValues()) {
            cmd.add("--set");
            cmd.add(value.toArgument());
        }
        cmd.add("-o");
        cmd.add("json");

        CommandResult result = run(cmd, chart.getTimeout().plus(timeoutBuffer),
                "Failed to deploy chart " + chart.getName());
        return parseStatus(chart.getName(), result.stdout());
    }

    @Override
    public void uninstall(String releaseName, String namespace) {
        List<String> cmd = List.of(binary, "uninstall", releaseName, "--namespace", namespace, "--wait");
        CommandResult result = runner.run(cmd, environment(), null, SHORT_TIMEOUT.multipliedBy(5));
        if (!result.isSuccess() && !result.stderr().contains("not found")) {
            throw new CommandException(cmd, result.exitCode(), "Failed to uninstall " + releaseName, result.stderr());
        }
    }

    @Override
    public void rollback(String releaseName, String namespace) {
        run(List.of(binary, "rollback", releaseName, "--namespace", namespace, "--wait"),
                SHORT_TIMEOUT.multipliedBy(5), "Failed to roll back " + releaseName);
    }

    @Override
    public Optional<VersionsNumber> installedVersion(String releaseName, String namespace) {
        CommandResult result = run(List.of(binary, "list", "--namespace", namespace,
                        "--filter", "^" + Pattern.quote(releaseName) + "$", "-o", "json"),
                SHORT_TIMEOUT, "Failed to list releases in " + namespace);
        try {
            JsonNode releases = objectMapper.readTree(result.stdout());
            for (JsonNode release : releases) {
                if (releaseName.equals(release.path("name").asText())) {
                    return parseChartVersion(release.path("chart").asText());
                }
            }
            return Optional.empty();
        } catch (IOException e) {
            throw new CommandException(List.of(binary, "list"), 0, "Unable to read helm release list", e.getMessage());
        }
    }

    static Optional<VersionsNumber> parseChartVersion(String chart) {
        Matcher m = CHART_VERSION.matcher(chart == null ? "" : chart);
        if (!m.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(VersionsNumber.parse(m.group(1)));
        } catch (IllegalArgumentException e) {
            log.debug("无法解析 chart 版本: {}", chart);
            return Optional.empty();
        }
    }

    private HelmDeploymentStatus parseStatus(String releaseName, String json) {
        try {
            JsonNode root = objectMapper.readTree(json);
            return HelmDeploymentStatus.of(
                    root.path("name").asText(releaseName),
                    root.path("version").asInt(0),
                    root.path("info").path("status").asText("unknown"));
        } catch (IOException e) {
            log.warn("无法解析 helm 输出，按已部署处理: release={}", releaseName);
            return HelmDeploymentStatus.of(releaseName, 0, "deployed");
        }
    }

    private CommandResult run(List<String> cmd, Duration timeout, String safeMessage) {
        CommandResult result = runner.run(cmd, environment(), null, timeout);
        if (!result.isSuccess()) {
            throw new CommandException(cmd, result.exitCode(), safeMessage, result.stderr());
        }
        return result;
    }

    private Map<String, String> environment() {
        return kubeconfig == null ? Map.of() : Map.of("KUBECONFIG", kubeconfig.toString());
    }
}
