package xyz.firestige.engine.domain.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.engine.domain.chart.ChartInfo;
import xyz.firestige.engine.domain.cluster.HelmDeploymentStatus;
import xyz.firestige.engine.domain.cluster.KubernetesCluster;
import xyz.firestige.engine.domain.environment.DeploymentTarget;
import xyz.firestige.engine.domain.environment.EngineContext;
import xyz.firestige.engine.domain.environment.Environment;
import xyz.firestige.engine.domain.progress.ProgressListeners;
import xyz.firestige.engine.domain.shared.exception.EngineException;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 服务公共实现：身份、规格、渲染与 helm 发布
 */
public abstract class AbstractService implements Service {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final String id;
    private final String name;
    private final Action action;
    private final Sizing sizing;
    private final Integer privatePort;
    private final String version;
    private final Duration startTimeoutBase;
    private final StartTimeoutPolicy startTimeoutPolicy;
    private final ProgressListeners listeners = new ProgressListeners();

    AbstractService(String id, String name, Action action, Sizing sizing, Integer privatePort, String version,
                    Duration startTimeoutBase, StartTimeoutPolicy startTimeoutPolicy) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("service id must not be blank");
        }
        this.id = id;
        this.name = name == null || name.isBlank() ? id : name;
        this.action = Objects.requireNonNull(action, "action");
        this.sizing = Objects.requireNonNull(sizing, "sizing");
        this.privatePort = privatePort;
        this.version = version;
        this.startTimeoutBase = Objects.requireNonNull(startTimeoutBase, "startTimeoutBase");
        this.startTimeoutPolicy = startTimeoutPolicy == null ? StartTimeoutPolicy.DEFAULT : startTimeoutPolicy;
    }

    /**
     * 命名前缀，例如 "app"
     */
    protected abstract String namePrefix();

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getSanitizedName() {
        return ServiceNames.sanitize(namePrefix(), id);
    }

    @Override
    public String getReleaseName() {
        return ServiceNames.releaseName(getType().name(), name, id);
    }

    @Override
    public Action getAction() {
        return action;
    }

    @Override
    public Sizing getSizing() {
        return sizing;
    }

    @Override
    public Optional<Integer> getPrivatePort() {
        return Optional.ofNullable(privatePort);
    }

    @Override
    public String getVersion() {
        return version;
    }

    @Override
    public Duration getStartTimeout() {
        return startTimeoutPolicy.compute(startTimeoutBase);
    }

    @Override
    public ProgressListeners getListeners() {
        return listeners;
    }

    /**
     * 所有服务共享的上下文键
     */
    protected RenderContext baseContext(DeploymentTarget target) {
        Environment env = target.getEnvironment();
        KubernetesCluster cluster = target.getCluster();
        RenderContext ctx = new RenderContext()
                .put("id", id)
                .put("name", name)
                .put("sanitized_name", getSanitizedName())
                .put("release_name", getReleaseName())
                .put("namespace", env.getNamespace())
                .put("environment_id", env.getId())
                .put("project_id", env.getProjectId())
                .put("execution_id", env.getExecutionId().getValue())
                .put("cluster_id", cluster.getId())
                .put("region", cluster.getRegion())
                .put("cloud_provider", cluster.getProvider().getShortName())
                .put("version", version)
                .put("total_cpus", sizing.getCpuRequest())
                .put("cpu_burst", sizing.effectiveCpuBurst())
                .put("total_ram_in_mib", sizing.getRamMib())
                .put("min_instances", sizing.getMinInstances())
                .put("max_instances", sizing.getMaxInstances())
                .put("start_timeout_in_seconds", getStartTimeout().toSeconds())
                .put("is_test_cluster", target.getEngineContext().isTestCluster());
        getPrivatePort().ifPresent(port -> ctx.put("private_port", port));
        cluster.getProvider().getExtraSettings().forEach(ctx::put);
        return ctx;
    }

    /**
     * 渲染模板到本次执行的工作目录
     */
    protected Path render(DeploymentTarget target, Path templateDir) {
        EngineContext engine = target.getEngineContext();
        Path workspace = engine.workspaceDir(target.getEnvironment().getExecutionId(), getSanitizedName());
        return engine.getTemplateRenderer().render(templateDir, renderContext(target).asMap(), workspace);
    }

    /**
     * 渲染并通过 helm 发布，超时取启动超时
     */
    protected HelmDeploymentStatus renderAndDeploy(DeploymentTarget target, Path templateDir) {
        Path rendered = render(target, templateDir);
        ChartInfo chart = ChartInfo.builder(getReleaseName())
                .path(rendered.toString())
                .namespace(target.getEnvironment().getNamespace())
                .timeout(getStartTimeout())
                .build();
        HelmDeploymentStatus status = target.getCluster().getHelm().upgrade(chart, List.of());
        if (status != null && !status.isDeployed()) {
            throw EngineException.execution(
                    "Deployment of " + getType().name().toLowerCase() + " " + name + " did not complete",
                    "release " + status);
        }
        log.info("发布完成: service={}, release={}", id, status);
        return status;
    }

    protected void uninstallRelease(DeploymentTarget target) {
        target.getCluster().getHelm().uninstall(getReleaseName(), target.getEnvironment().getNamespace());
        log.info("已卸载: service={}, release={}", id, getReleaseName());
    }

    protected void rollbackRelease(DeploymentTarget target) {
        target.getCluster().getHelm().rollback(getReleaseName(), target.getEnvironment().getNamespace());
        log.info("已回滚: service={}, release={}", id, getReleaseName());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id=" + id + ", name=" + name + ", action=" + action + "}";
    }
}
