package xyz.firestige.engine.domain.service;

import xyz.firestige.engine.domain.cluster.WorkloadKind;
import xyz.firestige.engine.domain.environment.DeploymentTarget;
import xyz.firestige.engine.domain.shared.exception.EngineException;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 无状态应用
 * <p>
 * 有持久卷时以 StatefulSet 运行，否则以 Deployment 运行；暂停即缩容到 0。
 */
public final class Application extends AbstractService {

    static final String CHART_DIRECTORY = "common/charts/application";

    private final String image;
    private final List<StorageVolume> storage;
    private final Map<String, String> environmentVariables;

    private Application(Builder b) {
        super(b.id, b.name, b.action, b.sizing, b.privatePort, b.version, b.startTimeoutBase, b.startTimeoutPolicy);
        this.image = b.image;
        this.storage = List.copyOf(b.storage);
        this.environmentVariables = Map.copyOf(b.environmentVariables);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    @Override
    protected String namePrefix() {
        return "app";
    }

    @Override
    public ServiceType getType() {
        return ServiceType.APPLICATION;
    }

    public String getImage() {
        return image;
    }

    public List<StorageVolume> getStorage() {
        return storage;
    }

    public boolean hasStorage() {
        return !storage.isEmpty();
    }

    public WorkloadKind workloadKind() {
        return hasStorage() ? WorkloadKind.STATEFUL_SET : WorkloadKind.DEPLOYMENT;
    }

    @Override
    public Optional<String> podSelector(DeploymentTarget target) {
        return Optional.of("appId=" + getId());
    }

    @Override
    public RenderContext renderContext(DeploymentTarget target) {
        RenderContext ctx = baseContext(target)
                .put("image", image)
                .put("workload_kind", workloadKind().getResourceName());
        List<Map<String, Object>> volumes = new ArrayList<>();
        for (StorageVolume v : storage) {
            Map<String, Object> volume = new LinkedHashMap<>();
            volume.put("id", v.id());
            volume.put("name", v.name());
            volume.put("size_in_gib", v.sizeGib());
            volume.put("mount_point", v.mountPoint());
            volumes.add(volume);
        }
        ctx.put("storage", volumes);
        List<Map<String, String>> env = new ArrayList<>();
        environmentVariables.forEach((k, v) -> env.add(Map.of("key", k, "value", v)));
        ctx.put("environment_variables", env);
        return ctx;
    }

    @Override
    public void onCreateCheck(DeploymentTarget target) {
        getSizing().validate(getName(), true);
        if (image == null || image.isBlank()) {
            throw EngineException.validation("Application " + getName() + " has no image to deploy");
        }
        getPrivatePort().ifPresent(port -> {
            if (port < 1 || port > 65535) {
                throw EngineException.validation("Application " + getName() + " private port " + port + " is out of range");
            }
        });
    }

    @Override
    public void onCreate(DeploymentTarget target) {
        Path templates = target.getEngineContext().getLibRoot().resolve(CHART_DIRECTORY);
        renderAndDeploy(target, templates);
    }

    @Override
    public void onCreateError(DeploymentTarget target) {
        rollbackRelease(target);
    }

    @Override
    public void onPauseCheck(DeploymentTarget target) {
        // 无
    }

    @Override
    public void onPause(DeploymentTarget target) {
        target.getCluster().getKubectl().scale(target.getEnvironment().getNamespace(), workloadKind(),
                podSelector(target).orElseThrow(), 0);
    }

    @Override
    public void onPauseError(DeploymentTarget target) {
        log.warn("应用暂停失败，保持当前副本数: service={}", getId());
    }

    @Override
    public void onDeleteCheck(DeploymentTarget target) {
        // 无
    }

    @Override
    public void onDelete(DeploymentTarget target) {
        uninstallRelease(target);
    }

    @Override
    public void onDeleteError(DeploymentTarget target) {
        // 再次尝试卸载，仍失败时由编排器记录
        log.warn("应用删除失败，重试卸载: service={}, release={}", getId(), getReleaseName());
        uninstallRelease(target);
    }

    public static final class Builder {
        private final String id;
        private String name;
        private Action action = Action.CREATE;
        private Sizing sizing = Sizing.single("500m", 512);
        private Integer privatePort;
        private String version;
        private Duration startTimeoutBase = Duration.ofSeconds(300);
        private StartTimeoutPolicy startTimeoutPolicy;
        private String image;
        private final List<StorageVolume> storage = new ArrayList<>();
        private final Map<String, String> environmentVariables = new LinkedHashMap<>();

        private Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder action(Action action) {
            this.action = action;
            return this;
        }

        public Builder sizing(Sizing sizing) {
            this.sizing = sizing;
            return this;
        }

        public Builder privatePort(Integer privatePort) {
            this.privatePort = privatePort;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder startTimeout(Duration base) {
            this.startTimeoutBase = base;
            return this;
        }

        public Builder startTimeoutPolicy(StartTimeoutPolicy policy) {
            this.startTimeoutPolicy = policy;
            return this;
        }

        public Builder image(String image) {
            this.image = image;
            return this;
        }

        public Builder storage(StorageVolume volume) {
            this.storage.add(volume);
            return this;
        }

        public Builder environmentVariable(String key, String value) {
            this.environmentVariables.put(key, value);
            return this;
        }

        public Application build() {
            return new Application(this);
        }
    }
}
