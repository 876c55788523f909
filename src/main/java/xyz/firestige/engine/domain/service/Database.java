package xyz.firestige.engine.domain.service;

import xyz.firestige.engine.domain.cluster.WorkloadKind;
import xyz.firestige.engine.domain.environment.DeploymentTarget;
import xyz.firestige.engine.domain.shared.exception.EngineException;
import xyz.firestige.engine.domain.version.SupportedVersionLookup;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * 数据库
 * <p>
 * 托管还是自建由部署目标决定；版本由 {@link SupportedVersionLookup} 解析。
 * 失败清理不做破坏性操作，数据保留给人工处理。
 */
public final class Database extends AbstractService {

    private final DatabaseType databaseType;
    private final String login;
    private final String password;
    private final int diskSizeGib;
    private final boolean publiclyAccessible;
    private final SupportedVersionLookup versionLookup;

    private Database(Builder b) {
        super(b.id, b.name, b.action, b.sizing, b.port == null ? b.databaseType.getDefaultPort() : b.port,
                b.version, b.startTimeoutBase, b.startTimeoutPolicy);
        this.databaseType = Objects.requireNonNull(b.databaseType, "databaseType");
        this.login = b.login;
        this.password = b.password;
        this.diskSizeGib = b.diskSizeGib;
        this.publiclyAccessible = b.publiclyAccessible;
        this.versionLookup = Objects.requireNonNull(b.versionLookup, "versionLookup");
    }

    public static Builder builder(String id, DatabaseType type) {
        return new Builder(id, type);
    }

    @Override
    protected String namePrefix() {
        return databaseType.getDirectoryName();
    }

    @Override
    public ServiceType getType() {
        return ServiceType.DATABASE;
    }

    public DatabaseType getDatabaseType() {
        return databaseType;
    }

    public DatabaseMode mode(DeploymentTarget target) {
        return DatabaseMode.forTarget(target.getKind());
    }

    public String resolvedVersion(DeploymentTarget target) {
        return versionLookup.resolve(databaseType, mode(target), getVersion());
    }

    @Override
    public Optional<String> podSelector(DeploymentTarget target) {
        return mode(target) == DatabaseMode.CONTAINER ? Optional.of("databaseId=" + getId()) : Optional.empty();
    }

    @Override
    public RenderContext renderContext(DeploymentTarget target) {
        return baseContext(target)
                .put("database_type", databaseType.getDirectoryName())
                .put("database_mode", mode(target).name().toLowerCase())
                .put("version", resolvedVersion(target))
                .put("database_login", login)
                .put("database_password", password)
                .put("database_port", getPrivatePort().orElse(databaseType.getDefaultPort()))
                .put("database_disk_size_in_gib", diskSizeGib)
                .put("publicly_accessible", publiclyAccessible);
    }

    @Override
    public void onCreateCheck(DeploymentTarget target) {
        getSizing().validate(getName(), false);
        if (getVersion() == null || getVersion().isBlank()) {
            throw EngineException.validation(databaseType.getDisplayName() + " " + getName() + " has no version");
        }
        if (diskSizeGib <= 0) {
            throw EngineException.validation(databaseType.getDisplayName() + " " + getName() + " disk size must be greater than 0");
        }
        String resolved = resolvedVersion(target);
        log.info("数据库版本解析: service={}, requested={}, resolved={}, mode={}", getId(), getVersion(), resolved, mode(target));
    }

    @Override
    public void onCreate(DeploymentTarget target) {
        renderAndDeploy(target, templateDirectory(target));
    }

    @Override
    public void onCreateError(DeploymentTarget target) {
        log.warn("数据库创建失败，保留现有数据不做回滚: service={}", getId());
    }

    @Override
    public void onPauseCheck(DeploymentTarget target) {
        // 无
    }

    @Override
    public void onPause(DeploymentTarget target) {
        if (mode(target) == DatabaseMode.MANAGED) {
            log.info("托管数据库不支持暂停，保持运行: service={}", getId());
            return;
        }
        target.getCluster().getKubectl().scale(target.getEnvironment().getNamespace(), WorkloadKind.STATEFUL_SET,
                podSelector(target).orElseThrow(), 0);
    }

    @Override
    public void onPauseError(DeploymentTarget target) {
        log.warn("数据库暂停失败: service={}", getId());
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
        log.warn("数据库删除失败，资源可能残留: service={}, release={}", getId(), getReleaseName());
    }

    /**
     * 托管：&lt;lib&gt;/&lt;provider&gt;/services/&lt;type&gt;；自建：&lt;lib&gt;/common/services/&lt;type&gt;
     */
    Path templateDirectory(DeploymentTarget target) {
        String root = mode(target) == DatabaseMode.MANAGED
                ? target.getCluster().getProvider().getLibDirectoryName()
                : "common";
        return target.getEngineContext().getLibRoot()
                .resolve(root)
                .resolve("services")
                .resolve(databaseType.getDirectoryName());
    }

    @Override
    public String toString() {
        return "Database{id=" + getId() + ", type=" + databaseType + ", version=" + getVersion() + ", action=" + getAction() + "}";
    }

    public static final class Builder {
        private final String id;
        private final DatabaseType databaseType;
        private String name;
        private Action action = Action.CREATE;
        private Sizing sizing = Sizing.single("250m", 256);
        private Integer port;
        private String version;
        private Duration startTimeoutBase = Duration.ofSeconds(300);
        private StartTimeoutPolicy startTimeoutPolicy;
        private String login = "superuser";
        private String password;
        private int diskSizeGib = 10;
        private boolean publiclyAccessible;
        private SupportedVersionLookup versionLookup;

        private Builder(String id, DatabaseType databaseType) {
            this.id = id;
            this.databaseType = databaseType;
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

        public Builder port(Integer port) {
            this.port = port;
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

        public Builder credentials(String login, String password) {
            this.login = login;
            this.password = password;
            return this;
        }

        public Builder diskSizeGib(int diskSizeGib) {
            this.diskSizeGib = diskSizeGib;
            return this;
        }

        public Builder publiclyAccessible(boolean publiclyAccessible) {
            this.publiclyAccessible = publiclyAccessible;
            return this;
        }

        public Builder versionLookup(SupportedVersionLookup versionLookup) {
            this.versionLookup = versionLookup;
            return this;
        }

        public Database build() {
            return new Database(this);
        }
    }
}
