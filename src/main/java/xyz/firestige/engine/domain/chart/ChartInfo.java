package xyz.firestige.engine.domain.chart;

import xyz.firestige.engine.domain.version.VersionsNumber;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 可安装单元（helm chart）
 * <p>
 * name 同时作为 release 名称，在一次安装中唯一。
 */
public final class ChartInfo {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(300);

    private final String name;
    private final String path;
    private final String namespace;
    private final List<ChartSetValue> values;
    private final List<String> valuesFiles;
    private final VersionsNumber lastBreakingVersion;
    private final Duration timeout;
    private final ChartAction action;
    private final List<String> backupResources;
    private final boolean atomic;
    private final boolean waitForResources;

    private ChartInfo(Builder builder) {
        this.name = requireText(builder.name, "name");
        this.path = requireText(builder.path, "path");
        this.namespace = requireText(builder.namespace, "namespace");
        this.values = List.copyOf(builder.values);
        this.valuesFiles = List.copyOf(builder.valuesFiles);
        this.lastBreakingVersion = builder.lastBreakingVersion;
        this.timeout = Objects.requireNonNull(builder.timeout, "timeout");
        this.action = Objects.requireNonNull(builder.action, "action");
        this.backupResources = List.copyOf(builder.backupResources);
        this.atomic = builder.atomic;
        this.waitForResources = builder.waitForResources;
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("chart " + field + " must not be blank");
        }
        return value;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public Builder toBuilder() {
        Builder b = new Builder(name)
                .path(path)
                .namespace(namespace)
                .timeout(timeout)
                .action(action)
                .lastBreakingVersion(lastBreakingVersion)
                .atomic(atomic)
                .waitForResources(waitForResources);
        b.values.addAll(values);
        b.valuesFiles.addAll(valuesFiles);
        b.backupResources.addAll(backupResources);
        return b;
    }

    public String getName() {
        return name;
    }

    public String getPath() {
        return path;
    }

    public String getNamespace() {
        return namespace;
    }

    public List<ChartSetValue> getValues() {
        return values;
    }

    public List<String> getValuesFiles() {
        return valuesFiles;
    }

    public Optional<VersionsNumber> getLastBreakingVersion() {
        return Optional.ofNullable(lastBreakingVersion);
    }

    public Duration getTimeout() {
        return timeout;
    }

    public ChartAction getAction() {
        return action;
    }

    public List<String> getBackupResources() {
        return backupResources;
    }

    public boolean isAtomic() {
        return atomic;
    }

    public boolean isWaitForResources() {
        return waitForResources;
    }

    @Override
    public String toString() {
        return "ChartInfo{" + name + " -> " + namespace + ", action=" + action + ", timeout=" + timeout.toSeconds() + "s}";
    }

    public static final class Builder {
        private final String name;
        private String path;
        private String namespace = "default";
        private final List<ChartSetValue> values = new ArrayList<>();
        private final List<String> valuesFiles = new ArrayList<>();
        private VersionsNumber lastBreakingVersion;
        private Duration timeout = DEFAULT_TIMEOUT;
        private ChartAction action = ChartAction.INSTALL;
        private final List<String> backupResources = new ArrayList<>();
        private boolean atomic = true;
        private boolean waitForResources = true;

        private Builder(String name) {
            this.name = name;
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder namespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder value(String key, String value) {
            this.values.add(ChartSetValue.of(key, value));
            return this;
        }

        public Builder valuesFile(String valuesFile) {
            this.valuesFiles.add(valuesFile);
            return this;
        }

        public Builder lastBreakingVersion(VersionsNumber version) {
            this.lastBreakingVersion = version;
            return this;
        }

        public Builder lastBreakingVersion(String version) {
            this.lastBreakingVersion = version == null ? null : VersionsNumber.parse(version);
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder timeoutSeconds(long seconds) {
            this.timeout = Duration.ofSeconds(seconds);
            return this;
        }

        public Builder action(ChartAction action) {
            this.action = action;
            return this;
        }

        public Builder backupResource(String resource) {
            this.backupResources.add(resource);
            return this;
        }

        public Builder atomic(boolean atomic) {
            this.atomic = atomic;
            return this;
        }

        public Builder waitForResources(boolean waitForResources) {
            this.waitForResources = waitForResources;
            return this;
        }

        public ChartInfo build() {
            return new ChartInfo(this);
        }
    }
}
