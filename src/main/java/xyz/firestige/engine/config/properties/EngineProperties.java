package xyz.firestige.engine.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 部署引擎配置
 * prefix: engine
 */
@ConfigurationProperties(prefix = "engine")
@Validated
public class EngineProperties {

    /** 每次执行的工作目录根，按 executionId 隔离 */
    @NotNull
    private Path workspaceRoot = Path.of(System.getProperty("java.io.tmpdir"), "cloud-deploy-engine");
    /** chart 与服务模板所在目录 */
    @NotNull
    private Path libRoot = Path.of("lib");
    /** 测试集群会缩小部分组件的副本数 */
    private boolean testCluster = false;

    @Valid
    @NotNull
    private Readiness readiness = new Readiness();
    @Valid
    @NotNull
    private ServiceProperties service = new ServiceProperties();
    @Valid
    @NotNull
    private Heartbeat heartbeat = new Heartbeat();
    @Valid
    @NotNull
    private Charts charts = new Charts();
    @Valid
    @NotNull
    private Commands commands = new Commands();

    // ========== Readiness ==========
    public static class Readiness {
        @Valid
        @NotNull
        private Probe cname = new Probe(Duration.ofSeconds(5), 30);
        @Valid
        @NotNull
        private Probe domain = new Probe(Duration.ofSeconds(3), 100);
        /** 单次 DNS 查询超时 */
        @NotNull
        private Duration lookupTimeout = Duration.ofSeconds(2);
        /** 轮询使用的解析器，server 为空表示系统解析器 */
        @Valid
        @NotEmpty
        private List<Resolver> resolvers = new ArrayList<>(List.of(
                new Resolver("google", "8.8.8.8"),
                new Resolver("cloudflare", "1.1.1.1"),
                new Resolver("quad9", "9.9.9.9"),
                new Resolver("system", null)));

        public Probe getCname() { return cname; }
        public void setCname(Probe cname) { this.cname = cname; }
        public Probe getDomain() { return domain; }
        public void setDomain(Probe domain) { this.domain = domain; }
        public Duration getLookupTimeout() { return lookupTimeout; }
        public void setLookupTimeout(Duration lookupTimeout) { this.lookupTimeout = lookupTimeout; }
        public List<Resolver> getResolvers() { return resolvers; }
        public void setResolvers(List<Resolver> resolvers) { this.resolvers = resolvers; }
    }

    public static class Probe {
        @NotNull
        private Duration interval;
        @Min(1)
        private int maxAttempts;

        public Probe() {
        }

        public Probe(Duration interval, int maxAttempts) {
            this.interval = interval;
            this.maxAttempts = maxAttempts;
        }

        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    }

    public static class Resolver {
        @NotBlank
        private String name;
        private String server;

        public Resolver() {
        }

        public Resolver(String name, String server) {
            this.name = name;
            this.server = server;
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getServer() { return server; }
        public void setServer(String server) { this.server = server; }
    }

    // ========== Service ==========
    public static class ServiceProperties {
        @NotNull
        private Duration startTimeoutMargin = Duration.ofSeconds(10);
        @Min(1)
        private int startTimeoutMultiplier = 4;
        /** pod 就绪轮询间隔 */
        @NotNull
        private Duration readinessPollInterval = Duration.ofSeconds(5);

        public Duration getStartTimeoutMargin() { return startTimeoutMargin; }
        public void setStartTimeoutMargin(Duration startTimeoutMargin) { this.startTimeoutMargin = startTimeoutMargin; }
        public int getStartTimeoutMultiplier() { return startTimeoutMultiplier; }
        public void setStartTimeoutMultiplier(int startTimeoutMultiplier) { this.startTimeoutMultiplier = startTimeoutMultiplier; }
        public Duration getReadinessPollInterval() { return readinessPollInterval; }
        public void setReadinessPollInterval(Duration readinessPollInterval) { this.readinessPollInterval = readinessPollInterval; }
    }

    // ========== Heartbeat ==========
    public static class Heartbeat {
        private boolean enabled = true;
        @NotNull
        private Duration interval = Duration.ofSeconds(10);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }
    }

    // ========== Charts ==========
    public static class Charts {
        /** 同一层级内并行安装的 chart 数，1 表示串行 */
        @Min(1)
        private int levelParallelism = 1;

        public int getLevelParallelism() { return levelParallelism; }
        public void setLevelParallelism(int levelParallelism) { this.levelParallelism = levelParallelism; }
    }

    // ========== Commands ==========
    public static class Commands {
        @NotBlank
        private String helmBinary = "helm";
        @NotBlank
        private String kubectlBinary = "kubectl";
        /** 进程超时 = chart 超时 + buffer */
        @NotNull
        private Duration timeoutBuffer = Duration.ofSeconds(30);

        public String getHelmBinary() { return helmBinary; }
        public void setHelmBinary(String helmBinary) { this.helmBinary = helmBinary; }
        public String getKubectlBinary() { return kubectlBinary; }
        public void setKubectlBinary(String kubectlBinary) { this.kubectlBinary = kubectlBinary; }
        public Duration getTimeoutBuffer() { return timeoutBuffer; }
        public void setTimeoutBuffer(Duration timeoutBuffer) { this.timeoutBuffer = timeoutBuffer; }
    }

    public Path getWorkspaceRoot() { return workspaceRoot; }
    public void setWorkspaceRoot(Path workspaceRoot) { this.workspaceRoot = workspaceRoot; }
    public Path getLibRoot() { return libRoot; }
    public void setLibRoot(Path libRoot) { this.libRoot = libRoot; }
    public boolean isTestCluster() { return testCluster; }
    public void setTestCluster(boolean testCluster) { this.testCluster = testCluster; }
    public Readiness getReadiness() { return readiness; }
    public void setReadiness(Readiness readiness) { this.readiness = readiness; }
    public ServiceProperties getService() { return service; }
    public void setService(ServiceProperties service) { this.service = service; }
    public Heartbeat getHeartbeat() { return heartbeat; }
    public void setHeartbeat(Heartbeat heartbeat) { this.heartbeat = heartbeat; }
    public Charts getCharts() { return charts; }
    public void setCharts(Charts charts) { this.charts = charts; }
    public Commands getCommands() { return commands; }
    public void setCommands(Commands commands) { this.commands = commands; }
}
