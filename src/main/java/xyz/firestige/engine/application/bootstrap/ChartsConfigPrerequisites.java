package xyz.firestige.engine.application.bootstrap;

import java.util.List;
import java.util.Objects;

/**
 * 集群基础组件安装所需的配置与特性开关
 */
public final class ChartsConfigPrerequisites {

    private final String organizationId;
    private final String clusterId;
    private final String clusterName;
    private final String region;
    private final String cloudProvider;
    private final boolean testCluster;
    private final EngineLocation engineLocation;
    private final boolean logHistoryEnabled;
    private final boolean metricsHistoryEnabled;
    private final boolean lifecycleDaemonDisabled;
    private final String managedDnsName;
    private final List<String> managedDnsResolvers;
    private final String externalDnsProvider;
    private final String dnsProviderEmail;
    private final String dnsProviderApiToken;
    private final String acmeEmail;
    private final String acmeUrl;
    private final String agentVersion;
    private final String engineVersion;
    private final String registrySecretName;

    private ChartsConfigPrerequisites(Builder b) {
        this.organizationId = Objects.requireNonNull(b.organizationId, "organizationId");
        this.clusterId = Objects.requireNonNull(b.clusterId, "clusterId");
        this.clusterName = b.clusterName == null ? b.clusterId : b.clusterName;
        this.region = b.region;
        this.cloudProvider = b.cloudProvider;
        this.testCluster = b.testCluster;
        this.engineLocation = b.engineLocation;
        this.logHistoryEnabled = b.logHistoryEnabled;
        this.metricsHistoryEnabled = b.metricsHistoryEnabled;
        this.lifecycleDaemonDisabled = b.lifecycleDaemonDisabled;
        this.managedDnsName = b.managedDnsName;
        this.managedDnsResolvers = List.copyOf(b.managedDnsResolvers);
        this.externalDnsProvider = b.externalDnsProvider;
        this.dnsProviderEmail = b.dnsProviderEmail;
        this.dnsProviderApiToken = b.dnsProviderApiToken;
        this.acmeEmail = b.acmeEmail;
        this.acmeUrl = b.acmeUrl;
        this.agentVersion = b.agentVersion;
        this.engineVersion = b.engineVersion;
        this.registrySecretName = b.registrySecretName;
    }

    public static Builder builder(String organizationId, String clusterId) {
        return new Builder(organizationId, clusterId);
    }

    public Builder toBuilder() {
        return new Builder(organizationId, clusterId)
                .clusterName(clusterName)
                .region(region)
                .cloudProvider(cloudProvider)
                .testCluster(testCluster)
                .engineLocation(engineLocation)
                .logHistoryEnabled(logHistoryEnabled)
                .metricsHistoryEnabled(metricsHistoryEnabled)
                .lifecycleDaemonDisabled(lifecycleDaemonDisabled)
                .managedDns(managedDnsName, managedDnsResolvers)
                .externalDns(externalDnsProvider, dnsProviderEmail, dnsProviderApiToken)
                .acme(acmeEmail, acmeUrl)
                .agentVersion(agentVersion)
                .engineVersion(engineVersion)
                .registrySecretName(registrySecretName);
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public String getClusterId() {
        return clusterId;
    }

    public String getClusterName() {
        return clusterName;
    }

    public String getRegion() {
        return region;
    }

    public String getCloudProvider() {
        return cloudProvider;
    }

    public boolean isTestCluster() {
        return testCluster;
    }

    public EngineLocation getEngineLocation() {
        return engineLocation;
    }

    public boolean isLogHistoryEnabled() {
        return logHistoryEnabled;
    }

    public boolean isMetricsHistoryEnabled() {
        return metricsHistoryEnabled;
    }

    public boolean isLifecycleDaemonDisabled() {
        return lifecycleDaemonDisabled;
    }

    public String getManagedDnsName() {
        return managedDnsName;
    }

    public List<String> getManagedDnsResolvers() {
        return managedDnsResolvers;
    }

    public String getExternalDnsProvider() {
        return externalDnsProvider;
    }

    public String getDnsProviderEmail() {
        return dnsProviderEmail;
    }

    public String getDnsProviderApiToken() {
        return dnsProviderApiToken;
    }

    public String getAcmeEmail() {
        return acmeEmail;
    }

    public String getAcmeUrl() {
        return acmeUrl;
    }

    public String getAgentVersion() {
        return agentVersion;
    }

    public String getEngineVersion() {
        return engineVersion;
    }

    public String getRegistrySecretName() {
        return registrySecretName;
    }

    public static final class Builder {
        private final String organizationId;
        private final String clusterId;
        private String clusterName;
        private String region = "";
        private String cloudProvider = "";
        private boolean testCluster;
        private EngineLocation engineLocation = EngineLocation.HOSTED;
        private boolean logHistoryEnabled;
        private boolean metricsHistoryEnabled;
        private boolean lifecycleDaemonDisabled;
        private String managedDnsName = "";
        private List<String> managedDnsResolvers = List.of();
        private String externalDnsProvider = "cloudflare";
        private String dnsProviderEmail = "";
        private String dnsProviderApiToken = "";
        private String acmeEmail = "";
        private String acmeUrl = "https://acme-v02.api.letsencrypt.org/directory";
        private String agentVersion = "latest";
        private String engineVersion = "latest";
        private String registrySecretName = "container-registry-secret";

        private Builder(String organizationId, String clusterId) {
            this.organizationId = organizationId;
            this.clusterId = clusterId;
        }

        public Builder clusterName(String clusterName) {
            this.clusterName = clusterName;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Builder cloudProvider(String cloudProvider) {
            this.cloudProvider = cloudProvider;
            return this;
        }

        public Builder testCluster(boolean testCluster) {
            this.testCluster = testCluster;
            return this;
        }

        public Builder engineLocation(EngineLocation engineLocation) {
            this.engineLocation = engineLocation;
            return this;
        }

        public Builder logHistoryEnabled(boolean enabled) {
            this.logHistoryEnabled = enabled;
            return this;
        }

        public Builder metricsHistoryEnabled(boolean enabled) {
            this.metricsHistoryEnabled = enabled;
            return this;
        }

        public Builder lifecycleDaemonDisabled(boolean disabled) {
            this.lifecycleDaemonDisabled = disabled;
            return this;
        }

        public Builder managedDns(String name, List<String> resolvers) {
            this.managedDnsName = name;
            this.managedDnsResolvers = resolvers;
            return this;
        }

        public Builder externalDns(String provider, String email, String apiToken) {
            this.externalDnsProvider = provider;
            this.dnsProviderEmail = email;
            this.dnsProviderApiToken = apiToken;
            return this;
        }

        public Builder acme(String email, String url) {
            this.acmeEmail = email;
            this.acmeUrl = url;
            return this;
        }

        public Builder agentVersion(String agentVersion) {
            this.agentVersion = agentVersion;
            return this;
        }

        public Builder engineVersion(String engineVersion) {
            this.engineVersion = engineVersion;
            return this;
        }

        public Builder registrySecretName(String registrySecretName) {
            this.registrySecretName = registrySecretName;
            return this;
        }

        public ChartsConfigPrerequisites build() {
            return new ChartsConfigPrerequisites(this);
        }
    }
}
