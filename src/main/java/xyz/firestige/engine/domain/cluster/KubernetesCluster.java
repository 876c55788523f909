package xyz.firestige.engine.domain.cluster;

import java.nio.file.Path;
import java.util.Objects;

/**
 * 集群句柄
 * <p>
 * 集群状态以集群自身为准，这里只保存访问方式，不缓存任何运行态信息。
 */
public final class KubernetesCluster {

    private final String id;
    private final String name;
    private final String region;
    private final Path kubeconfig;
    private final String dnsDomain;
    private final CloudProviderSettings provider;
    private final HelmClient helm;
    private final KubectlClient kubectl;

    private KubernetesCluster(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        this.name = builder.name == null ? builder.id : builder.name;
        this.region = builder.region;
        this.kubeconfig = builder.kubeconfig;
        this.dnsDomain = builder.dnsDomain;
        this.provider = Objects.requireNonNull(builder.provider, "provider");
        this.helm = Objects.requireNonNull(builder.helm, "helm");
        this.kubectl = Objects.requireNonNull(builder.kubectl, "kubectl");
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getRegion() {
        return region;
    }

    public Path getKubeconfig() {
        return kubeconfig;
    }

    public String getDnsDomain() {
        return dnsDomain;
    }

    public CloudProviderSettings getProvider() {
        return provider;
    }

    public HelmClient getHelm() {
        return helm;
    }

    public KubectlClient getKubectl() {
        return kubectl;
    }

    @Override
    public String toString() {
        return "KubernetesCluster{" + id + ", provider=" + provider + ", region=" + region + "}";
    }

    public static final class Builder {
        private final String id;
        private String name;
        private String region;
        private Path kubeconfig;
        private String dnsDomain;
        private CloudProviderSettings provider;
        private HelmClient helm;
        private KubectlClient kubectl;

        private Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Builder kubeconfig(Path kubeconfig) {
            this.kubeconfig = kubeconfig;
            return this;
        }

        public Builder dnsDomain(String dnsDomain) {
            this.dnsDomain = dnsDomain;
            return this;
        }

        public Builder provider(CloudProviderSettings provider) {
            this.provider = provider;
            return this;
        }

        public Builder helm(HelmClient helm) {
            this.helm = helm;
            return this;
        }

        public Builder kubectl(KubectlClient kubectl) {
            this.kubectl = kubectl;
            return this;
        }

        public KubernetesCluster build() {
            return new KubernetesCluster(this);
        }
    }
}
