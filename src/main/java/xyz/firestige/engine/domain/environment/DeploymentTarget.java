package xyz.firestige.engine.domain.environment;

import xyz.firestige.engine.domain.cluster.KubernetesCluster;

import java.util.Objects;

/**
 * 部署目标：集群句柄 + 环境句柄
 */
public final class DeploymentTarget {

    private final TargetKind kind;
    private final KubernetesCluster cluster;
    private final Environment environment;
    private final EngineContext engineContext;

    private DeploymentTarget(TargetKind kind, KubernetesCluster cluster, Environment environment, EngineContext engineContext) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.cluster = Objects.requireNonNull(cluster, "cluster");
        this.environment = Objects.requireNonNull(environment, "environment");
        this.engineContext = Objects.requireNonNull(engineContext, "engineContext");
    }

    public static DeploymentTarget managedServices(KubernetesCluster cluster, Environment environment, EngineContext engineContext) {
        return new DeploymentTarget(TargetKind.MANAGED_SERVICES, cluster, environment, engineContext);
    }

    public static DeploymentTarget selfHosted(KubernetesCluster cluster, Environment environment, EngineContext engineContext) {
        return new DeploymentTarget(TargetKind.SELF_HOSTED, cluster, environment, engineContext);
    }

    /**
     * 生产环境使用托管数据库，其余自建
     */
    public static DeploymentTarget forEnvironment(KubernetesCluster cluster, Environment environment, EngineContext engineContext) {
        return environment.isProduction()
                ? managedServices(cluster, environment, engineContext)
                : selfHosted(cluster, environment, engineContext);
    }

    /**
     * 同一集群、同一类型下切换到另一个环境，用于故障切换
     */
    public DeploymentTarget withEnvironment(Environment other) {
        return new DeploymentTarget(kind, cluster, other, engineContext);
    }

    public TargetKind getKind() {
        return kind;
    }

    public KubernetesCluster getCluster() {
        return cluster;
    }

    public Environment getEnvironment() {
        return environment;
    }

    public EngineContext getEngineContext() {
        return engineContext;
    }

    @Override
    public String toString() {
        return "DeploymentTarget{" + kind + ", cluster=" + cluster.getId() + ", environment=" + environment.getId() + "}";
    }
}
