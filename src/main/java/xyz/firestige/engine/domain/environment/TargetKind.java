package xyz.firestige.engine.domain.environment;

/**
 * 数据库由云厂商托管还是在集群内自建
 */
public enum TargetKind {
    MANAGED_SERVICES,
    SELF_HOSTED
}
