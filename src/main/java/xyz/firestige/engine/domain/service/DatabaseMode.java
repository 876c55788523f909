package xyz.firestige.engine.domain.service;

import xyz.firestige.engine.domain.environment.TargetKind;

/**
 * 数据库部署模式
 */
public enum DatabaseMode {

    /**
     * 云厂商托管
     */
    MANAGED,

    /**
     * 集群内自建
     */
    CONTAINER;

    public static DatabaseMode forTarget(TargetKind kind) {
        return kind == TargetKind.MANAGED_SERVICES ? MANAGED : CONTAINER;
    }
}
