package xyz.firestige.engine.domain.service;

/**
 * 服务动作
 * <p>
 * CREATE / PAUSE / DELETE 所有服务都支持；其余动作按服务能力开放，
 * 不支持时返回 NOT_IMPLEMENTED，且编排器绝不会自动触发它们。
 */
public enum Action {
    CREATE,
    PAUSE,
    DELETE,
    UPGRADE,
    DOWNGRADE,
    BACKUP,
    RESTORE,
    CLONE;

    public boolean isCapabilityGated() {
        return switch (this) {
            case CREATE, PAUSE, DELETE -> false;
            default -> true;
        };
    }

    public String displayName() {
        return name().toLowerCase();
    }
}
