package xyz.firestige.engine.domain.transaction;

import java.util.EnumSet;
import java.util.Set;

/**
 * 事务状态
 * <p>
 * PENDING → EXECUTING → {COMMITTED, ROLLED_BACK, UNRECOVERABLE}
 */
public enum TransactionStatus {

    PENDING("待执行"),

    EXECUTING("执行中"),

    /**
     * 所有步骤成功（终态）
     */
    COMMITTED("已提交"),

    /**
     * 执行失败并完成补偿（终态）
     */
    ROLLED_BACK("已回滚"),

    /**
     * 无法自动恢复（终态）
     */
    UNRECOVERABLE("不可恢复");

    private final String description;

    TransactionStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTerminal() {
        return this == COMMITTED || this == ROLLED_BACK || this == UNRECOVERABLE;
    }

    public boolean canTransitionTo(TransactionStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<TransactionStatus> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(EXECUTING);
            case EXECUTING -> EnumSet.of(COMMITTED, ROLLED_BACK, UNRECOVERABLE);
            default -> EnumSet.noneOf(TransactionStatus.class);
        };
    }
}
