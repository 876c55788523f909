package xyz.firestige.engine.domain.transaction;

import xyz.firestige.engine.domain.shared.exception.FailureInfo;

import java.util.Objects;
import java.util.Optional;

/**
 * 一次事务的最终结果：Ok、Rollback(cause) 或 UnrecoverableError(serviceId, cause)
 */
public final class TransactionResult {

    public enum Kind {
        OK,
        ROLLBACK,
        UNRECOVERABLE_ERROR
    }

    private static final TransactionResult OK = new TransactionResult(Kind.OK, null, null);

    private final Kind kind;
    private final String serviceId;
    private final FailureInfo cause;

    private TransactionResult(Kind kind, String serviceId, FailureInfo cause) {
        this.kind = kind;
        this.serviceId = serviceId;
        this.cause = cause;
    }

    public static TransactionResult ok() {
        return OK;
    }

    public static TransactionResult rollback(FailureInfo cause) {
        return new TransactionResult(Kind.ROLLBACK, null, Objects.requireNonNull(cause, "cause"));
    }

    /**
     * @param serviceId 失败的服务 ID，无具体服务时可为 null
     */
    public static TransactionResult unrecoverable(String serviceId, FailureInfo cause) {
        return new TransactionResult(Kind.UNRECOVERABLE_ERROR, serviceId, Objects.requireNonNull(cause, "cause"));
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isOk() {
        return kind == Kind.OK;
    }

    public boolean isRollback() {
        return kind == Kind.ROLLBACK;
    }

    public boolean isUnrecoverable() {
        return kind == Kind.UNRECOVERABLE_ERROR;
    }

    public Optional<String> getServiceId() {
        return Optional.ofNullable(serviceId);
    }

    public Optional<FailureInfo> getCause() {
        return Optional.ofNullable(cause);
    }

    public TransactionStatus toStatus() {
        return switch (kind) {
            case OK -> TransactionStatus.COMMITTED;
            case ROLLBACK -> TransactionStatus.ROLLED_BACK;
            case UNRECOVERABLE_ERROR -> TransactionStatus.UNRECOVERABLE;
        };
    }

    @Override
    public String toString() {
        return switch (kind) {
            case OK -> "Ok";
            case ROLLBACK -> "Rollback(" + cause.getSafeMessage() + ")";
            case UNRECOVERABLE_ERROR -> "UnrecoverableError(" + serviceId + ", " + cause.getSafeMessage() + ")";
        };
    }
}
