package xyz.firestige.engine.domain.transaction.event;

import xyz.firestige.engine.domain.shared.event.DomainEvent;
import xyz.firestige.engine.domain.transaction.TransactionStatus;

/**
 * 事务状态事件基类
 */
public abstract class TransactionStatusEvent extends DomainEvent {

    private final String transactionId;
    private final TransactionStatus status;

    protected TransactionStatusEvent(String transactionId, TransactionStatus status, String message) {
        super(message);
        this.transactionId = transactionId;
        this.status = status;
    }

    public String getTransactionId() {
        return transactionId;
    }

    public TransactionStatus getStatus() {
        return status;
    }

    @Override
    public String toString() {
        return getEventName() + "{transactionId=" + transactionId + ", status=" + status + ", message=" + getMessage() + "}";
    }
}
