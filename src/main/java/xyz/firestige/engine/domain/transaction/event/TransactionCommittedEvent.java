package xyz.firestige.engine.domain.transaction.event;

import xyz.firestige.engine.domain.transaction.TransactionStatus;

public class TransactionCommittedEvent extends TransactionStatusEvent {

    public TransactionCommittedEvent(String transactionId) {
        super(transactionId, TransactionStatus.COMMITTED, "事务已提交");
    }
}
