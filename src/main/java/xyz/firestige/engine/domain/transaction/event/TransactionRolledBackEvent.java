package xyz.firestige.engine.domain.transaction.event;

import xyz.firestige.engine.domain.shared.event.WithFailureInfo;
import xyz.firestige.engine.domain.shared.exception.FailureInfo;
import xyz.firestige.engine.domain.transaction.TransactionStatus;

public class TransactionRolledBackEvent extends TransactionStatusEvent implements WithFailureInfo {

    private final FailureInfo failureInfo;

    public TransactionRolledBackEvent(String transactionId, FailureInfo failureInfo) {
        super(transactionId, TransactionStatus.ROLLED_BACK, "事务已回滚: " + failureInfo.getSafeMessage());
        this.failureInfo = failureInfo;
    }

    @Override
    public FailureInfo getFailureInfo() {
        return failureInfo;
    }
}
