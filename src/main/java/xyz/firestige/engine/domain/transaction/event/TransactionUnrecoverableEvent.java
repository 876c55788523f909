package xyz.firestige.engine.domain.transaction.event;

import xyz.firestige.engine.domain.shared.event.WithFailureInfo;
import xyz.firestige.engine.domain.shared.exception.FailureInfo;
import xyz.firestige.engine.domain.transaction.TransactionStatus;

public class TransactionUnrecoverableEvent extends TransactionStatusEvent implements WithFailureInfo {

    private final String serviceId;
    private final FailureInfo failureInfo;

    public TransactionUnrecoverableEvent(String transactionId, String serviceId, FailureInfo failureInfo) {
        super(transactionId, TransactionStatus.UNRECOVERABLE, "事务不可恢复: " + failureInfo.getSafeMessage());
        this.serviceId = serviceId;
        this.failureInfo = failureInfo;
    }

    public String getServiceId() {
        return serviceId;
    }

    @Override
    public FailureInfo getFailureInfo() {
        return failureInfo;
    }
}
