package xyz.firestige.engine.domain.transaction.event;

import xyz.firestige.engine.domain.transaction.TransactionStatus;

public class TransactionStartedEvent extends TransactionStatusEvent {

    private final int stepCount;

    public TransactionStartedEvent(String transactionId, int stepCount) {
        super(transactionId, TransactionStatus.EXECUTING, "事务开始执行，共 " + stepCount + " 个步骤");
        this.stepCount = stepCount;
    }

    public int getStepCount() {
        return stepCount;
    }
}
