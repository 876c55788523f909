package xyz.firestige.engine.domain.transaction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.engine.domain.shared.event.DomainEventPublisher;
import xyz.firestige.engine.domain.shared.exception.StateTransitionException;
import xyz.firestige.engine.domain.transaction.event.TransactionCommittedEvent;
import xyz.firestige.engine.domain.transaction.event.TransactionRolledBackEvent;
import xyz.firestige.engine.domain.transaction.event.TransactionStartedEvent;
import xyz.firestige.engine.domain.transaction.event.TransactionUnrecoverableEvent;

/**
 * 事务状态机：校验状态转换并发布状态事件
 */
public class TransactionStateMachine {

    private static final Logger log = LoggerFactory.getLogger(TransactionStateMachine.class);

    private final String transactionId;
    private final DomainEventPublisher eventPublisher;
    private volatile TransactionStatus status = TransactionStatus.PENDING;

    public TransactionStateMachine(String transactionId, DomainEventPublisher eventPublisher) {
        this.transactionId = transactionId;
        this.eventPublisher = eventPublisher;
    }

    public TransactionStatus getStatus() {
        return status;
    }

    public synchronized void start(int stepCount) {
        transition(TransactionStatus.EXECUTING);
        eventPublisher.publish(new TransactionStartedEvent(transactionId, stepCount));
    }

    /**
     * 根据结果进入对应终态
     */
    public synchronized void complete(TransactionResult result) {
        transition(result.toStatus());
        switch (result.getKind()) {
            case OK -> eventPublisher.publish(new TransactionCommittedEvent(transactionId));
            case ROLLBACK -> eventPublisher.publish(
                    new TransactionRolledBackEvent(transactionId, result.getCause().orElseThrow()));
            case UNRECOVERABLE_ERROR -> eventPublisher.publish(new TransactionUnrecoverableEvent(
                    transactionId, result.getServiceId().orElse(null), result.getCause().orElseThrow()));
        }
    }

    private void transition(TransactionStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new StateTransitionException(status.name(), target.name());
        }
        log.debug("事务状态转换: transactionId={}, {} -> {}", transactionId, status, target);
        status = target;
    }
}
