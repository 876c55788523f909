package xyz.firestige.engine.domain.transaction;

import org.junit.jupiter.api.Test;
import xyz.firestige.engine.domain.shared.exception.ErrorType;
import xyz.firestige.engine.domain.shared.exception.FailureInfo;
import xyz.firestige.engine.domain.shared.exception.StateTransitionException;
import xyz.firestige.engine.domain.transaction.event.TransactionCommittedEvent;
import xyz.firestige.engine.domain.transaction.event.TransactionStartedEvent;
import xyz.firestige.engine.domain.transaction.event.TransactionUnrecoverableEvent;
import xyz.firestige.engine.testutil.RecordingEventPublisher;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransactionStateMachineTest {

    private final RecordingEventPublisher publisher = new RecordingEventPublisher();
    private final TransactionStateMachine machine = new TransactionStateMachine("tx-1", publisher);

    @Test
    void commitPath() {
        machine.start(3);
        machine.complete(TransactionResult.ok());

        assertThat(machine.getStatus()).isEqualTo(TransactionStatus.COMMITTED);
        assertThat(publisher.getEvents()).hasSize(2);
        assertThat(publisher.getEventsOfType(TransactionStartedEvent.class).get(0).getStepCount()).isEqualTo(3);
        assertThat(publisher.getEventsOfType(TransactionCommittedEvent.class)).hasSize(1);
    }

    @Test
    void unrecoverableCarriesServiceId() {
        machine.start(1);
        machine.complete(TransactionResult.unrecoverable("db-1",
                FailureInfo.of(ErrorType.EXECUTION_ERROR, "failover failed")));

        assertThat(machine.getStatus()).isEqualTo(TransactionStatus.UNRECOVERABLE);
        TransactionUnrecoverableEvent event = publisher.getEventsOfType(TransactionUnrecoverableEvent.class).get(0);
        assertThat(event.getServiceId()).isEqualTo("db-1");
        assertThat(event.getFailureInfo().getSafeMessage()).isEqualTo("failover failed");
    }

    @Test
    void completeBeforeStartIsRejected() {
        assertThatThrownBy(() -> machine.complete(TransactionResult.ok()))
                .isInstanceOf(StateTransitionException.class);
        assertThat(machine.getStatus()).isEqualTo(TransactionStatus.PENDING);
    }

    @Test
    void terminalStatesAreFinal() {
        machine.start(1);
        machine.complete(TransactionResult.rollback(FailureInfo.of(ErrorType.TIMEOUT_ERROR, "timeout")));

        assertThat(machine.getStatus()).isEqualTo(TransactionStatus.ROLLED_BACK);
        assertThat(TransactionStatus.ROLLED_BACK.isTerminal()).isTrue();
        assertThatThrownBy(() -> machine.start(1)).isInstanceOf(StateTransitionException.class);
    }
}
