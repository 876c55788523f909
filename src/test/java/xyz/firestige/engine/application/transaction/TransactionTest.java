package xyz.firestige.engine.application.transaction;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import xyz.firestige.engine.application.bootstrap.ChartsConfigPrerequisites;
import xyz.firestige.engine.application.bootstrap.ClusterBootstrapService;
import xyz.firestige.engine.domain.cluster.KubernetesCluster;
import xyz.firestige.engine.domain.environment.DeploymentTarget;
import xyz.firestige.engine.domain.environment.Environment;
import xyz.firestige.engine.domain.environment.EnvironmentAction;
import xyz.firestige.engine.domain.shared.exception.EngineException;
import xyz.firestige.engine.domain.shared.exception.ErrorType;
import xyz.firestige.engine.domain.shared.vo.ExecutionId;
import xyz.firestige.engine.domain.transaction.TransactionResult;
import xyz.firestige.engine.domain.transaction.TransactionStatus;
import xyz.firestige.engine.domain.transaction.event.TransactionCommittedEvent;
import xyz.firestige.engine.domain.transaction.event.TransactionRolledBackEvent;
import xyz.firestige.engine.domain.transaction.event.TransactionStartedEvent;
import xyz.firestige.engine.domain.transaction.event.TransactionUnrecoverableEvent;
import xyz.firestige.engine.testutil.EngineFixtures;
import xyz.firestige.engine.testutil.FakeSleeper;
import xyz.firestige.engine.testutil.HookJournal;
import xyz.firestige.engine.testutil.RecordingEventPublisher;
import xyz.firestige.engine.testutil.RecordingService;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TransactionTest {

    @TempDir
    Path workspace;

    @Mock
    private ClusterBootstrapService clusterBootstrapService;

    private HookJournal journal;
    private RecordingEventPublisher publisher;
    private EngineSession session;
    private KubernetesCluster cluster;

    @BeforeEach
    void setUp() {
        journal = new HookJournal();
        publisher = new RecordingEventPublisher();
        session = new EngineSession(EngineFixtures.environmentExecutor(publisher, new FakeSleeper()),
                clusterBootstrapService, publisher, null);
        cluster = EngineFixtures.mockCluster();
    }

    private DeploymentTarget target(Environment environment) {
        return DeploymentTarget.forEnvironment(cluster, environment, EngineFixtures.engineContext(workspace));
    }

    @Test
    void commit_runsStepsInOrderAndCommits() {
        RecordingService app = RecordingService.application("app", journal);
        Environment env = Environment.builder("env1").service(app).build();

        Transaction tx = session.transaction()
                .deployEnvironment(target(env), EnvironmentAction.of(env))
                .pauseEnvironment(target(env), EnvironmentAction.of(env));
        TransactionResult result = tx.commit();

        assertThat(result.isOk()).isTrue();
        assertThat(tx.getStatus()).isEqualTo(TransactionStatus.COMMITTED);
        assertThat(app.calls()).containsExactly("onCreateCheck", "onCreate", "onPauseCheck", "onPause");
        assertThat(publisher.getEventsOfType(TransactionStartedEvent.class))
                .singleElement()
                .extracting(TransactionStartedEvent::getStepCount)
                .isEqualTo(2);
        assertThat(publisher.getEventsOfType(TransactionCommittedEvent.class)).hasSize(1);
    }

    @Test
    void commit_stopsAtFirstNonOkStep() {
        RecordingService app = RecordingService.application("app", journal).failOn("onCreate");
        Environment env = Environment.builder("env1").service(app).build();

        Transaction tx = session.transaction()
                .deployEnvironment(target(env), EnvironmentAction.of(env))
                .deleteEnvironment(target(env), EnvironmentAction.of(env));
        TransactionResult result = tx.commit();

        assertThat(result.isRollback()).isTrue();
        assertThat(tx.getStatus()).isEqualTo(TransactionStatus.ROLLED_BACK);
        assertThat(app.calls()).doesNotContain("onDeleteCheck", "onDelete");
        assertThat(publisher.getEventsOfType(TransactionRolledBackEvent.class))
                .singleElement()
                .satisfies(e -> assertThat(e.getFailureInfo().getSafeMessage()).isEqualTo("app onCreate failed"));
    }

    @Test
    void commit_onlyOnce() {
        Environment env = Environment.builder("env1").service(RecordingService.application("app", journal)).build();
        Transaction tx = session.transaction().deployEnvironment(target(env), EnvironmentAction.of(env));

        tx.commit();

        assertThatThrownBy(tx::commit).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> tx.deleteEnvironment(target(env), EnvironmentAction.of(env)))
                .isInstanceOf(IllegalStateException.class);
        assertThat(journal.count("onCreate")).isEqualTo(1);
    }

    @Test
    void cancelBeforeCommit_rollsBackWithoutRunningHooks() {
        RecordingService app = RecordingService.application("app", journal);
        Environment env = Environment.builder("env1").service(app).build();
        Transaction tx = session.transaction().deployEnvironment(target(env), EnvironmentAction.of(env));

        tx.cancel();
        TransactionResult result = tx.commit();

        assertThat(result.isRollback()).isTrue();
        assertThat(result.getCause().orElseThrow().getErrorType()).isEqualTo(ErrorType.CANCELLED);
        assertThat(app.calls()).isEmpty();
    }

    @Test
    void createKubernetes_missingOutputsIsUnrecoverable() {
        ChartsConfigPrerequisites prerequisites = ChartsConfigPrerequisites.builder("org", "z1234").build();
        Path outputs = workspace.resolve("outputs.json");
        when(clusterBootstrapService.bootstrap(eq(cluster), eq(prerequisites), eq(outputs), any(ExecutionId.class)))
                .thenThrow(EngineException.configuration("outputs file has not been rendered", "no such file", null));
        RecordingService app = RecordingService.application("app", journal);
        Environment env = Environment.builder("env1").service(app).build();

        TransactionResult result = session.transaction()
                .createKubernetes(cluster, prerequisites, outputs)
                .deployEnvironment(target(env), EnvironmentAction.of(env))
                .commit();

        assertThat(result.isUnrecoverable()).isTrue();
        assertThat(result.getCause().orElseThrow().getErrorType()).isEqualTo(ErrorType.CONFIGURATION_ERROR);
        assertThat(app.calls()).isEmpty();
        assertThat(publisher.getEventsOfType(TransactionUnrecoverableEvent.class)).hasSize(1);
    }

    @Test
    void createKubernetes_success_continuesWithEnvironment() {
        ChartsConfigPrerequisites prerequisites = ChartsConfigPrerequisites.builder("org", "z1234").build();
        Path outputs = workspace.resolve("outputs.json");
        when(clusterBootstrapService.bootstrap(eq(cluster), eq(prerequisites), eq(outputs), any(ExecutionId.class)))
                .thenReturn(List.of());
        RecordingService app = RecordingService.application("app", journal);
        Environment env = Environment.builder("env1").service(app).build();

        Transaction tx = session.transaction()
                .createKubernetes(cluster, prerequisites, outputs)
                .deployEnvironment(target(env), EnvironmentAction.of(env));

        assertThat(tx.getStepNames()).containsExactly("create-kubernetes:z1234", "deploy-environment:env1");
        assertThat(tx.commit().isOk()).isTrue();
        assertThat(app.calls()).containsExactly("onCreateCheck", "onCreate");
    }

    @Test
    void transactionsHaveDistinctIds() {
        assertThat(session.transaction().getTransactionId()).isNotEqualTo(session.transaction().getTransactionId());
        verifyNoInteractions(clusterBootstrapService);
    }
}
