package xyz.firestige.engine.facade;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xyz.firestige.engine.application.transaction.EngineSession;
import xyz.firestige.engine.domain.cluster.KubernetesCluster;
import xyz.firestige.engine.domain.environment.Environment;
import xyz.firestige.engine.domain.environment.EnvironmentAction;
import xyz.firestige.engine.domain.service.Action;
import xyz.firestige.engine.domain.transaction.TransactionResult;
import xyz.firestige.engine.domain.transaction.event.TransactionCommittedEvent;
import xyz.firestige.engine.testutil.EngineFixtures;
import xyz.firestige.engine.testutil.FakeSleeper;
import xyz.firestige.engine.testutil.HookJournal;
import xyz.firestige.engine.testutil.RecordingEventPublisher;
import xyz.firestige.engine.testutil.RecordingService;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 部署入口测试
 *
 * 测试目标：
 * - 参数校验快速失败
 * - 每个调用对应一个单步骤事务
 */
@DisplayName("EnvironmentDeploymentFacade 测试")
class EnvironmentDeploymentFacadeTest {

    @TempDir
    Path workspace;

    private final RecordingEventPublisher publisher = new RecordingEventPublisher();
    private final HookJournal journal = new HookJournal();
    private final KubernetesCluster cluster = EngineFixtures.mockCluster();
    private EnvironmentDeploymentFacade facade;

    @BeforeEach
    void setUp() {
        EngineSession session = new EngineSession(
                EngineFixtures.environmentExecutor(publisher, new FakeSleeper()), null, publisher, null);
        facade = new EnvironmentDeploymentFacade(session, EngineFixtures.engineContext(workspace));
    }

    @Test
    @DisplayName("部署 - 成功提交")
    void deploy_commits() {
        // Given
        Environment env = Environment.builder("env-1")
                .service(RecordingService.database("db", journal))
                .service(RecordingService.application("app", journal))
                .build();

        // When
        TransactionResult result = facade.deploy(cluster, EnvironmentAction.of(env));

        // Then
        assertThat(result.isOk()).isTrue();
        assertThat(journal.count("onCreate")).isEqualTo(2);
        assertThat(publisher.getEventsOfType(TransactionCommittedEvent.class)).hasSize(1);
    }

    @Test
    @DisplayName("删除 - 强制使用删除钩子")
    void delete_forcesDeleteHooks() {
        // Given
        Environment env = Environment.builder("env-1")
                .service(RecordingService.application("app", journal))
                .build();

        // When
        TransactionResult result = facade.delete(cluster, EnvironmentAction.of(env));

        // Then
        assertThat(result.isOk()).isTrue();
        assertThat(journal.count("onDelete")).isEqualTo(1);
        assertThat(journal.count("onCreate")).isZero();
    }

    @Test
    @DisplayName("暂停 - 强制使用暂停钩子")
    void pause_forcesPauseHooks() {
        Environment env = Environment.builder("env-1")
                .action(Action.CREATE)
                .service(RecordingService.application("app", journal))
                .build();

        TransactionResult result = facade.pause(cluster, EnvironmentAction.of(env));

        assertThat(result.isOk()).isTrue();
        assertThat(journal.count("onPause")).isEqualTo(1);
    }

    @Test
    @DisplayName("参数校验 - 空参数与空环境")
    void rejectsInvalidArguments() {
        Environment empty = Environment.builder("env-empty").build();

        assertThatThrownBy(() -> facade.deploy(null, EnvironmentAction.of(empty)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> facade.deploy(cluster, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> facade.deploy(cluster, EnvironmentAction.of(empty)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("env-empty");
        assertThatThrownBy(() -> facade.bootstrapCluster(cluster, null, workspace.resolve("outputs.json")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
