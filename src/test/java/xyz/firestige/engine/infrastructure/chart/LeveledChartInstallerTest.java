package xyz.firestige.engine.infrastructure.chart;

import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import xyz.firestige.engine.domain.chart.ChartAction;
import xyz.firestige.engine.domain.chart.ChartInfo;
import xyz.firestige.engine.domain.chart.ChartLevel;
import xyz.firestige.engine.domain.cluster.HelmClient;
import xyz.firestige.engine.domain.cluster.HelmDeploymentStatus;
import xyz.firestige.engine.domain.cluster.KubectlClient;
import xyz.firestige.engine.domain.cluster.KubernetesCluster;
import xyz.firestige.engine.domain.shared.exception.CommandException;
import xyz.firestige.engine.domain.shared.exception.EngineException;
import xyz.firestige.engine.domain.shared.exception.ErrorType;
import xyz.firestige.engine.domain.shared.vo.ExecutionId;
import xyz.firestige.engine.domain.version.VersionsNumber;
import xyz.firestige.engine.testutil.EngineFixtures;
import xyz.firestige.engine.testutil.RecordingEventPublisher;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LeveledChartInstallerTest {

    @TempDir
    Path workspace;

    @Mock
    private HelmClient helm;

    @Mock
    private KubectlClient kubectl;

    @Mock
    private ChartBackupService backupService;

    private KubernetesCluster cluster;
    private LeveledChartInstaller installer;
    private ExecutorService pool;
    private final ExecutionId executionId = ExecutionId.of("exec-1");

    @BeforeEach
    void setUp() {
        cluster = EngineFixtures.cluster(helm, kubectl);
        installer = newInstaller(null);
        lenient().when(helm.upgrade(any(ChartInfo.class), anyList()))
                .thenAnswer(inv -> HelmDeploymentStatus.of(inv.<ChartInfo>getArgument(0).getName(), 1, "deployed"));
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdownNow();
        }
    }

    private LeveledChartInstaller newInstaller(ExecutorService executor) {
        RecordingEventPublisher publisher = new RecordingEventPublisher();
        return new LeveledChartInstaller(backupService,
                EngineFixtures.decorator(EngineFixtures.syncNotifier(publisher)), executor, null);
    }

    private static ChartInfo chart(String name) {
        return ChartInfo.builder(name).path("/lib/common/charts/" + name).namespace("kube-system").build();
    }

    private static ChartInfo named(String name) {
        return argThat(c -> c != null && c.getName().equals(name));
    }

    @Test
    void levelsInstallInOrderAndEmptyLevelsAreSkipped() {
        List<ChartLevel> levels = List.of(
                new ChartLevel(1, List.of(chart("storage-class"))),
                new ChartLevel(2, List.of()),
                new ChartLevel(3, List.of(chart("ingress-nginx"), chart("pleco"))));

        installer.install(cluster, levels, workspace, executionId);

        InOrder order = inOrder(helm);
        order.verify(helm).upgrade(named("storage-class"), anyList());
        order.verify(helm).upgrade(named("ingress-nginx"), anyList());
        order.verify(helm).upgrade(named("pleco"), anyList());
    }

    @Test
    void failureAbortsRemainingLevels() {
        doThrow(new CommandException(List.of("helm", "upgrade"), 1, "helm upgrade of cert-manager failed", "timed out"))
                .when(helm).upgrade(named("cert-manager"), anyList());
        List<ChartLevel> levels = List.of(
                new ChartLevel(1, List.of(chart("cert-manager"))),
                new ChartLevel(2, List.of(chart("cert-manager-configs"))));

        EngineException e = catchThrowableOfType(
                () -> installer.install(cluster, levels, workspace, executionId), EngineException.class);

        assertThat(e.getErrorType()).isEqualTo(ErrorType.EXECUTION_ERROR);
        assertThat(e.getFailureInfo().getSafeMessage()).isEqualTo("helm upgrade of cert-manager failed");
        verify(helm, never()).upgrade(named("cert-manager-configs"), anyList());
    }

    @Test
    void breakingVersion_uninstallsOlderReleaseBeforeUpgrade() {
        ChartInfo promtail = ChartInfo.builder("promtail").path("/lib/promtail").namespace("kube-system")
                .lastBreakingVersion("0.24.0").build();
        when(helm.installedVersion("promtail", "kube-system")).thenReturn(Optional.of(VersionsNumber.parse("0.23.1")));

        installer.installChart(cluster, promtail, workspace, executionId);

        InOrder order = inOrder(helm);
        order.verify(helm).uninstall("promtail", "kube-system");
        order.verify(helm).upgrade(promtail, List.of());
    }

    @Test
    void breakingVersion_keepsNewerRelease() {
        ChartInfo promtail = ChartInfo.builder("promtail").path("/lib/promtail").namespace("kube-system")
                .lastBreakingVersion("0.24.0").build();
        when(helm.installedVersion("promtail", "kube-system")).thenReturn(Optional.of(VersionsNumber.parse("0.24.3")));

        installer.installChart(cluster, promtail, workspace, executionId);

        verify(helm, never()).uninstall("promtail", "kube-system");
    }

    @Test
    void backupWrapsUpgrade() {
        ChartInfo certManager = chart("cert-manager");

        installer.installChart(cluster, certManager, workspace, executionId);

        InOrder order = inOrder(backupService, helm);
        order.verify(backupService).prepare(kubectl, certManager, workspace.resolve("cert-manager"));
        order.verify(helm).upgrade(certManager, List.of());
        order.verify(backupService).apply(kubectl, certManager, workspace.resolve("cert-manager"));
    }

    @Test
    void certManagerInstallsOnFreshClusterWithoutItsResourceTypes() {
        installer = new LeveledChartInstaller(new ChartBackupService(new YAMLMapper()),
                EngineFixtures.decorator(EngineFixtures.syncNotifier(new RecordingEventPublisher())), null, null);
        ChartInfo certManager = ChartInfo.builder("cert-manager").path("/lib/common/charts/cert-manager")
                .namespace("cert-manager").backupResource("cert").build();
        when(kubectl.getResourceYaml("cert", "cert-manager")).thenThrow(new CommandException(
                List.of("kubectl", "get", "cert"), 1, "kubectl get cert failed",
                "error: the server doesn't have a resource type \"cert\""));

        installer.install(cluster, List.of(new ChartLevel(2, List.of(certManager))), workspace, executionId);

        verify(helm).upgrade(certManager, List.of());
        verify(kubectl, never()).createSecretFromFile(any(), any(), any(), any());
    }

    @Test
    void destroyAction_onlyUninstalls() {
        ChartInfo engine = ChartInfo.builder("deployment-engine").path("/lib/engine").namespace("engine-system")
                .action(ChartAction.DESTROY).build();

        installer.installChart(cluster, engine, workspace, executionId);

        verify(helm).uninstall("deployment-engine", "engine-system");
        verify(helm, never()).upgrade(any(ChartInfo.class), anyList());
    }

    @Test
    void duplicateNamesAreRejected() {
        List<ChartLevel> levels = List.of(
                new ChartLevel(1, List.of(chart("coredns-config"))),
                new ChartLevel(2, List.of(chart("coredns-config"))));

        assertThatThrownBy(() -> installer.install(cluster, levels, workspace, executionId))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("coredns-config");
        verify(helm, never()).upgrade(any(ChartInfo.class), anyList());
    }

    @Test
    void parallelLevel_reportsFailureAfterSiblingsComplete() {
        pool = Executors.newFixedThreadPool(2);
        installer = newInstaller(pool);
        doThrow(new IllegalStateException("boom"))
                .when(helm).upgrade(named("metrics-server"), anyList());
        List<ChartLevel> levels = List.of(
                new ChartLevel(1, List.of(chart("metrics-server"), chart("external-dns"))),
                new ChartLevel(2, List.of(chart("ingress-nginx"))));

        assertThatThrownBy(() -> installer.install(cluster, levels, workspace, executionId))
                .isInstanceOf(EngineException.class);
        verify(helm).upgrade(named("external-dns"), anyList());
        verify(helm, never()).upgrade(named("ingress-nginx"), anyList());
    }
}
