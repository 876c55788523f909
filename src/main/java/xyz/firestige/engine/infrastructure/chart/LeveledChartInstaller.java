package xyz.firestige.engine.infrastructure.chart;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.engine.domain.chart.ChartAction;
import xyz.firestige.engine.domain.chart.ChartInfo;
import xyz.firestige.engine.domain.chart.ChartLevel;
import xyz.firestige.engine.domain.cluster.HelmClient;
import xyz.firestige.engine.domain.cluster.KubernetesCluster;
import xyz.firestige.engine.domain.progress.ProgressScope;
import xyz.firestige.engine.domain.shared.exception.EngineException;
import xyz.firestige.engine.domain.shared.exception.ErrorType;
import xyz.firestige.engine.domain.shared.exception.FailureInfo;
import xyz.firestige.engine.domain.shared.vo.ExecutionId;
import xyz.firestige.engine.domain.version.VersionsNumber;
import xyz.firestige.engine.infrastructure.execution.LongTaskProgressDecorator;
import xyz.firestige.engine.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.engine.infrastructure.metrics.NoopMetricsRegistry;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * 分层安装 chart
 * <p>
 * 层级严格按顺序执行，只有前一层全部成功后才开始下一层；任何一个 chart 失败都会终止剩余层级。
 * 同一层内的 chart 在配置了 executor 时并行安装，否则按声明顺序串行。
 */
public class LeveledChartInstaller {

    private static final Logger log = LoggerFactory.getLogger(LeveledChartInstaller.class);

    private final ChartBackupService backupService;
    private final LongTaskProgressDecorator progressDecorator;
    private final ExecutorService levelExecutor;
    private final MetricsRegistry metrics;

    public LeveledChartInstaller(ChartBackupService backupService,
                                 LongTaskProgressDecorator progressDecorator,
                                 ExecutorService levelExecutor,
                                 MetricsRegistry metrics) {
        this.backupService = backupService;
        this.progressDecorator = progressDecorator;
        this.levelExecutor = levelExecutor;
        this.metrics = metrics != null ? metrics : new NoopMetricsRegistry();
    }

    /**
     * @throws EngineException 第一个失败的 chart，EXECUTION_ERROR
     */
    public void install(KubernetesCluster cluster, List<ChartLevel> levels, Path workspace, ExecutionId executionId) {
        ChartLevel.requireUniqueNames(levels);
        for (ChartLevel level : levels) {
            if (level.isEmpty()) {
                log.debug("跳过空层级: level={}", level.getNumber());
                continue;
            }
            log.info("开始安装层级: level={}, charts={}", level.getNumber(), level.chartNames());
            installLevel(cluster, level, workspace, executionId);
            log.info("层级安装完成: level={}", level.getNumber());
        }
    }

    private void installLevel(KubernetesCluster cluster, ChartLevel level, Path workspace, ExecutionId executionId) {
        if (levelExecutor == null || level.getCharts().size() == 1) {
            for (ChartInfo chart : level.getCharts()) {
                installChart(cluster, chart, workspace, executionId);
            }
            return;
        }

        List<Future<?>> futures = new ArrayList<>();
        for (ChartInfo chart : level.getCharts()) {
            futures.add(levelExecutor.submit(() -> installChart(cluster, chart, workspace, executionId)));
        }
        EngineException firstFailure = null;
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new EngineException(FailureInfo.of(ErrorType.CANCELLED,
                        "Installation of level " + level.getNumber() + " was interrupted"), e);
            } catch (ExecutionException e) {
                if (firstFailure == null) {
                    firstFailure = toEngineException(e.getCause(), "level-" + level.getNumber());
                }
            }
        }
        if (firstFailure != null) {
            throw firstFailure;
        }
    }

    void installChart(KubernetesCluster cluster, ChartInfo chart, Path workspace, ExecutionId executionId) {
        String action = chart.getAction() == ChartAction.INSTALL ? "install-chart" : "destroy-chart";
        try {
            progressDecorator.run(ProgressScope.infrastructure(chart.getName()), null, action, executionId, () -> {
                HelmClient helm = cluster.getHelm();
                if (chart.getAction() == ChartAction.DESTROY) {
                    helm.uninstall(chart.getName(), chart.getNamespace());
                    return;
                }
                uninstallIfBreaking(helm, chart);
                Path chartWorkspace = workspace.resolve(chart.getName());
                backupService.prepare(cluster.getKubectl(), chart, chartWorkspace);
                helm.upgrade(chart, List.of());
                backupService.apply(cluster.getKubectl(), chart, chartWorkspace);
            });
            metrics.incrementCounter("chart_installed");
        } catch (RuntimeException e) {
            metrics.incrementCounter("chart_failed");
            throw toEngineException(e, chart.getName());
        }
    }

    /**
     * 已安装版本低于不兼容边界时先卸载，再全新安装
     */
    private void uninstallIfBreaking(HelmClient helm, ChartInfo chart) {
        Optional<VersionsNumber> breaking = chart.getLastBreakingVersion();
        if (breaking.isEmpty()) {
            return;
        }
        Optional<VersionsNumber> installed = helm.installedVersion(chart.getName(), chart.getNamespace());
        if (installed.isPresent() && installed.get().isOlderThan(breaking.get())) {
            log.warn("已安装版本跨越不兼容边界，先卸载: chart={}, installed={}, breaking={}",
                    chart.getName(), installed.get(), breaking.get());
            helm.uninstall(chart.getName(), chart.getNamespace());
        }
    }

    private static EngineException toEngineException(Throwable e, String failedAt) {
        FailureInfo info = FailureInfo.fromException(e, ErrorType.EXECUTION_ERROR, failedAt);
        if (info.getErrorType() == ErrorType.COMMAND_ERROR) {
            info = info.withType(ErrorType.EXECUTION_ERROR);
        }
        return new EngineException(info, e);
    }
}
