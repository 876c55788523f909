package xyz.firestige.engine.application.bootstrap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.engine.domain.chart.ChartLevel;
import xyz.firestige.engine.domain.cluster.KubernetesCluster;
import xyz.firestige.engine.domain.environment.EngineContext;
import xyz.firestige.engine.domain.shared.vo.ExecutionId;
import xyz.firestige.engine.infrastructure.chart.LeveledChartInstaller;

import java.nio.file.Path;
import java.util.List;

/**
 * 集群引导：生成分层计划后逐层安装
 * <p>
 * 每个集群引导一次，与环境部署无关。
 */
public class ClusterBootstrapService {

    private static final Logger log = LoggerFactory.getLogger(ClusterBootstrapService.class);

    private final ClusterChartsPlanner planner;
    private final LeveledChartInstaller installer;
    private final EngineContext engineContext;

    public ClusterBootstrapService(ClusterChartsPlanner planner, LeveledChartInstaller installer, EngineContext engineContext) {
        this.planner = planner;
        this.installer = installer;
        this.engineContext = engineContext;
    }

    /**
     * @param outputsFile 基础设施步骤输出文件
     * @return 已安装的层级
     */
    public List<ChartLevel> bootstrap(KubernetesCluster cluster,
                                      ChartsConfigPrerequisites prerequisites,
                                      Path outputsFile,
                                      ExecutionId executionId) {
        log.info("开始引导集群: cluster={}, executionId={}", cluster.getId(), executionId);
        List<ChartLevel> levels = planner.plan(
                outputsFile, prerequisites, engineContext.getLibRoot(), cluster.getProvider().getLibDirectoryName());
        Path workspace = engineContext.workspaceDir(executionId, "cluster-" + cluster.getId());
        installer.install(cluster, levels, workspace, executionId);
        log.info("集群引导完成: cluster={}", cluster.getId());
        return levels;
    }
}
