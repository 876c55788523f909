package xyz.firestige.engine.facade;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.engine.application.bootstrap.ChartsConfigPrerequisites;
import xyz.firestige.engine.application.transaction.EngineSession;
import xyz.firestige.engine.domain.cluster.KubernetesCluster;
import xyz.firestige.engine.domain.environment.DeploymentTarget;
import xyz.firestige.engine.domain.environment.EngineContext;
import xyz.firestige.engine.domain.environment.Environment;
import xyz.firestige.engine.domain.environment.EnvironmentAction;
import xyz.firestige.engine.domain.transaction.TransactionResult;

import java.nio.file.Path;

/**
 * 部署入口
 * <p>
 * 职责：
 * 1. 参数校验（快速失败）
 * 2. 组装部署目标（生产环境使用托管数据库）
 * 3. 每个调用对应一个单步骤事务
 * <p>
 * 多步骤或需要取消的场景直接使用 {@link EngineSession#transaction()}。
 */
public class EnvironmentDeploymentFacade {

    private static final Logger logger = LoggerFactory.getLogger(EnvironmentDeploymentFacade.class);

    private final EngineSession session;
    private final EngineContext engineContext;

    public EnvironmentDeploymentFacade(EngineSession session, EngineContext engineContext) {
        this.session = session;
        this.engineContext = engineContext;
    }

    public TransactionResult bootstrapCluster(KubernetesCluster cluster, ChartsConfigPrerequisites prerequisites, Path outputsFile) {
        if (cluster == null || prerequisites == null || outputsFile == null) {
            throw new IllegalArgumentException("cluster、prerequisites、outputsFile 不能为空");
        }
        logger.info("[Facade] 引导集群: cluster={}", cluster.getId());
        return session.transaction().createKubernetes(cluster, prerequisites, outputsFile).commit();
    }

    public TransactionResult deploy(KubernetesCluster cluster, EnvironmentAction action) {
        DeploymentTarget target = target(cluster, action);
        logger.info("[Facade] 部署环境: {}", action);
        return session.transaction().deployEnvironment(target, action).commit();
    }

    public TransactionResult pause(KubernetesCluster cluster, EnvironmentAction action) {
        DeploymentTarget target = target(cluster, action);
        logger.info("[Facade] 暂停环境: {}", action);
        return session.transaction().pauseEnvironment(target, action).commit();
    }

    public TransactionResult delete(KubernetesCluster cluster, EnvironmentAction action) {
        DeploymentTarget target = target(cluster, action);
        logger.info("[Facade] 删除环境: {}", action);
        return session.transaction().deleteEnvironment(target, action).commit();
    }

    private DeploymentTarget target(KubernetesCluster cluster, EnvironmentAction action) {
        if (cluster == null) {
            throw new IllegalArgumentException("cluster 不能为空");
        }
        if (action == null) {
            throw new IllegalArgumentException("环境动作不能为空");
        }
        Environment primary = action.getPrimary();
        if (primary.getServices().isEmpty()) {
            throw new IllegalArgumentException("环境 " + primary.getId() + " 没有任何服务");
        }
        return DeploymentTarget.forEnvironment(cluster, primary, engineContext);
    }
}
