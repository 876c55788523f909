package xyz.firestige.engine.application.transaction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.engine.application.bootstrap.ChartsConfigPrerequisites;
import xyz.firestige.engine.application.bootstrap.ClusterBootstrapService;
import xyz.firestige.engine.domain.cluster.KubernetesCluster;
import xyz.firestige.engine.domain.environment.DeploymentTarget;
import xyz.firestige.engine.domain.environment.EnvironmentAction;
import xyz.firestige.engine.domain.environment.EnvironmentOperation;
import xyz.firestige.engine.domain.shared.event.DomainEventPublisher;
import xyz.firestige.engine.domain.shared.exception.ErrorType;
import xyz.firestige.engine.domain.shared.exception.FailureInfo;
import xyz.firestige.engine.domain.shared.vo.ExecutionId;
import xyz.firestige.engine.domain.transaction.TransactionResult;
import xyz.firestige.engine.domain.transaction.TransactionStateMachine;
import xyz.firestige.engine.domain.transaction.TransactionStatus;
import xyz.firestige.engine.infrastructure.execution.EnvironmentExecutor;
import xyz.firestige.engine.infrastructure.metrics.MetricsRegistry;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 事务：按入队顺序执行步骤，第一个非 Ok 的步骤结束提交
 * <p>
 * 一个事务只能提交一次。取消信号只在钩子之间生效。
 * <pre>{@code
 * TransactionResult result = session.transaction()
 *         .createKubernetes(cluster, prerequisites, outputsFile)
 *         .deployEnvironment(target, EnvironmentAction.of(environment))
 *         .commit();
 * }</pre>
 */
public class Transaction {

    private static final Logger log = LoggerFactory.getLogger(Transaction.class);

    private final String transactionId;
    private final EnvironmentExecutor environmentExecutor;
    private final ClusterBootstrapService clusterBootstrapService;
    private final TransactionStateMachine stateMachine;
    private final MetricsRegistry metrics;
    private final List<TransactionStep> steps = new ArrayList<>();
    private final AtomicBoolean committed = new AtomicBoolean(false);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    Transaction(String transactionId,
                EnvironmentExecutor environmentExecutor,
                ClusterBootstrapService clusterBootstrapService,
                DomainEventPublisher eventPublisher,
                MetricsRegistry metrics) {
        this.transactionId = transactionId;
        this.environmentExecutor = environmentExecutor;
        this.clusterBootstrapService = clusterBootstrapService;
        this.stateMachine = new TransactionStateMachine(transactionId, eventPublisher);
        this.metrics = metrics;
    }

    public Transaction createKubernetes(KubernetesCluster cluster, ChartsConfigPrerequisites prerequisites, Path outputsFile) {
        Objects.requireNonNull(cluster, "cluster");
        Objects.requireNonNull(prerequisites, "prerequisites");
        Objects.requireNonNull(outputsFile, "outputsFile");
        return addStep(new TransactionStep("create-kubernetes:" + cluster.getId(), () -> {
            if (clusterBootstrapService == null) {
                throw new IllegalStateException("cluster bootstrap is not configured");
            }
            clusterBootstrapService.bootstrap(cluster, prerequisites, outputsFile, ExecutionId.of(transactionId));
            return TransactionResult.ok();
        }));
    }

    public Transaction deployEnvironment(DeploymentTarget target, EnvironmentAction action) {
        return environmentStep(target, action, EnvironmentOperation.DEPLOY);
    }

    public Transaction pauseEnvironment(DeploymentTarget target, EnvironmentAction action) {
        return environmentStep(target, action, EnvironmentOperation.PAUSE);
    }

    public Transaction deleteEnvironment(DeploymentTarget target, EnvironmentAction action) {
        return environmentStep(target, action, EnvironmentOperation.DELETE);
    }

    private Transaction environmentStep(DeploymentTarget target, EnvironmentAction action, EnvironmentOperation operation) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(action, "action");
        return addStep(new TransactionStep(operation.displayName() + "-environment:" + action.getPrimary().getId(),
                () -> environmentExecutor.execute(target, action, operation, cancelled::get)));
    }

    private synchronized Transaction addStep(TransactionStep step) {
        if (committed.get()) {
            throw new IllegalStateException("transaction " + transactionId + " has already been committed");
        }
        steps.add(step);
        return this;
    }

    /**
     * 提交事务
     *
     * @throws IllegalStateException 重复提交
     */
    public TransactionResult commit() {
        if (!committed.compareAndSet(false, true)) {
            throw new IllegalStateException("transaction " + transactionId + " has already been committed");
        }
        List<TransactionStep> toRun;
        synchronized (this) {
            toRun = List.copyOf(steps);
        }
        log.info("事务开始提交: transactionId={}, steps={}", transactionId, toRun.size());
        stateMachine.start(toRun.size());

        TransactionResult result = TransactionResult.ok();
        for (TransactionStep step : toRun) {
            if (cancelled.get()) {
                result = TransactionResult.rollback(FailureInfo.of(ErrorType.CANCELLED,
                        "Deployment has been cancelled", "cancelled before step " + step.getName(), step.getName()));
                break;
            }
            log.info("执行事务步骤: transactionId={}, step={}", transactionId, step.getName());
            result = step.run();
            if (!result.isOk()) {
                log.warn("事务步骤未成功，结束提交: transactionId={}, step={}, result={}", transactionId, step.getName(), result);
                break;
            }
        }

        stateMachine.complete(result);
        metrics.incrementCounter(switch (result.getKind()) {
            case OK -> "transaction_committed";
            case ROLLBACK -> "transaction_rolled_back";
            case UNRECOVERABLE_ERROR -> "transaction_unrecoverable";
        });
        log.info("事务结束: transactionId={}, result={}", transactionId, result);
        return result;
    }

    /**
     * 请求取消，正在执行的钩子不会被中断
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.warn("收到取消请求: transactionId={}", transactionId);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public String getTransactionId() {
        return transactionId;
    }

    public TransactionStatus getStatus() {
        return stateMachine.getStatus();
    }

    public List<String> getStepNames() {
        synchronized (this) {
            return steps.stream().map(TransactionStep::getName).toList();
        }
    }
}
