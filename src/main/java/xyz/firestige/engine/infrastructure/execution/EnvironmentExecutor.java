package xyz.firestige.engine.infrastructure.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import xyz.firestige.engine.domain.environment.DeploymentTarget;
import xyz.firestige.engine.domain.environment.Environment;
import xyz.firestige.engine.domain.environment.EnvironmentAction;
import xyz.firestige.engine.domain.environment.EnvironmentOperation;
import xyz.firestige.engine.domain.progress.ProgressEvent;
import xyz.firestige.engine.domain.progress.ProgressScope;
import xyz.firestige.engine.domain.progress.ProgressStep;
import xyz.firestige.engine.domain.service.Action;
import xyz.firestige.engine.domain.service.Service;
import xyz.firestige.engine.domain.shared.exception.ErrorType;
import xyz.firestige.engine.domain.shared.exception.FailureInfo;
import xyz.firestige.engine.domain.transaction.TransactionResult;
import xyz.firestige.engine.infrastructure.event.ProgressNotifier;
import xyz.firestige.engine.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.engine.infrastructure.metrics.NoopMetricsRegistry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * 环境执行器
 *
 * <p>执行流程：
 * <pre>
 * 能力校验      请求了服务不支持的动作 → UnrecoverableError(NOT_IMPLEMENTED)，不调用任何钩子
 *     ↓
 * 全部 check    任一失败 → UnrecoverableError(VALIDATION_ERROR)，没有任何变更，不回滚不切换
 *     ↓
 * 逐个主钩子     经由 LongTaskProgressDecorator 调用，CREATE 后等待就绪
 *     ↓ 失败
 * error 钩子    失败服务 + 已成功服务，尽力而为，失败只收集记录
 *     ↓
 * Rollback(cause)，有故障切换环境时在同一部署目标上执行故障切换环境
 * </pre>
 *
 * <p>顺序：CREATE 先有状态服务后无状态服务；PAUSE / DELETE 反之。
 * DEPLOY 时按服务自身动作分组，依次执行 CREATE、PAUSE、DELETE 组。
 *
 * <p>取消不是抢占式的，只在钩子之间检查取消信号。
 */
public class EnvironmentExecutor {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentExecutor.class);

    public static final String MDC_EXECUTION_ID = "executionId";
    public static final String MDC_SERVICE_ID = "serviceId";

    private static final BooleanSupplier NEVER_CANCELLED = () -> false;

    private final LongTaskProgressDecorator progressDecorator;
    private final ServiceReadinessWaiter readinessWaiter;
    private final ProgressNotifier notifier;
    private final MetricsRegistry metrics;

    public EnvironmentExecutor(LongTaskProgressDecorator progressDecorator,
                               ServiceReadinessWaiter readinessWaiter,
                               ProgressNotifier notifier,
                               MetricsRegistry metrics) {
        this.progressDecorator = progressDecorator;
        this.readinessWaiter = readinessWaiter;
        this.notifier = notifier;
        this.metrics = metrics != null ? metrics : new NoopMetricsRegistry();
    }

    public TransactionResult execute(DeploymentTarget target, EnvironmentAction action, EnvironmentOperation operation) {
        return execute(target, action, operation, NEVER_CANCELLED);
    }

    /**
     * 执行环境动作，主环境失败且有故障切换环境时，在同一部署目标上执行故障切换环境
     *
     * @param cancelled 取消信号，只在钩子之间检查
     */
    public TransactionResult execute(DeploymentTarget target,
                                     EnvironmentAction action,
                                     EnvironmentOperation operation,
                                     BooleanSupplier cancelled) {
        Environment primary = action.getPrimary();
        RunOutcome primaryOutcome = runEnvironment(target.withEnvironment(primary), operation, cancelled);
        if (primaryOutcome.isSuccess()) {
            return TransactionResult.ok();
        }
        if (!primaryOutcome.isRecoverable()) {
            return TransactionResult.unrecoverable(primaryOutcome.serviceId, primaryOutcome.failure);
        }

        Optional<Environment> failover = action.getFailover();
        if (failover.isEmpty() || primaryOutcome.failure.getErrorType() == ErrorType.CANCELLED) {
            return TransactionResult.rollback(primaryOutcome.failure);
        }

        log.warn("主环境执行失败，切换到故障切换环境: primary={}, failover={}, cause={}",
                primary.getId(), failover.get().getId(), primaryOutcome.failure.getSafeMessage());
        metrics.incrementCounter("environment_failover");
        RunOutcome failoverOutcome = runEnvironment(target.withEnvironment(failover.get()), operation, cancelled);
        if (failoverOutcome.isSuccess()) {
            return TransactionResult.ok();
        }
        log.error("故障切换环境也执行失败: failover={}, cause={}", failover.get().getId(), failoverOutcome.failure.getSafeMessage());
        return TransactionResult.unrecoverable(failoverOutcome.serviceId, failoverOutcome.failure);
    }

    private RunOutcome runEnvironment(DeploymentTarget target, EnvironmentOperation operation, BooleanSupplier cancelled) {
        Environment environment = target.getEnvironment();
        String previousExecutionId = MDC.get(MDC_EXECUTION_ID);
        MDC.put(MDC_EXECUTION_ID, environment.getExecutionId().getValue());
        ProgressScope scope = ProgressScope.environment(environment.getId());
        try {
            log.info("开始执行环境: environment={}, operation={}, services={}",
                    environment.getId(), operation.displayName(), environment.getServices().size());
            notifier.notify(ProgressEvent.info(scope, operation.displayName(), ProgressStep.STARTED,
                    environment.getExecutionId(), operation.displayName() + " of environment " + environment.getName() + " started"));

            RunOutcome outcome = doRun(target, operation, cancelled);

            if (outcome.isSuccess()) {
                notifier.notify(ProgressEvent.info(scope, operation.displayName(), ProgressStep.SUCCEEDED,
                        environment.getExecutionId(), operation.displayName() + " of environment " + environment.getName() + " succeeded"));
            } else {
                metrics.incrementCounter("environment_failed");
                notifier.notify(ProgressEvent.error(scope, operation.displayName(), ProgressStep.FAILED,
                        environment.getExecutionId(), operation.displayName() + " of environment " + environment.getName()
                                + " failed: " + outcome.failure.getSafeMessage()));
            }
            return outcome;
        } finally {
            MDC.remove(MDC_SERVICE_ID);
            if (previousExecutionId == null) {
                MDC.remove(MDC_EXECUTION_ID);
            } else {
                MDC.put(MDC_EXECUTION_ID, previousExecutionId);
            }
        }
    }

    private RunOutcome doRun(DeploymentTarget target, EnvironmentOperation operation, BooleanSupplier cancelled) {
        List<Step> steps = orderedSteps(target.getEnvironment(), operation);

        // 1. 能力校验
        for (Step step : steps) {
            if (!step.service.supports(step.action)) {
                String safe = step.service.getType().name().toLowerCase() + " " + step.service.getName()
                        + " does not support action " + step.action.displayName();
                log.error("请求了不支持的动作: service={}, action={}", step.service.getId(), step.action);
                return RunOutcome.unrecoverable(step.service.getId(),
                        FailureInfo.of(ErrorType.NOT_IMPLEMENTED, safe, safe, step.service.getId()));
            }
        }

        // 2. 预检
        for (Step step : steps) {
            if (cancelled.getAsBoolean()) {
                return RunOutcome.recoverable(step.service.getId(), cancelledFailure(step.service));
            }
            MDC.put(MDC_SERVICE_ID, step.service.getId());
            try {
                step.check(target);
            } catch (RuntimeException e) {
                FailureInfo failure = FailureInfo.fromException(e, ErrorType.VALIDATION_ERROR, step.service.getId())
                        .withType(ErrorType.VALIDATION_ERROR);
                log.error("预检失败: service={}, action={}, error={}", step.service.getId(), step.action, failure.getSafeMessage());
                return RunOutcome.unrecoverable(step.service.getId(), failure);
            }
        }

        // 3. 主钩子
        if (steps.stream().anyMatch(step -> step.action == Action.CREATE)) {
            String namespace = target.getEnvironment().getNamespace();
            try {
                target.getCluster().getKubectl().createNamespaceIfAbsent(namespace);
            } catch (RuntimeException e) {
                log.error("创建命名空间失败: namespace={}", namespace, e);
                return RunOutcome.recoverable(null, FailureInfo.fromException(e, ErrorType.EXECUTION_ERROR, namespace));
            }
        }

        List<Step> succeeded = new ArrayList<>();
        for (Step step : steps) {
            if (cancelled.getAsBoolean()) {
                log.warn("执行已取消，回滚已完成的服务: succeeded={}", succeeded.size());
                runErrorHooks(target, succeeded, null);
                return RunOutcome.recoverable(step.service.getId(), cancelledFailure(step.service));
            }
            MDC.put(MDC_SERVICE_ID, step.service.getId());
            try {
                progressDecorator.run(step.service.progressScope(), step.service.getListeners(), step.action.displayName(),
                        target.getEnvironment().getExecutionId(), () -> {
                            step.execute(target);
                            if (step.action == Action.CREATE) {
                                readinessWaiter.await(step.service, target);
                            }
                        });
                succeeded.add(step);
            } catch (RuntimeException e) {
                FailureInfo failure = FailureInfo.fromException(e, ErrorType.EXECUTION_ERROR, step.service.getId());
                log.error("服务执行失败: service={}, action={}, error={}, raw={}",
                        step.service.getId(), step.action, failure.getSafeMessage(), failure.getRawMessage());
                metrics.incrementCounter("service_failed");
                runErrorHooks(target, succeeded, step);
                return RunOutcome.recoverable(step.service.getId(), failure);
            }
        }
        return RunOutcome.success();
    }

    /**
     * 失败服务先执行，其余已成功服务按逆序执行；失败只记录，不覆盖原始错误
     */
    private List<FailureInfo> runErrorHooks(DeploymentTarget target, List<Step> succeeded, Step failed) {
        List<Step> compensations = new ArrayList<>();
        if (failed != null) {
            compensations.add(failed);
        }
        for (int i = succeeded.size() - 1; i >= 0; i--) {
            compensations.add(succeeded.get(i));
        }

        List<FailureInfo> secondaryFailures = new ArrayList<>();
        for (Step step : compensations) {
            MDC.put(MDC_SERVICE_ID, step.service.getId());
            try {
                step.onError(target);
            } catch (RuntimeException e) {
                FailureInfo failure = FailureInfo.fromException(e, ErrorType.EXECUTION_ERROR, step.service.getId());
                secondaryFailures.add(failure);
                log.warn("error 钩子执行失败，忽略: service={}, action={}, error={}",
                        step.service.getId(), step.action, failure.getRawMessage());
            }
        }
        if (!secondaryFailures.isEmpty()) {
            log.warn("清理阶段共有 {} 个失败", secondaryFailures.size());
        }
        return secondaryFailures;
    }

    static List<Step> orderedSteps(Environment environment, EnvironmentOperation operation) {
        List<Step> creates = new ArrayList<>();
        List<Step> pauses = new ArrayList<>();
        List<Step> deletes = new ArrayList<>();
        List<Step> others = new ArrayList<>();
        for (Service service : environment.getServices()) {
            Action action = operation.getForcedAction().orElse(service.getAction());
            Step step = new Step(service, action);
            switch (action) {
                case CREATE -> creates.add(step);
                case PAUSE -> pauses.add(step);
                case DELETE -> deletes.add(step);
                default -> others.add(step);
            }
        }
        Comparator<Step> statefulFirst = Comparator.comparing(step -> !step.service.getType().isStateful());
        Comparator<Step> statelessFirst = Comparator.comparing(step -> step.service.getType().isStateful());
        creates.sort(statefulFirst);
        pauses.sort(statelessFirst);
        deletes.sort(statelessFirst);

        List<Step> ordered = new ArrayList<>(others);
        ordered.addAll(creates);
        ordered.addAll(pauses);
        ordered.addAll(deletes);
        return ordered;
    }

    private static FailureInfo cancelledFailure(Service service) {
        return FailureInfo.of(ErrorType.CANCELLED, "Deployment has been cancelled", "cancelled before " + service.getId(), service.getId());
    }

    /**
     * 服务 + 本次执行的动作
     */
    static final class Step {
        final Service service;
        final Action action;

        Step(Service service, Action action) {
            this.service = service;
            this.action = action;
        }

        void check(DeploymentTarget target) {
            switch (action) {
                case CREATE -> service.onCreateCheck(target);
                case PAUSE -> service.onPauseCheck(target);
                case DELETE -> service.onDeleteCheck(target);
                default -> {
                }
            }
        }

        void execute(DeploymentTarget target) {
            switch (action) {
                case CREATE -> service.onCreate(target);
                case PAUSE -> service.onPause(target);
                case DELETE -> service.onDelete(target);
                case UPGRADE -> service.onUpgrade(target);
                case DOWNGRADE -> service.onDowngrade(target);
                case BACKUP -> service.onBackup(target);
                case RESTORE -> service.onRestore(target);
                case CLONE -> service.onClone(target);
            }
        }

        void onError(DeploymentTarget target) {
            switch (action) {
                case CREATE -> service.onCreateError(target);
                case PAUSE -> service.onPauseError(target);
                case DELETE -> service.onDeleteError(target);
                default -> log.debug("动作 {} 没有 error 钩子: service={}", action, service.getId());
            }
        }

        @Override
        public String toString() {
            return action.displayName() + ":" + service.getId();
        }
    }

    private static final class RunOutcome {
        private final boolean success;
        private final boolean recoverable;
        private final String serviceId;
        private final FailureInfo failure;

        private RunOutcome(boolean success, boolean recoverable, String serviceId, FailureInfo failure) {
            this.success = success;
            this.recoverable = recoverable;
            this.serviceId = serviceId;
            this.failure = failure;
        }

        static RunOutcome success() {
            return new RunOutcome(true, true, null, null);
        }

        static RunOutcome recoverable(String serviceId, FailureInfo failure) {
            return new RunOutcome(false, true, serviceId, failure);
        }

        static RunOutcome unrecoverable(String serviceId, FailureInfo failure) {
            return new RunOutcome(false, false, serviceId, failure);
        }

        boolean isSuccess() {
            return success;
        }

        boolean isRecoverable() {
            return recoverable;
        }
    }
}
