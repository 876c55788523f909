package xyz.firestige.engine.infrastructure.execution;

import xyz.firestige.engine.domain.progress.ProgressEvent;
import xyz.firestige.engine.domain.progress.ProgressListeners;
import xyz.firestige.engine.domain.progress.ProgressScope;
import xyz.firestige.engine.domain.progress.ProgressStep;
import xyz.firestige.engine.domain.shared.exception.ErrorType;
import xyz.firestige.engine.domain.shared.exception.FailureInfo;
import xyz.firestige.engine.domain.shared.vo.ExecutionId;
import xyz.firestige.engine.infrastructure.event.ProgressNotifier;

import java.util.function.Supplier;

/**
 * 长任务进度装饰器
 * <p>
 * 调用前发布 STARTED，阻塞期间由心跳发布 IN_PROGRESS，结束后发布 SUCCEEDED 或 FAILED。
 * 主生命周期钩子只能经由这里调用。
 */
public class LongTaskProgressDecorator {

    private final ProgressNotifier notifier;
    private final HeartbeatScheduler heartbeatScheduler;

    public LongTaskProgressDecorator(ProgressNotifier notifier, HeartbeatScheduler heartbeatScheduler) {
        this.notifier = notifier;
        this.heartbeatScheduler = heartbeatScheduler;
    }

    public void run(ProgressScope scope, ProgressListeners listeners, String action, ExecutionId executionId, Runnable task) {
        call(scope, listeners, action, executionId, () -> {
            task.run();
            return null;
        });
    }

    public <T> T call(ProgressScope scope, ProgressListeners listeners, String action, ExecutionId executionId, Supplier<T> task) {
        notifier.notify(ProgressEvent.info(scope, action, ProgressStep.STARTED, executionId,
                action + " of " + scope.getId() + " started"), listeners);
        T result;
        try (HeartbeatScheduler.Heartbeat ignored = heartbeatScheduler.start(scope, action, executionId, listeners)) {
            result = task.get();
        } catch (RuntimeException e) {
            FailureInfo failure = FailureInfo.fromException(e, ErrorType.EXECUTION_ERROR, scope.getId());
            notifier.notify(ProgressEvent.error(scope, action, ProgressStep.FAILED, executionId,
                    action + " of " + scope.getId() + " failed: " + failure.getSafeMessage()), listeners);
            throw e;
        }
        notifier.notify(ProgressEvent.info(scope, action, ProgressStep.SUCCEEDED, executionId,
                action + " of " + scope.getId() + " succeeded"), listeners);
        return result;
    }
}
