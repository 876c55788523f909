package xyz.firestige.engine.domain.progress;

import xyz.firestige.engine.domain.shared.event.DomainEvent;
import xyz.firestige.engine.domain.shared.vo.ExecutionId;

/**
 * 进度事件
 * <p>
 * 消息只包含可以展示给用户的安全文本。
 */
public class ProgressEvent extends DomainEvent {

    private final ProgressScope scope;
    private final ProgressLevel level;
    private final String action;
    private final ProgressStep step;
    private final ExecutionId executionId;

    public ProgressEvent(ProgressScope scope, ProgressLevel level, String action, ProgressStep step,
                         ExecutionId executionId, String message) {
        super(message);
        this.scope = scope;
        this.level = level;
        this.action = action;
        this.step = step;
        this.executionId = executionId;
    }

    public static ProgressEvent info(ProgressScope scope, String action, ProgressStep step, ExecutionId executionId, String message) {
        return new ProgressEvent(scope, ProgressLevel.INFO, action, step, executionId, message);
    }

    public static ProgressEvent warn(ProgressScope scope, String action, ProgressStep step, ExecutionId executionId, String message) {
        return new ProgressEvent(scope, ProgressLevel.WARN, action, step, executionId, message);
    }

    public static ProgressEvent error(ProgressScope scope, String action, ProgressStep step, ExecutionId executionId, String message) {
        return new ProgressEvent(scope, ProgressLevel.ERROR, action, step, executionId, message);
    }

    public ProgressScope getScope() {
        return scope;
    }

    public ProgressLevel getLevel() {
        return level;
    }

    public String getAction() {
        return action;
    }

    public ProgressStep getStep() {
        return step;
    }

    public ExecutionId getExecutionId() {
        return executionId;
    }

    @Override
    public String toString() {
        return "ProgressEvent{" +
                "scope=" + scope +
                ", level=" + level +
                ", action='" + action + '\'' +
                ", step=" + step +
                ", executionId=" + executionId +
                ", message='" + getMessage() + '\'' +
                '}';
    }
}
