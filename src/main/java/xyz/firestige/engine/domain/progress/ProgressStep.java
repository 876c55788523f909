package xyz.firestige.engine.domain.progress;

/**
 * 长任务所处阶段
 */
public enum ProgressStep {

    STARTED,

    /**
     * 心跳
     */
    IN_PROGRESS,

    SUCCEEDED,

    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
