package xyz.firestige.engine.domain.progress;

/**
 * 进度事件级别
 */
public enum ProgressLevel {
    INFO,
    WARN,
    ERROR
}
