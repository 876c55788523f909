package xyz.firestige.engine.domain.shared.exception;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * 失败信息封装类
 * <p>
 * safeMessage 可以展示给最终用户；rawMessage 只用于日志诊断，可能包含命令输出、内部地址等信息，
 * 两者不能混用。
 */
public class FailureInfo {

    private final ErrorType errorType;

    /**
     * 面向用户的安全消息
     */
    private final String safeMessage;

    /**
     * 诊断用原始消息（可选）
     */
    private final String rawMessage;

    /**
     * 失败位置（服务 ID、chart 名称或步骤名称）
     */
    private final String failedAt;

    private final boolean retryable;

    private final LocalDateTime timestamp;

    private FailureInfo(ErrorType errorType, String safeMessage, String rawMessage, String failedAt, boolean retryable) {
        this.errorType = Objects.requireNonNull(errorType, "errorType");
        this.safeMessage = safeMessage;
        this.rawMessage = rawMessage;
        this.failedAt = failedAt;
        this.retryable = retryable;
        this.timestamp = LocalDateTime.now();
    }

    public static FailureInfo of(ErrorType errorType, String safeMessage) {
        return new FailureInfo(errorType, safeMessage, null, null, errorType.isRetryable());
    }

    public static FailureInfo of(ErrorType errorType, String safeMessage, String rawMessage) {
        return new FailureInfo(errorType, safeMessage, rawMessage, null, errorType.isRetryable());
    }

    public static FailureInfo of(ErrorType errorType, String safeMessage, String rawMessage, String failedAt) {
        return new FailureInfo(errorType, safeMessage, rawMessage, failedAt, errorType.isRetryable());
    }

    /**
     * 从异常构造失败信息：EngineException 直接取其携带的信息，其他异常使用通用安全消息
     */
    public static FailureInfo fromException(Throwable e, ErrorType fallbackType, String failedAt) {
        if (e instanceof EngineException ee) {
            FailureInfo info = ee.getFailureInfo();
            return info.getFailedAt() != null ? info : info.at(failedAt);
        }
        return new FailureInfo(fallbackType, "An unexpected error occurred: " + fallbackType.getDescription(),
                e.getClass().getSimpleName() + ": " + e.getMessage(), failedAt, fallbackType.isRetryable());
    }

    /**
     * 返回相同内容、不同失败位置的副本
     */
    public FailureInfo at(String failedAt) {
        return new FailureInfo(errorType, safeMessage, rawMessage, failedAt, retryable);
    }

    /**
     * 返回相同消息、不同错误类型的副本
     */
    public FailureInfo withType(ErrorType newType) {
        return new FailureInfo(newType, safeMessage, rawMessage, failedAt, newType.isRetryable());
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getSafeMessage() {
        return safeMessage;
    }

    public String getRawMessage() {
        return rawMessage;
    }

    public String getFailedAt() {
        return failedAt;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "FailureInfo{" +
                "errorType=" + errorType +
                ", safeMessage='" + safeMessage + '\'' +
                ", failedAt='" + failedAt + '\'' +
                '}';
    }
}
