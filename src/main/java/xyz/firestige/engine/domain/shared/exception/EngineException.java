package xyz.firestige.engine.domain.shared.exception;

/**
 * 引擎异常基类，携带 {@link FailureInfo}
 * <p>
 * 异常消息只使用安全消息，原始诊断信息通过 {@link FailureInfo#getRawMessage()} 获取。
 */
public class EngineException extends RuntimeException {

    private final FailureInfo failureInfo;

    public EngineException(FailureInfo failureInfo) {
        super(failureInfo.getSafeMessage());
        this.failureInfo = failureInfo;
    }

    public EngineException(FailureInfo failureInfo, Throwable cause) {
        super(failureInfo.getSafeMessage(), cause);
        this.failureInfo = failureInfo;
    }

    public static EngineException validation(String safeMessage) {
        return new EngineException(FailureInfo.of(ErrorType.VALIDATION_ERROR, safeMessage));
    }

    public static EngineException execution(String safeMessage, String rawMessage) {
        return new EngineException(FailureInfo.of(ErrorType.EXECUTION_ERROR, safeMessage, rawMessage));
    }

    public static EngineException notImplemented(String safeMessage) {
        return new EngineException(FailureInfo.of(ErrorType.NOT_IMPLEMENTED, safeMessage));
    }

    public static EngineException configuration(String safeMessage, String rawMessage, Throwable cause) {
        return new EngineException(FailureInfo.of(ErrorType.CONFIGURATION_ERROR, safeMessage, rawMessage), cause);
    }

    public FailureInfo getFailureInfo() {
        return failureInfo;
    }

    public ErrorType getErrorType() {
        return failureInfo.getErrorType();
    }
}
