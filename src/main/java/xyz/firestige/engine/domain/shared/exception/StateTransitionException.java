package xyz.firestige.engine.domain.shared.exception;

/**
 * 非法状态转换
 */
public class StateTransitionException extends EngineException {

    public StateTransitionException(String from, String to) {
        super(FailureInfo.of(ErrorType.SYSTEM_ERROR, "Illegal state transition: " + from + " -> " + to));
    }
}
