package xyz.firestige.engine.application.transaction;

import xyz.firestige.engine.domain.shared.exception.EngineException;
import xyz.firestige.engine.domain.shared.exception.ErrorType;
import xyz.firestige.engine.domain.shared.exception.FailureInfo;
import xyz.firestige.engine.domain.transaction.TransactionResult;

import java.util.function.Supplier;

/**
 * 事务中的一个步骤，异常统一转换为结果
 */
final class TransactionStep {

    private final String name;
    private final Supplier<TransactionResult> body;

    TransactionStep(String name, Supplier<TransactionResult> body) {
        this.name = name;
        this.body = body;
    }

    String getName() {
        return name;
    }

    /**
     * 配置类错误（前置产物缺失或无法解析）不可恢复；其余执行失败转换为回滚
     */
    TransactionResult run() {
        try {
            return body.get();
        } catch (EngineException e) {
            FailureInfo failure = e.getFailureInfo();
            if (failure.getErrorType() == ErrorType.CONFIGURATION_ERROR
                    || failure.getErrorType() == ErrorType.VALIDATION_ERROR
                    || failure.getErrorType() == ErrorType.UNRECOVERABLE_ERROR) {
                return TransactionResult.unrecoverable(null, failure);
            }
            return TransactionResult.rollback(failure);
        } catch (RuntimeException e) {
            return TransactionResult.rollback(FailureInfo.fromException(e, ErrorType.EXECUTION_ERROR, name));
        }
    }
}
