package xyz.firestige.engine.domain.shared.exception;

/**
 * 错误类型枚举
 * 用于区分检查失败、执行失败与不可恢复失败，决定编排器的处理方式
 */
public enum ErrorType {

    /**
     * 预检失败，未发生任何状态变更
     */
    VALIDATION_ERROR("校验错误", false),

    /**
     * 生命周期钩子或 chart 安装在变更开始后失败，触发回滚或故障切换
     */
    EXECUTION_ERROR("执行错误", true),

    /**
     * 主环境与故障切换环境均失败，或必需的前置文件缺失/无法解析
     */
    UNRECOVERABLE_ERROR("不可恢复错误", false),

    /**
     * 服务类型不支持请求的动作
     */
    NOT_IMPLEMENTED("未实现", false),

    /**
     * 配置文件缺失或格式错误
     */
    CONFIGURATION_ERROR("配置错误", false),

    /**
     * 外部命令（helm / kubectl）返回非零退出码
     */
    COMMAND_ERROR("命令执行错误", true),

    /**
     * 超时错误
     */
    TIMEOUT_ERROR("超时错误", true),

    /**
     * 事务被取消
     */
    CANCELLED("已取消", false),

    /**
     * 系统错误
     */
    SYSTEM_ERROR("系统错误", false);

    private final String description;
    private final boolean retryable;

    ErrorType(String description, boolean retryable) {
        this.description = description;
        this.retryable = retryable;
    }

    public String getDescription() {
        return description;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
