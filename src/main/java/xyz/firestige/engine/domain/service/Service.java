package xyz.firestige.engine.domain.service;

import xyz.firestige.engine.domain.environment.DeploymentTarget;
import xyz.firestige.engine.domain.progress.ProgressListeners;
import xyz.firestige.engine.domain.progress.ProgressScope;
import xyz.firestige.engine.domain.shared.exception.EngineException;

import java.time.Duration;
import java.util.Optional;

/**
 * 可部署服务的生命周期契约
 * <p>
 * 每个动作有三个钩子：
 * <ul>
 *   <li>{@code onXxxCheck}：预检，在任何变更之前执行</li>
 *   <li>{@code onXxx}：主钩子，阻塞调用外部系统</li>
 *   <li>{@code onXxxError}：主钩子失败后的清理，自身失败只记录，不覆盖原始错误</li>
 * </ul>
 * 钩子通过抛出 {@link EngineException} 表示失败。
 * <p>
 * 实现固定为 {@link Application}、{@link Database}、{@link Router} 三种。
 */
public interface Service {

    /**
     * 稳定标识，在服务生命周期内不变
     */
    String getId();

    String getName();

    /**
     * 用于工作目录与集群资源命名的规范化名称
     */
    String getSanitizedName();

    String getReleaseName();

    ServiceType getType();

    Action getAction();

    Sizing getSizing();

    Optional<Integer> getPrivatePort();

    /**
     * 主钩子成功返回后，等待服务就绪的最长时间
     */
    Duration getStartTimeout();

    String getVersion();

    ProgressListeners getListeners();

    /**
     * 就绪检查使用的 pod 选择器，没有 pod 的服务返回空
     */
    Optional<String> podSelector(DeploymentTarget target);

    default ProgressScope progressScope() {
        return ProgressScope.of(getType().getScopeKind(), getId());
    }

    RenderContext renderContext(DeploymentTarget target);

    void onCreateCheck(DeploymentTarget target);

    void onCreate(DeploymentTarget target);

    void onCreateError(DeploymentTarget target);

    void onPauseCheck(DeploymentTarget target);

    void onPause(DeploymentTarget target);

    void onPauseError(DeploymentTarget target);

    void onDeleteCheck(DeploymentTarget target);

    void onDelete(DeploymentTarget target);

    void onDeleteError(DeploymentTarget target);

    /**
     * 是否支持指定动作；CREATE / PAUSE / DELETE 始终支持
     */
    default boolean supports(Action action) {
        return !action.isCapabilityGated();
    }

    default void onUpgrade(DeploymentTarget target) {
        throw notImplemented(Action.UPGRADE);
    }

    default void onDowngrade(DeploymentTarget target) {
        throw notImplemented(Action.DOWNGRADE);
    }

    default void onBackup(DeploymentTarget target) {
        throw notImplemented(Action.BACKUP);
    }

    default void onRestore(DeploymentTarget target) {
        throw notImplemented(Action.RESTORE);
    }

    default void onClone(DeploymentTarget target) {
        throw notImplemented(Action.CLONE);
    }

    private EngineException notImplemented(Action action) {
        return EngineException.notImplemented(getType().name().toLowerCase() + " " + getName()
                + " does not support action " + action.displayName());
    }
}
