package xyz.firestige.engine.domain.environment;

import xyz.firestige.engine.domain.service.Action;

import java.util.Optional;

/**
 * 对环境执行的操作
 * <p>
 * DEPLOY 按每个服务自身声明的动作执行；PAUSE / DELETE 对所有服务强制使用对应动作。
 */
public enum EnvironmentOperation {

    DEPLOY(null),
    PAUSE(Action.PAUSE),
    DELETE(Action.DELETE);

    private final Action forcedAction;

    EnvironmentOperation(Action forcedAction) {
        this.forcedAction = forcedAction;
    }

    public Optional<Action> getForcedAction() {
        return Optional.ofNullable(forcedAction);
    }

    public String displayName() {
        return name().toLowerCase();
    }
}
