package xyz.firestige.engine.domain.environment;

import java.util.Objects;
import java.util.Optional;

/**
 * 环境动作：单个环境，或主环境加故障切换环境
 */
public final class EnvironmentAction {

    public enum Kind {
        ENVIRONMENT,
        ENVIRONMENT_WITH_FAILOVER
    }

    private final Environment primary;
    private final Environment failover;

    private EnvironmentAction(Environment primary, Environment failover) {
        this.primary = Objects.requireNonNull(primary, "primary");
        this.failover = failover;
    }

    public static EnvironmentAction of(Environment environment) {
        return new EnvironmentAction(environment, null);
    }

    public static EnvironmentAction withFailover(Environment primary, Environment failover) {
        return new EnvironmentAction(primary, Objects.requireNonNull(failover, "failover"));
    }

    public Kind getKind() {
        return failover == null ? Kind.ENVIRONMENT : Kind.ENVIRONMENT_WITH_FAILOVER;
    }

    public Environment getPrimary() {
        return primary;
    }

    public Optional<Environment> getFailover() {
        return Optional.ofNullable(failover);
    }

    @Override
    public String toString() {
        return failover == null ? "Environment(" + primary.getId() + ")"
                : "EnvironmentWithFailover(" + primary.getId() + ", " + failover.getId() + ")";
    }
}
