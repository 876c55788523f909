package xyz.firestige.engine.domain.environment;

import xyz.firestige.engine.domain.service.Action;
import xyz.firestige.engine.domain.service.Service;
import xyz.firestige.engine.domain.shared.vo.ExecutionId;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 环境：有序的服务集合加元数据
 * <p>
 * 一个服务在一次事务内只属于一个环境。executionId 每次部署尝试唯一。
 */
public final class Environment {

    private final String id;
    private final String projectId;
    private final String name;
    private final EnvironmentKind kind;
    private final String namespace;
    private final ExecutionId executionId;
    private final Action action;
    private final List<Service> services;

    private Environment(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id");
        this.projectId = b.projectId;
        this.name = b.name == null ? b.id : b.name;
        this.kind = Objects.requireNonNull(b.kind, "kind");
        this.namespace = b.namespace == null ? "env-" + b.id : b.namespace;
        this.executionId = b.executionId == null ? ExecutionId.generate() : b.executionId;
        this.action = Objects.requireNonNull(b.action, "action");
        this.services = List.copyOf(b.services);
        Set<String> ids = new HashSet<>();
        for (Service s : services) {
            if (!ids.add(s.getId())) {
                throw new IllegalArgumentException("duplicate service id in environment " + id + ": " + s.getId());
            }
        }
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() {
        return id;
    }

    public String getProjectId() {
        return projectId;
    }

    public String getName() {
        return name;
    }

    public EnvironmentKind getKind() {
        return kind;
    }

    public String getNamespace() {
        return namespace;
    }

    public ExecutionId getExecutionId() {
        return executionId;
    }

    public Action getAction() {
        return action;
    }

    public List<Service> getServices() {
        return services;
    }

    public boolean isProduction() {
        return kind == EnvironmentKind.PRODUCTION;
    }

    @Override
    public String toString() {
        return "Environment{id=" + id + ", kind=" + kind + ", namespace=" + namespace
                + ", executionId=" + executionId + ", services=" + services.size() + "}";
    }

    public static final class Builder {
        private final String id;
        private String projectId;
        private String name;
        private EnvironmentKind kind = EnvironmentKind.DEVELOPMENT;
        private String namespace;
        private ExecutionId executionId;
        private Action action = Action.CREATE;
        private final List<Service> services = new ArrayList<>();

        private Builder(String id) {
            this.id = id;
        }

        public Builder projectId(String projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder kind(EnvironmentKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder namespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder executionId(ExecutionId executionId) {
            this.executionId = executionId;
            return this;
        }

        public Builder action(Action action) {
            this.action = action;
            return this;
        }

        public Builder service(Service service) {
            this.services.add(service);
            return this;
        }

        public Builder services(List<? extends Service> services) {
            this.services.addAll(services);
            return this;
        }

        public Environment build() {
            return new Environment(this);
        }
    }
}
