package xyz.firestige.engine.domain.progress;

import java.util.Objects;

/**
 * 进度事件归属对象
 */
public final class ProgressScope {

    public enum Kind {
        ENVIRONMENT,
        APPLICATION,
        DATABASE,
        ROUTER,
        INFRASTRUCTURE
    }

    private final Kind kind;
    private final String id;

    private ProgressScope(Kind kind, String id) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.id = Objects.requireNonNull(id, "id");
    }

    public static ProgressScope of(Kind kind, String id) {
        return new ProgressScope(kind, id);
    }

    public static ProgressScope environment(String id) {
        return new ProgressScope(Kind.ENVIRONMENT, id);
    }

    public static ProgressScope infrastructure(String id) {
        return new ProgressScope(Kind.INFRASTRUCTURE, id);
    }

    public Kind getKind() {
        return kind;
    }

    public String getId() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProgressScope that)) return false;
        return kind == that.kind && id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, id);
    }

    @Override
    public String toString() {
        return kind + ":" + id;
    }
}
