package xyz.firestige.engine.domain.service;

import xyz.firestige.engine.domain.progress.ProgressScope;

public enum ServiceType {

    APPLICATION(false, ProgressScope.Kind.APPLICATION),
    DATABASE(true, ProgressScope.Kind.DATABASE),
    ROUTER(false, ProgressScope.Kind.ROUTER);

    private final boolean stateful;
    private final ProgressScope.Kind scopeKind;

    ServiceType(boolean stateful, ProgressScope.Kind scopeKind) {
        this.stateful = stateful;
        this.scopeKind = scopeKind;
    }

    public boolean isStateful() {
        return stateful;
    }

    public ProgressScope.Kind getScopeKind() {
        return scopeKind;
    }
}
