package xyz.firestige.engine.domain.environment;

public enum EnvironmentKind {
    PRODUCTION,
    DEVELOPMENT
}
