package xyz.firestige.engine.domain.service;

public enum DatabaseType {

    POSTGRESQL("PostgreSQL", "postgresql", 5432),
    MYSQL("MySQL", "mysql", 3306),
    MONGODB("MongoDB", "mongodb", 27017),
    REDIS("Redis", "redis", 6379);

    private final String displayName;
    private final String directoryName;
    private final int defaultPort;

    DatabaseType(String displayName, String directoryName, int defaultPort) {
        this.displayName = displayName;
        this.directoryName = directoryName;
        this.defaultPort = defaultPort;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDirectoryName() {
        return directoryName;
    }

    public int getDefaultPort() {
        return defaultPort;
    }
}
