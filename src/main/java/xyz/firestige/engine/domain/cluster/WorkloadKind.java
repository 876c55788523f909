package xyz.firestige.engine.domain.cluster;

public enum WorkloadKind {

    DEPLOYMENT("deployment"),
    STATEFUL_SET("statefulset");

    private final String resourceName;

    WorkloadKind(String resourceName) {
        this.resourceName = resourceName;
    }

    public String getResourceName() {
        return resourceName;
    }
}
