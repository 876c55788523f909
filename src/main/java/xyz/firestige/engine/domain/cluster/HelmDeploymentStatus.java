package xyz.firestige.engine.domain.cluster;

/**
 * helm 最近一次部署状态
 */
public final class HelmDeploymentStatus {

    private final String releaseName;
    private final int revision;
    private final String status;

    private HelmDeploymentStatus(String releaseName, int revision, String status) {
        this.releaseName = releaseName;
        this.revision = revision;
        this.status = status;
    }

    public static HelmDeploymentStatus of(String releaseName, int revision, String status) {
        return new HelmDeploymentStatus(releaseName, revision, status);
    }

    public String getReleaseName() {
        return releaseName;
    }

    public int getRevision() {
        return revision;
    }

    public String getStatus() {
        return status;
    }

    public boolean isDeployed() {
        return "deployed".equalsIgnoreCase(status);
    }

    @Override
    public String toString() {
        return releaseName + "@" + revision + "(" + status + ")";
    }
}
