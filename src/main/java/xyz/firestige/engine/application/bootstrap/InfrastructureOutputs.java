package xyz.firestige.engine.application.bootstrap;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 前置基础设施步骤渲染出的输出文件（JSON）
 * <p>
 * 日志存储的访问凭据只在这里出现，不写入日志。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class InfrastructureOutputs {

    private final String logStorageAccessId;
    private final String logStorageSecretKey;
    private final String logStorageRegion;
    private final String logStorageHost;
    private final String logStorageBucketName;

    @JsonCreator
    public InfrastructureOutputs(
            @JsonProperty(value = "log_storage_access_id", required = true) String logStorageAccessId,
            @JsonProperty(value = "log_storage_secret_key", required = true) String logStorageSecretKey,
            @JsonProperty(value = "log_storage_region", required = true) String logStorageRegion,
            @JsonProperty(value = "log_storage_host", required = true) String logStorageHost,
            @JsonProperty(value = "log_storage_bucket_name", required = true) String logStorageBucketName) {
        this.logStorageAccessId = logStorageAccessId;
        this.logStorageSecretKey = logStorageSecretKey;
        this.logStorageRegion = logStorageRegion;
        this.logStorageHost = logStorageHost;
        this.logStorageBucketName = logStorageBucketName;
    }

    public String getLogStorageAccessId() {
        return logStorageAccessId;
    }

    public String getLogStorageSecretKey() {
        return logStorageSecretKey;
    }

    public String getLogStorageRegion() {
        return logStorageRegion;
    }

    public String getLogStorageHost() {
        return logStorageHost;
    }

    public String getLogStorageBucketName() {
        return logStorageBucketName;
    }

    @Override
    public String toString() {
        return "InfrastructureOutputs{region=" + logStorageRegion + ", host=" + logStorageHost + ", bucket=" + logStorageBucketName + "}";
    }
}
