package xyz.firestige.engine.domain.cluster;

import xyz.firestige.engine.domain.chart.ChartInfo;
import xyz.firestige.engine.domain.version.VersionsNumber;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * 集群包管理器调用
 * <p>
 * 失败时抛出 {@link xyz.firestige.engine.domain.shared.exception.CommandException}，携带安全消息与原始输出。
 */
public interface HelmClient {

    /**
     * 安装或升级，超时取 {@link ChartInfo#getTimeout()}
     */
    HelmDeploymentStatus upgrade(ChartInfo chart, List<Path> valuesFiles);

    void uninstall(String releaseName, String namespace);

    void rollback(String releaseName, String namespace);

    /**
     * 已安装 release 的 chart 版本，未安装时为空
     */
    Optional<VersionsNumber> installedVersion(String releaseName, String namespace);
}
