package xyz.firestige.engine.domain.version;

import xyz.firestige.engine.domain.service.DatabaseMode;
import xyz.firestige.engine.domain.service.DatabaseType;

/**
 * 数据库引擎支持版本查询
 * <p>
 * 支持的版本属于数据而非编排逻辑，由宿主按云厂商注入。
 */
@FunctionalInterface
public interface SupportedVersionLookup {

    /**
     * 将请求的版本解析为实际部署的版本
     *
     * @throws xyz.firestige.engine.domain.shared.exception.EngineException 版本不受支持（VALIDATION_ERROR）
     */
    String resolve(DatabaseType type, DatabaseMode mode, String requestedVersion);
}
