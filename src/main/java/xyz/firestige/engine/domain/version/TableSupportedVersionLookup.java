package xyz.firestige.engine.domain.version;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.engine.domain.service.DatabaseMode;
import xyz.firestige.engine.domain.service.DatabaseType;
import xyz.firestige.engine.domain.shared.exception.EngineException;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于查找表的版本解析
 * <p>
 * 按请求版本的精度（major.minor.patch、major.minor 或 major）查找；未注册表的引擎/模式组合不做约束，原样返回请求的版本。
 */
public class TableSupportedVersionLookup implements SupportedVersionLookup {

    private static final Logger log = LoggerFactory.getLogger(TableSupportedVersionLookup.class);

    private final Map<String, Map<String, String>> tables = new ConcurrentHashMap<>();

    public TableSupportedVersionLookup register(DatabaseType type, DatabaseMode mode, Map<String, String> versions) {
        tables.merge(key(type, mode), new HashMap<>(versions), (a, b) -> {
            Map<String, String> merged = new HashMap<>(a);
            merged.putAll(b);
            return merged;
        });
        return this;
    }

    @Override
    public String resolve(DatabaseType type, DatabaseMode mode, String requestedVersion) {
        VersionsNumber requested;
        try {
            requested = VersionsNumber.parse(requestedVersion);
        } catch (IllegalArgumentException e) {
            throw EngineException.validation(type.getDisplayName() + " version '" + requestedVersion + "' is invalid: " + e.getMessage());
        }

        Map<String, String> table = tables.get(key(type, mode));
        if (table == null) {
            log.debug("未注册版本表，按原样使用: type={}, mode={}, version={}", type, mode, requestedVersion);
            return requestedVersion;
        }

        String found;
        if (requested.getPatch().isPresent()) {
            found = table.get(requested.getMajor() + "." + requested.getMinor().get() + "." + requested.getPatch().get());
        } else if (requested.getMinor().isPresent()) {
            found = table.get(requested.toMajorMinorString());
        } else {
            found = table.get(requested.toMajorString());
        }
        if (found == null) {
            throw EngineException.validation(type.getDisplayName() + " " + requestedVersion + " version is not supported");
        }
        return found;
    }

    private static String key(DatabaseType type, DatabaseMode mode) {
        return type.name() + "/" + mode.name();
    }
}
