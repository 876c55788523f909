package xyz.firestige.engine.domain.version;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 支持版本表生成工具
 * <p>
 * 对一个 major 版本的 minor / patch 区间生成查找表：
 * "13" 与 "13.x" 映射到区间内最新版本，"13.x.y" 映射到自身。
 */
public final class SupportedVersions {

    private SupportedVersions() {
    }

    /**
     * @param patchMin 为 null 时只生成 major / major.minor 两级
     * @param suffix 追加到完整版本号后的后缀（可为 null）
     */
    public static Map<String, String> generate(int major, int minorMin, int minorMax,
                                               Integer patchMin, Integer patchMax, String suffix) {
        if (minorMin > minorMax) {
            throw new IllegalArgumentException("minorMin must be <= minorMax");
        }
        if ((patchMin == null) != (patchMax == null) || (patchMin != null && patchMin > patchMax)) {
            throw new IllegalArgumentException("invalid patch range");
        }
        String tail = suffix == null || suffix.isEmpty() ? "" : "-" + suffix;
        Map<String, String> versions = new LinkedHashMap<>();
        for (int minor = minorMin; minor <= minorMax; minor++) {
            String majorMinor = major + "." + minor;
            if (patchMin == null) {
                versions.put(majorMinor, majorMinor + tail);
                continue;
            }
            for (int patch = patchMin; patch <= patchMax; patch++) {
                String full = majorMinor + "." + patch;
                versions.put(full, full + tail);
            }
            versions.put(majorMinor, majorMinor + "." + patchMax + tail);
        }
        versions.put(String.valueOf(major), versions.get(major + "." + minorMax));
        return versions;
    }
}
