package xyz.firestige.engine.domain.service;

import java.util.Locale;

/**
 * 服务命名规则
 */
public final class ServiceNames {

    public static final int MAX_RELEASE_NAME_LENGTH = 50;

    private ServiceNames() {
    }

    /**
     * "&lt;prefix&gt;-&lt;id&gt;"，小写，下划线替换为中划线
     */
    public static String sanitize(String prefix, String id) {
        return (prefix + "-" + id).toLowerCase(Locale.ROOT).replace('_', '-');
    }

    /**
     * helm release 名称，非法字符替换为中划线，截断到 50 个字符
     */
    public static String releaseName(String prefix, String name, String id) {
        String raw = (prefix + "-" + name + "-" + id).toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9-]", "-");
        String cut = raw.length() > MAX_RELEASE_NAME_LENGTH ? raw.substring(0, MAX_RELEASE_NAME_LENGTH) : raw;
        while (cut.endsWith("-")) {
            cut = cut.substring(0, cut.length() - 1);
        }
        return cut;
    }
}
