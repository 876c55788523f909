package xyz.firestige.engine.domain.cluster;

import java.util.Map;
import java.util.Objects;

/**
 * 云厂商相关常量，显式传入编排逻辑，编排本身与厂商无关
 */
public final class CloudProviderSettings {

    private final String shortName;
    private final String libDirectoryName;
    private final Map<String, String> extraSettings;

    private CloudProviderSettings(String shortName, String libDirectoryName, Map<String, String> extraSettings) {
        this.shortName = Objects.requireNonNull(shortName, "shortName");
        this.libDirectoryName = Objects.requireNonNull(libDirectoryName, "libDirectoryName");
        this.extraSettings = extraSettings == null ? Map.of() : Map.copyOf(extraSettings);
    }

    public static CloudProviderSettings of(String shortName, String libDirectoryName) {
        return new CloudProviderSettings(shortName, libDirectoryName, Map.of());
    }

    public static CloudProviderSettings of(String shortName, String libDirectoryName, Map<String, String> extraSettings) {
        return new CloudProviderSettings(shortName, libDirectoryName, extraSettings);
    }

    public String getShortName() {
        return shortName;
    }

    public String getLibDirectoryName() {
        return libDirectoryName;
    }

    public Map<String, String> getExtraSettings() {
        return extraSettings;
    }

    @Override
    public String toString() {
        return shortName;
    }
}
