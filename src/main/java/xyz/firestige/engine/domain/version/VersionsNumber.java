package xyz.firestige.engine.domain.version;

import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * 版本号值对象：major[.minor[.patch]][-suffix]
 * <p>
 * 解析时去掉前缀 {@code v} 和构建元数据 {@code +...}。
 */
public final class VersionsNumber implements Comparable<VersionsNumber> {

    private static final Comparator<VersionsNumber> ORDER = Comparator
            .comparingInt((VersionsNumber v) -> v.major)
            .thenComparingInt(v -> v.minor == null ? 0 : v.minor)
            .thenComparingInt(v -> v.patch == null ? 0 : v.patch);

    private final int major;
    private final Integer minor;
    private final Integer patch;
    private final String suffix;

    public VersionsNumber(int major, Integer minor, Integer patch, String suffix) {
        if (minor == null && patch != null) {
            throw new IllegalArgumentException("patch requires minor");
        }
        this.major = major;
        this.minor = minor;
        this.patch = patch;
        this.suffix = suffix == null || suffix.isEmpty() ? null : suffix;
    }

    public static VersionsNumber of(int major, int minor, int patch) {
        return new VersionsNumber(major, minor, patch, null);
    }

    /**
     * @throws IllegalArgumentException 版本为空或格式不正确
     */
    public static VersionsNumber parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("version cannot be empty");
        }
        String value = raw.trim();
        if (value.startsWith("v") || value.startsWith("V")) {
            value = value.substring(1);
        }
        int plus = value.indexOf('+');
        if (plus >= 0) {
            value = value.substring(0, plus);
        }
        String suffix = null;
        int dash = value.indexOf('-');
        if (dash >= 0) {
            suffix = value.substring(dash + 1);
            value = value.substring(0, dash);
        }
        String[] parts = value.split("\\.");
        if (parts.length == 0 || parts.length > 3 || value.isEmpty()) {
            throw new IllegalArgumentException("invalid version: " + raw);
        }
        try {
            int major = Integer.parseInt(parts[0]);
            Integer minor = parts.length > 1 ? Integer.parseInt(parts[1]) : null;
            Integer patch = parts.length > 2 ? Integer.parseInt(parts[2]) : null;
            return new VersionsNumber(major, minor, patch, suffix);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid version: " + raw, e);
        }
    }

    public int getMajor() {
        return major;
    }

    public Optional<Integer> getMinor() {
        return Optional.ofNullable(minor);
    }

    public Optional<Integer> getPatch() {
        return Optional.ofNullable(patch);
    }

    public Optional<String> getSuffix() {
        return Optional.ofNullable(suffix);
    }

    /**
     * "13"
     */
    public String toMajorString() {
        return String.valueOf(major);
    }

    /**
     * "13.4"，没有 minor 时等同于 {@link #toMajorString()}
     */
    public String toMajorMinorString() {
        return minor == null ? toMajorString() : major + "." + minor;
    }

    @Override
    public int compareTo(VersionsNumber other) {
        return ORDER.compare(this, other);
    }

    public boolean isOlderThan(VersionsNumber other) {
        return compareTo(other) < 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VersionsNumber that)) return false;
        return major == that.major && Objects.equals(minor, that.minor)
                && Objects.equals(patch, that.patch) && Objects.equals(suffix, that.suffix);
    }

    @Override
    public int hashCode() {
        return Objects.hash(major, minor, patch, suffix);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder().append(major);
        if (minor != null) {
            sb.append('.').append(minor);
        }
        if (patch != null) {
            sb.append('.').append(patch);
        }
        if (suffix != null) {
            sb.append('-').append(suffix);
        }
        return sb.toString();
    }
}
