package xyz.firestige.engine.domain.version;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VersionsNumberTest {

    @Test
    void parse_stripsPrefixAndBuildMetadata() {
        VersionsNumber version = VersionsNumber.parse("v1.24.3-rc1+build.5");

        assertThat(version.getMajor()).isEqualTo(1);
        assertThat(version.getMinor()).contains(24);
        assertThat(version.getPatch()).contains(3);
        assertThat(version.getSuffix()).contains("rc1");
        assertThat(version).hasToString("1.24.3-rc1");
    }

    @Test
    void parse_partialVersions() {
        assertThat(VersionsNumber.parse("13").getMinor()).isEmpty();
        assertThat(VersionsNumber.parse("13.4").toMajorMinorString()).isEqualTo("13.4");
        assertThat(VersionsNumber.parse("13").toMajorMinorString()).isEqualTo("13");
    }

    @Test
    void parse_rejectsGarbage() {
        assertThatThrownBy(() -> VersionsNumber.parse("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> VersionsNumber.parse("1.2.3.4")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> VersionsNumber.parse("latest")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void ordering_treatsMissingPartsAsZero() {
        assertThat(VersionsNumber.parse("0.23.9").isOlderThan(VersionsNumber.parse("0.24.0"))).isTrue();
        assertThat(VersionsNumber.parse("0.24").compareTo(VersionsNumber.parse("0.24.0"))).isZero();
        assertThat(VersionsNumber.parse("1.0.0").isOlderThan(VersionsNumber.parse("0.99.99"))).isFalse();
    }
}
