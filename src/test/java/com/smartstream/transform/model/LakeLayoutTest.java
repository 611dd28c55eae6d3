package com.smartstream.transform.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LakeLayoutTest {

    @Test
    void normalizesPrefixes() {
        LakeLayout layout = new LakeLayout("lake", "/raw", "trusted/", " analytics ");

        assertThat(layout.getRawPrefix()).isEqualTo("raw/");
        assertThat(layout.getTrustedPrefix()).isEqualTo("trusted/");
        assertThat(layout.getAnalyticsPrefix()).isEqualTo("analytics/");
    }

    @Test
    void rejectsOutputZonesUnderRawZone() {
        assertThatThrownBy(() -> new LakeLayout("lake", "raw/", "raw/trusted/", "analytics/"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Trusted prefix");
        assertThatThrownBy(() -> new LakeLayout("lake", "raw/", "trusted/", "raw/analytics"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Analytics prefix");
    }

    @Test
    void allowsSiblingPrefixSharingLeadingCharacters() {
        LakeLayout layout = new LakeLayout("lake", "raw/", "raw-trusted/", "analytics/");

        assertThat(layout.isRawKey("raw-trusted/hr/a.json")).isFalse();
    }

    @Test
    void recognizesRawKeys() {
        LakeLayout layout = new LakeLayout("lake", "raw/", "trusted/", "analytics/");

        assertThat(layout.isRawKey("raw/2026/a.json")).isTrue();
        assertThat(layout.isRawKey("raw/")).isFalse();
        assertThat(layout.isRawKey("trusted/hr/a.json")).isFalse();
        assertThat(layout.isRawKey(null)).isFalse();
    }

    @Test
    void rejectsBlankPrefix() {
        assertThatThrownBy(() -> new LakeLayout("lake", " ", "trusted/", "analytics/"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
