package com.smartstream.transform.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CompressionTest {

    @Test
    void detectsGzipFromSuffixOrContentEncoding() {
        assertThat(Compression.detect("raw/a.json.gz", null)).isEqualTo(Compression.GZIP);
        assertThat(Compression.detect("raw/a.GZIP", null)).isEqualTo(Compression.GZIP);
        assertThat(Compression.detect("raw/a.json", "gzip")).isEqualTo(Compression.GZIP);
        assertThat(Compression.detect("raw/a.json", null)).isEqualTo(Compression.NONE);
    }

    @Test
    void returnsSuffixWithOriginalCase() {
        assertThat(Compression.compressionSuffix("raw/a.json.GZ")).isEqualTo(".GZ");
        assertThat(Compression.compressionSuffix("raw/a.json")).isNull();
    }
}
