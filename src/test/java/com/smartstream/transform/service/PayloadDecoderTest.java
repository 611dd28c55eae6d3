package com.smartstream.transform.service;

import com.smartstream.transform.model.Compression;
import com.smartstream.transform.model.RawPayload;
import com.smartstream.transform.model.StageResult;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPOutputStream;

import static org.assertj.core.api.Assertions.assertThat;

class PayloadDecoderTest {

    private final PayloadDecoder decoder = new PayloadDecoder();

    @Test
    void decodesPlainUtf8() {
        StageResult<String> result = decoder.decode(payload("raw/a.json", "{\"name\":\"Åse\"}".getBytes(StandardCharsets.UTF_8), Compression.NONE));

        assertThat(result.orElseThrow()).isEqualTo("{\"name\":\"Åse\"}");
    }

    @Test
    void gunzipsMarkedPayload() throws IOException {
        StageResult<String> result = decoder.decode(payload("raw/a.json.gz", gzip("{\"id\":1}\n"), Compression.GZIP));

        assertThat(result.orElseThrow()).isEqualTo("{\"id\":1}\n");
    }

    @Test
    void gunzipsUnmarkedPayloadByMagicBytes() throws IOException {
        StageResult<String> result = decoder.decode(payload("raw/a.json", gzip("{\"id\":1}"), Compression.NONE));

        assertThat(result.orElseThrow()).isEqualTo("{\"id\":1}");
    }

    @Test
    void failsOnCorruptGzip() {
        StageResult<String> result = decoder.decode(payload("raw/a.gz", "not gzip".getBytes(StandardCharsets.UTF_8), Compression.GZIP));

        assertThat(result.isFatal()).isTrue();
        assertThat(result.getReason()).contains("raw/a.gz");
        assertThat(result.getCause()).isInstanceOf(IOException.class);
    }

    @Test
    void failsOnInvalidUtf8() {
        StageResult<String> result = decoder.decode(payload("raw/a.json", new byte[]{'{', (byte) 0xC3, (byte) 0x28, '}'}, Compression.NONE));

        assertThat(result.isFatal()).isTrue();
    }

    @Test
    void stripsByteOrderMark() {
        byte[] withBom = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF, '{', '}'};

        assertThat(decoder.decode(payload("raw/a.json", withBom, Compression.NONE)).orElseThrow()).isEqualTo("{}");
    }

    @Test
    void decodesEmptyPayloadToEmptyText() {
        assertThat(decoder.decode(payload("raw/a.json", new byte[0], Compression.NONE)).orElseThrow()).isEmpty();
    }

    private static RawPayload payload(String key, byte[] bytes, Compression compression) {
        return new RawPayload(key, bytes, compression);
    }

    private static byte[] gzip(String text) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (GZIPOutputStream gz = new GZIPOutputStream(out)) {
            gz.write(text.getBytes(StandardCharsets.UTF_8));
        }
        return out.toByteArray();
    }
}
