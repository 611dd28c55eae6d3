package com.smartstream.transform.service;

import com.smartstream.transform.model.Compression;
import com.smartstream.transform.model.RawPayload;
import com.smartstream.transform.model.StageResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPInputStream;

/**
 * Turns the bytes of a raw object into the text handed to the JSON parser.
 */
@Service
public class PayloadDecoder {

    private static final Logger logger = LoggerFactory.getLogger(PayloadDecoder.class);

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    public StageResult<String> decode(RawPayload payload) {
        byte[] bytes = payload.getContent();
        boolean gzipped = payload.getCompression() == Compression.GZIP || hasGzipMagic(bytes);
        if (gzipped) {
            try {
                bytes = gunzip(bytes);
            } catch (IOException e) {
                return StageResult.fatal("Corrupt gzip content in " + payload.getSourceKey(), e);
            }
        }

        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            return StageResult.fatal("Content of " + payload.getSourceKey() + " is not valid UTF-8", e);
        }
        if (!text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK) {
            text = text.substring(1);
        }
        logger.debug("Decoded {} bytes ({}) from {} into {} chars",
                payload.size(), gzipped ? "gzip" : "plain", payload.getSourceKey(), text.length());
        return StageResult.ok(text);
    }

    private static boolean hasGzipMagic(byte[] bytes) {
        return bytes.length >= 2 && (bytes[0] & 0xff) == 0x1f && (bytes[1] & 0xff) == 0x8b;
    }

    private static byte[] gunzip(byte[] bytes) throws IOException {
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(bytes))) {
            return in.readAllBytes();
        }
    }
}
