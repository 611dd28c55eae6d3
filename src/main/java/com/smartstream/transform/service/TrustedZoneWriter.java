package com.smartstream.transform.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.smartstream.transform.model.CleanedRecord;
import com.smartstream.transform.model.RouteBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Persists route batches as newline-delimited JSON in the trusted zone.
 */
@Service
public class TrustedZoneWriter {

    private static final Logger logger = LoggerFactory.getLogger(TrustedZoneWriter.class);

    private final S3StorageService s3StorageService;
    private final TrustedKeyGenerator trustedKeyGenerator;
    private final ObjectWriter lineWriter;

    public TrustedZoneWriter(S3StorageService s3StorageService,
                             TrustedKeyGenerator trustedKeyGenerator,
                             ObjectMapper objectMapper) {
        this.s3StorageService = s3StorageService;
        this.trustedKeyGenerator = trustedKeyGenerator;
        this.lineWriter = objectMapper.writer().without(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Writes every non-empty batch. All batches are attempted; if any write fails, a
     * {@link StorageException} carrying each failure is thrown once the others have been tried.
     *
     * @return the keys that were written, in batch order
     */
    public List<String> writeAll(String bucket, String sourceKey, Collection<RouteBatch> batches) {
        List<String> written = new ArrayList<>();
        List<StorageException> failures = new ArrayList<>();
        for (RouteBatch batch : batches) {
            if (batch.isEmpty()) {
                continue;
            }
            String trustedKey = trustedKeyGenerator.trustedKey(sourceKey, batch.getRoute());
            try {
                s3StorageService.putJson(bucket, trustedKey, toNdjson(batch));
                written.add(trustedKey);
                logger.info("Wrote {} record(s) for route {} from {} to {}",
                        batch.size(), batch.getRoute(), sourceKey, trustedKey);
            } catch (StorageException e) {
                logger.error("Failed to write route {} of {}: {}", batch.getRoute(), sourceKey, e.getMessage(), e);
                failures.add(e);
            }
        }

        if (!failures.isEmpty()) {
            StorageException combined = new StorageException("Failed to write " + failures.size() + " of "
                    + (written.size() + failures.size()) + " route output(s) for " + sourceKey,
                    failures.get(0));
            failures.stream().skip(1).forEach(combined::addSuppressed);
            throw combined;
        }
        return written;
    }

    /**
     * Serializes the batch as one compact JSON object per line.
     */
    byte[] toNdjson(RouteBatch batch) {
        StringBuilder body = new StringBuilder();
        for (CleanedRecord record : batch.getRecords()) {
            try {
                body.append(lineWriter.writeValueAsString(record.getFields())).append('\n');
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Could not serialize record for route " + batch.getRoute(), e);
            }
        }
        return body.toString().getBytes(StandardCharsets.UTF_8);
    }
}
