package com.smartstream.transform.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.smartstream.transform.dto.ObjectOutcome;
import com.smartstream.transform.dto.TransformStatus;
import com.smartstream.transform.model.CleanedRecord;
import com.smartstream.transform.model.LakeLayout;
import com.smartstream.transform.model.RawPayload;
import com.smartstream.transform.model.RouteBatch;
import com.smartstream.transform.model.RoutedRow;
import com.smartstream.transform.model.S3ObjectRef;
import com.smartstream.transform.model.StageResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs the raw-to-trusted pipeline for objects named by storage notifications.
 *
 * <p>Per object: read, decode, split into JSON values, route, clean, group and deduplicate by
 * route, then write one NDJSON object per non-empty route. Nothing is written until every value
 * of the object has been routed and deduplicated. Objects are independent of each other and run
 * concurrently on the transform worker pool.
 */
@Service
public class RawToTrustedTransformService {

    private static final Logger logger = LoggerFactory.getLogger(RawToTrustedTransformService.class);

    private final S3StorageService s3StorageService;
    private final PayloadDecoder payloadDecoder;
    private final MultiValueJsonParser multiValueJsonParser;
    private final EnvelopeRouter envelopeRouter;
    private final RecordNormalizer recordNormalizer;
    private final BatchDeduplicator batchDeduplicator;
    private final TrustedZoneWriter trustedZoneWriter;
    private final LakeLayout lakeLayout;
    private final TaskExecutor taskExecutor;

    public RawToTrustedTransformService(S3StorageService s3StorageService,
                                        PayloadDecoder payloadDecoder,
                                        MultiValueJsonParser multiValueJsonParser,
                                        EnvelopeRouter envelopeRouter,
                                        RecordNormalizer recordNormalizer,
                                        BatchDeduplicator batchDeduplicator,
                                        TrustedZoneWriter trustedZoneWriter,
                                        LakeLayout lakeLayout,
                                        @Qualifier("rawObjectTransformExecutor") TaskExecutor taskExecutor) {
        this.s3StorageService = s3StorageService;
        this.payloadDecoder = payloadDecoder;
        this.multiValueJsonParser = multiValueJsonParser;
        this.envelopeRouter = envelopeRouter;
        this.recordNormalizer = recordNormalizer;
        this.batchDeduplicator = batchDeduplicator;
        this.trustedZoneWriter = trustedZoneWriter;
        this.lakeLayout = lakeLayout;
        this.taskExecutor = taskExecutor;
    }

    /**
     * Transforms every object, one task per object. A failing object is reported in the
     * returned status and does not stop the others.
     */
    public TransformStatus transformAll(List<S3ObjectRef> objects) {
        logger.info("Received {} object notification(s)", objects.size());
        List<CompletableFuture<ObjectOutcome>> futures = objects.stream()
                .map(ref -> CompletableFuture.supplyAsync(() -> transformObject(ref), taskExecutor))
                .collect(Collectors.toList());

        List<ObjectOutcome> outcomes = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            S3ObjectRef ref = objects.get(i);
            try {
                outcomes.add(futures.get(i).join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                logger.error("Unexpected failure while transforming {}: {}", ref, cause.getMessage(), cause);
                outcomes.add(ObjectOutcome.failed(ref.bucket(), ref.key(), cause.getMessage()));
            }
        }

        TransformStatus status = TransformStatus.of(outcomes);
        logger.info("{} ({} processed, {} failed)", status.getMessage(), status.getProcessedFiles(), status.getFailedFiles());
        return status;
    }

    /**
     * Transforms one object. Storage and decoding failures are logged and reported as
     * {@link ObjectOutcome.Status#FAILED}.
     */
    public ObjectOutcome transformObject(S3ObjectRef ref) {
        String bucket = ref.bucket();
        String key = ref.key();
        if (!lakeLayout.isRawKey(key)) {
            logger.info("Skipping non-raw object: s3://{}/{}", bucket, key);
            return ObjectOutcome.skipped(bucket, key, "not under " + lakeLayout.getRawPrefix());
        }

        logger.info("Processing file: s3://{}/{}", bucket, key);
        try {
            return process(bucket, key);
        } catch (StorageException | PayloadDecodingException e) {
            logger.error("Error during transformation of s3://{}/{}: {}", bucket, key, e.getMessage(), e);
            return ObjectOutcome.failed(bucket, key, e.getMessage());
        }
    }

    private ObjectOutcome process(String bucket, String key) {
        RawPayload payload = s3StorageService.readRawObject(bucket, key);
        StageResult<String> decoded = payloadDecoder.decode(payload);
        if (!decoded.isOk()) {
            throw new PayloadDecodingException(decoded.getReason(), decoded.getCause());
        }

        BatchDeduplicator.Grouping grouping = batchDeduplicator.newGrouping();
        int valuesParsed = 0;
        int routed = 0;
        int cleaned = 0;
        try (Stream<JsonNode> values = multiValueJsonParser.values(decoded.orElseThrow())) {
            for (JsonNode value : (Iterable<JsonNode>) values::iterator) {
                valuesParsed++;
                StageResult<RoutedRow> routedRow = envelopeRouter.route(value);
                if (!routedRow.isOk()) {
                    continue;
                }
                routed++;
                RoutedRow row = routedRow.orElseThrow();
                StageResult<CleanedRecord> record = recordNormalizer.normalize(row.row());
                if (!record.isOk()) {
                    continue;
                }
                cleaned++;
                grouping.add(row.route(), record.orElseThrow());
            }
        }

        Collection<RouteBatch> batches = grouping.batches().values();
        int kept = batches.stream().mapToInt(RouteBatch::size).sum();
        int duplicates = batches.stream().mapToInt(RouteBatch::getDuplicatesDropped).sum();
        logger.info("Transformed {} records from {} ({} values parsed, {} routed, {} cleaned, {} duplicates dropped)",
                kept, key, valuesParsed, routed, cleaned, duplicates);

        if (kept == 0) {
            logger.info("No valid records after transform. Skipping write for: {}", key);
            return new ObjectOutcome(bucket, key, ObjectOutcome.Status.EMPTY, valuesParsed, 0, duplicates,
                    List.of(), "no records survived filtering");
        }

        List<String> trustedKeys = trustedZoneWriter.writeAll(bucket, key, batches);
        logger.info("Successfully transformed: {} -> {}", key, trustedKeys);
        return new ObjectOutcome(bucket, key, ObjectOutcome.Status.WRITTEN, valuesParsed, kept, duplicates,
                trustedKeys, "written to " + trustedKeys.size() + " route(s)");
    }
}
