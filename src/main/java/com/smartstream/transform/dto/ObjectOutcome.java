package com.smartstream.transform.dto;

import java.util.List;

/**
 * Result of transforming one raw object.
 *
 * @param status      WRITTEN, EMPTY, SKIPPED or FAILED
 * @param trustedKeys keys written to the trusted zone, in route order
 */
public record ObjectOutcome(
        String bucket,
        String sourceKey,
        Status status,
        int valuesParsed,
        int recordsWritten,
        int duplicatesDropped,
        List<String> trustedKeys,
        String message
) {

    public enum Status { WRITTEN, EMPTY, SKIPPED, FAILED }

    public static ObjectOutcome skipped(String bucket, String sourceKey, String message) {
        return new ObjectOutcome(bucket, sourceKey, Status.SKIPPED, 0, 0, 0, List.of(), message);
    }

    public static ObjectOutcome failed(String bucket, String sourceKey, String message) {
        return new ObjectOutcome(bucket, sourceKey, Status.FAILED, 0, 0, 0, List.of(), message);
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }
}
