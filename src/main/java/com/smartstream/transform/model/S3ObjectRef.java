package com.smartstream.transform.model;

/**
 * Bucket and key of an object named by a storage notification.
 */
public record S3ObjectRef(String bucket, String key) {

    public String toUri() {
        return "s3://" + bucket + "/" + key;
    }

    @Override
    public String toString() {
        return toUri();
    }
}
