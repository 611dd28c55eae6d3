package com.smartstream.transform.service;

import com.smartstream.transform.model.Compression;
import com.smartstream.transform.model.RawPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.ServerSideEncryption;

/**
 * Single-shot reads and writes against the data-lake bucket. Failures surface as
 * {@link StorageException}; retrying is left to whoever redelivers the notification.
 */
@Service
public class S3StorageService {

    private static final Logger logger = LoggerFactory.getLogger(S3StorageService.class);

    static final String JSON_CONTENT_TYPE = "application/json";

    private final S3Client s3Client;

    public S3StorageService(S3Client s3Client) {
        this.s3Client = s3Client;
    }

    /**
     * Downloads a raw object together with its compression marker.
     */
    public RawPayload readRawObject(String bucket, String key) {
        try {
            ResponseBytes<GetObjectResponse> response = s3Client.getObjectAsBytes(GetObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build());
            byte[] content = response.asByteArray();
            Compression compression = Compression.detect(key, response.response().contentEncoding());
            logger.info("Read {} bytes from s3://{}/{}", content.length, bucket, key);
            return new RawPayload(key, content, compression);
        } catch (SdkException e) {
            throw new StorageException("Failed to read s3://" + bucket + "/" + key + ": " + e.getMessage(), e);
        }
    }

    /**
     * Writes a JSON object, replacing whatever is stored under the key.
     */
    public void putJson(String bucket, String key, byte[] body) {
        try {
            s3Client.putObject(PutObjectRequest.builder()
                            .bucket(bucket)
                            .key(key)
                            .contentType(JSON_CONTENT_TYPE)
                            .serverSideEncryption(ServerSideEncryption.AES256)
                            .build(),
                    RequestBody.fromBytes(body));
            logger.info("Written {} bytes to s3://{}/{}", body.length, bucket, key);
        } catch (SdkException e) {
            throw new StorageException("Failed to write s3://" + bucket + "/" + key + ": " + e.getMessage(), e);
        }
    }
}
