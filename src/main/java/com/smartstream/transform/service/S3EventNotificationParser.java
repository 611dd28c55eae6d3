package com.smartstream.transform.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smartstream.transform.model.S3ObjectRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Extracts the objects named by an S3 event notification, as delivered to SQS either directly
 * or wrapped in an SNS notification.
 */
@Service
public class S3EventNotificationParser {

    private static final Logger logger = LoggerFactory.getLogger(S3EventNotificationParser.class);

    private static final String OBJECT_CREATED_PREFIX = "ObjectCreated:";
    private static final String TEST_EVENT = "s3:TestEvent";

    private final ObjectMapper objectMapper;

    public S3EventNotificationParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses a notification body.
     *
     * @return the created objects, empty for test events and other event types
     * @throws IllegalArgumentException if the body is not a notification document
     */
    public List<S3ObjectRef> parse(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Notification body is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Notification body must be a JSON object");
        }

        if ("Notification".equals(root.path("Type").asText()) && root.path("Message").isTextual()) {
            return parse(root.get("Message").textValue());
        }
        if (TEST_EVENT.equals(root.path("Event").asText())) {
            logger.info("Ignoring S3 test event for bucket {}", root.path("Bucket").asText());
            return List.of();
        }
        return parse(root);
    }

    /**
     * Parses an already decoded notification document.
     */
    public List<S3ObjectRef> parse(JsonNode root) {
        JsonNode records = root.path("Records");
        if (!records.isArray()) {
            throw new IllegalArgumentException("Notification has no Records array");
        }

        List<S3ObjectRef> objects = new ArrayList<>();
        for (JsonNode record : records) {
            String eventName = record.path("eventName").asText("");
            if (!eventName.isEmpty() && !eventName.startsWith(OBJECT_CREATED_PREFIX)) {
                logger.debug("Ignoring {} event", eventName);
                continue;
            }
            String bucket = record.path("s3").path("bucket").path("name").asText("");
            String rawKey = record.path("s3").path("object").path("key").asText("");
            if (bucket.isEmpty() || rawKey.isEmpty()) {
                logger.warn("Ignoring notification record without bucket or key: {}", record);
                continue;
            }
            objects.add(new S3ObjectRef(bucket, decodeKey(rawKey)));
        }
        return objects;
    }

    /**
     * Object keys in notifications are URL-encoded, with spaces as '+'.
     */
    static String decodeKey(String key) {
        return URLDecoder.decode(key, StandardCharsets.UTF_8);
    }
}
