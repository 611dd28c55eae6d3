package com.smartstream.transform.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

@Service
public class ContentHashingService {

    private static final Logger logger = LoggerFactory.getLogger(ContentHashingService.class);

    private final MessageDigest digest;
    private final ObjectMapper canonicalMapper;

    /**
     * Initializes the SHA-256 message digest and the key-sorting mapper used for content hashing.
     */
    public ContentHashingService(ObjectMapper objectMapper) {
        try {
            this.digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            logger.error("Could not initialize SHA-256 MessageDigest", e);
            throw new IllegalStateException("Failed to initialize hashing service", e);
        }
        this.canonicalMapper = objectMapper.copy()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(SerializationFeature.INDENT_OUTPUT, false);
    }

    /**
     * Calculates the SHA-256 hash of a given string content.
     *
     * @param content The string content to hash.
     * @return The SHA-256 hash as a hexadecimal string.
     */
    public synchronized String hash(String content) {
        if (content == null) {
            return null;
        }
        byte[] encodedhash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
        return bytesToHex(encodedhash);
    }

    /**
     * Hashes a JSON value independently of the order its object keys were inserted in.
     */
    public String hashJson(JsonNode value) {
        return hash(canonicalJson(value));
    }

    /**
     * Serializes the value with object keys sorted at every nesting level. Object nodes are
     * turned into plain maps first, since key ordering only applies to maps.
     */
    String canonicalJson(JsonNode value) {
        try {
            Object plain = canonicalMapper.convertValue(value, Object.class);
            return canonicalMapper.writeValueAsString(plain);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize JSON value for hashing", e);
        }
    }

    /**
     * Converts a raw byte array into a lowercase hexadecimal string.
     */
    private String bytesToHex(byte[] hash) {
        StringBuilder hexString = new StringBuilder(2 * hash.length);
        for (byte b : hash) {
            String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1) {
                hexString.append('0');
            }
            hexString.append(hex);
        }
        return hexString.toString();
    }
}
