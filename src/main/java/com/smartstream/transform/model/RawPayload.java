package com.smartstream.transform.model;

/**
 * Bytes of one raw object as read from storage. Lives only until it has been decoded.
 */
public class RawPayload {

    private final String sourceKey;
    private final byte[] content;
    private final Compression compression;

    /**
     * Creates a payload for the given source key.
     */
    public RawPayload(String sourceKey, byte[] content, Compression compression) {
        this.sourceKey = sourceKey;
        this.content = content != null ? content : new byte[0];
        this.compression = compression != null ? compression : Compression.NONE;
    }

    /**
     * Returns the key the payload was read from.
     */
    public String getSourceKey() { return sourceKey; }

    /**
     * Returns the raw bytes.
     */
    public byte[] getContent() { return content; }

    /**
     * Returns the compression marker derived from the key or the storage metadata.
     */
    public Compression getCompression() { return compression; }

    public int size() { return content.length; }
}
