package com.smartstream.transform.model;

/**
 * Bucket and zone prefixes of the data lake. Prefixes are stored with a trailing slash.
 */
public class LakeLayout {

    private final String bucket;
    private final String rawPrefix;
    private final String trustedPrefix;
    private final String analyticsPrefix;

    /**
     * Creates the layout and rejects output zones nested under the raw zone, since objects
     * written there would trigger the transform again.
     */
    public LakeLayout(String bucket, String rawPrefix, String trustedPrefix, String analyticsPrefix) {
        this.bucket = bucket;
        this.rawPrefix = normalizePrefix(rawPrefix, "raw");
        this.trustedPrefix = normalizePrefix(trustedPrefix, "trusted");
        this.analyticsPrefix = normalizePrefix(analyticsPrefix, "analytics");
        if (this.trustedPrefix.startsWith(this.rawPrefix)) {
            throw new IllegalArgumentException("Trusted prefix '" + this.trustedPrefix
                    + "' must not be located under the raw prefix '" + this.rawPrefix + "'");
        }
        if (this.analyticsPrefix.startsWith(this.rawPrefix)) {
            throw new IllegalArgumentException("Analytics prefix '" + this.analyticsPrefix
                    + "' must not be located under the raw prefix '" + this.rawPrefix + "'");
        }
    }

    /**
     * Returns the default data-lake bucket, used when a request names none.
     */
    public String getBucket() { return bucket; }

    public String getRawPrefix() { return rawPrefix; }

    public String getTrustedPrefix() { return trustedPrefix; }

    public String getAnalyticsPrefix() { return analyticsPrefix; }

    public boolean isRawKey(String key) {
        return key != null && key.startsWith(rawPrefix) && key.length() > rawPrefix.length();
    }

    private static String normalizePrefix(String prefix, String zone) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("The " + zone + " prefix must not be blank");
        }
        String trimmed = prefix.trim();
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        return trimmed.endsWith("/") ? trimmed : trimmed + "/";
    }
}
