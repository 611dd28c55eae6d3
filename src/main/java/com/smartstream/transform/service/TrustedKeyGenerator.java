package com.smartstream.transform.service;

import com.smartstream.transform.model.Compression;
import com.smartstream.transform.model.LakeLayout;
import com.smartstream.transform.model.Route;
import org.springframework.stereotype.Service;

/**
 * Derives the trusted-zone key of a route's output for a raw object.
 *
 * <p>{@code raw/year=2026/month=02/day=07/file.gz} on route {@code finance.transactions} becomes
 * {@code trusted/finance/transactions/year=2026/month=02/day=07/file.json}. The key depends on
 * nothing but its inputs, so a retried object overwrites its earlier output.
 */
@Service
public class TrustedKeyGenerator {

    private static final String JSON_SUFFIX = ".json";

    private final LakeLayout lakeLayout;

    public TrustedKeyGenerator(LakeLayout lakeLayout) {
        this.lakeLayout = lakeLayout;
    }

    public String trustedKey(String sourceKey, Route route) {
        if (sourceKey == null || sourceKey.isBlank()) {
            throw new IllegalArgumentException("Source key must not be blank");
        }
        String relative = sourceKey.startsWith(lakeLayout.getRawPrefix())
                ? sourceKey.substring(lakeLayout.getRawPrefix().length())
                : sourceKey;
        while (relative.startsWith("/")) {
            relative = relative.substring(1);
        }

        String compressionSuffix = Compression.compressionSuffix(relative);
        if (compressionSuffix != null) {
            relative = relative.substring(0, relative.length() - compressionSuffix.length());
        }
        if (!relative.endsWith(JSON_SUFFIX)) {
            relative = relative + JSON_SUFFIX;
        }
        return lakeLayout.getTrustedPrefix() + route.domain() + "/" + route.table() + "/" + relative;
    }
}
