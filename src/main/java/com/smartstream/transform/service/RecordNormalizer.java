package com.smartstream.transform.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.smartstream.transform.model.CleanedRecord;
import com.smartstream.transform.model.StageResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Cleans a routed row: strips null and empty-string fields and rewrites the recognized
 * timestamp fields to ISO-8601 UTC with a {@code Z} suffix.
 */
@Service
public class RecordNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(RecordNormalizer.class);

    private static final Splitter FIELD_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    // yyyy-MM-dd followed by 'T' or a single space and a time
    private static final Pattern DATE_TIME_SHAPE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}[Tt ]\\d{2}:\\d{2}.*");
    private static final Pattern ZONED_SUFFIX = Pattern.compile(".*([Zz]|[+-]\\d{2}(:?\\d{2})?)$");
    private static final Pattern DATE_ONLY = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

    private final List<String> timestampFields;

    public RecordNormalizer(@Value("${app.transform.timestamp-fields:timestamp,created_at,updated_at,datetime,date}")
                            String timestampFields) {
        this.timestampFields = ImmutableList.copyOf(FIELD_SPLITTER.split(timestampFields));
    }

    public StageResult<CleanedRecord> normalize(ObjectNode row) {
        ObjectNode cleaned = row.deepCopy();
        Iterator<Map.Entry<String, JsonNode>> fields = cleaned.fields();
        while (fields.hasNext()) {
            JsonNode value = fields.next().getValue();
            if (value == null || value.isNull() || (value.isTextual() && value.textValue().isEmpty())) {
                fields.remove();
            }
        }
        if (cleaned.isEmpty()) {
            return StageResult.skip("no non-empty fields");
        }

        for (String field : timestampFields) {
            JsonNode value = cleaned.get(field);
            if (value != null) {
                cleaned.set(field, normalizeTimestamp(field, value));
            }
        }
        return StageResult.ok(new CleanedRecord(cleaned));
    }

    /**
     * Returns the canonical form of a timestamp value, or the value itself when it is already
     * canonical or cannot be interpreted.
     */
    JsonNode normalizeTimestamp(String field, JsonNode value) {
        if (value.isNumber()) {
            try {
                return cleanedText(formatEpochSeconds(value.decimalValue()));
            } catch (DateTimeException | ArithmeticException e) {
                logger.warn("Could not parse timestamp field '{}': epoch value {} is out of range", field, value);
                return value;
            }
        }
        if (!value.isTextual()) {
            logger.warn("Could not parse timestamp field '{}': unsupported {} value", field, value.getNodeType());
            return value;
        }

        String text = value.textValue().trim();
        if (DATE_ONLY.matcher(text).matches()) {
            return value;
        }
        if (!DATE_TIME_SHAPE.matcher(text).matches()) {
            logger.warn("Could not parse timestamp field '{}': '{}' is not an ISO-8601 date-time", field, text);
            return value;
        }

        String isoText = text.substring(0, 10) + "T" + text.substring(11);
        try {
            if (ZONED_SUFFIX.matcher(isoText).matches()) {
                OffsetDateTime.parse(isoText, DateTimeFormatter.ISO_OFFSET_DATE_TIME);
                return value;
            }
            LocalDateTime.parse(isoText, DateTimeFormatter.ISO_LOCAL_DATE_TIME);
            return cleanedText(isoText + "Z");
        } catch (DateTimeParseException e) {
            logger.warn("Could not parse timestamp field '{}': {}", field, e.getMessage());
            return value;
        }
    }

    private static String formatEpochSeconds(BigDecimal epochSeconds) {
        long seconds = epochSeconds.setScale(0, RoundingMode.FLOOR).longValueExact();
        int nanos = epochSeconds.subtract(BigDecimal.valueOf(seconds))
                .movePointRight(9)
                .setScale(0, RoundingMode.HALF_UP)
                .intValueExact();
        return DateTimeFormatter.ISO_INSTANT.format(Instant.ofEpochSecond(seconds, nanos));
    }

    private static JsonNode cleanedText(String text) {
        return TextNode.valueOf(text);
    }
}
