package com.smartstream.transform.service;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Splits a raw text blob into the JSON values it contains.
 *
 * <p>Producers write one value, a JSON array, or many values back to back, separated by
 * newlines, by arbitrary whitespace or by nothing at all (pretty-printed objects glued together).
 * All three shapes come out as one ordered sequence of values; the elements of a top-level array
 * are emitted individually. A malformed value ends the scan: everything decoded before it is
 * still returned.
 *
 * <p>A top-level number needs whitespace before the next value. {@code 1{"b":2}} is rejected by
 * the parser's root-value check and ends the scan after the values before the number.
 */
@Service
public class MultiValueJsonParser {

    private static final Logger logger = LoggerFactory.getLogger(MultiValueJsonParser.class);

    private final ObjectMapper objectMapper;

    public MultiValueJsonParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Lazily decodes the values of {@code text}. The stream must be closed (or fully consumed)
     * to release the underlying parser.
     */
    public Stream<JsonNode> values(String text) {
        if (text == null || text.isBlank()) {
            return Stream.empty();
        }
        JsonParser parser;
        try {
            parser = objectMapper.getFactory().createParser(text);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not open JSON parser", e);
        }
        ValueIterator iterator = new ValueIterator(parser, text.length());
        return StreamSupport.stream(
                        Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL), false)
                .onClose(iterator::close);
    }

    /**
     * Decodes every value of {@code text}. Returns an empty list for blank input.
     */
    public List<JsonNode> parseAll(String text) {
        try (Stream<JsonNode> stream = values(text)) {
            return stream.collect(Collectors.toList());
        }
    }

    private final class ValueIterator implements Iterator<JsonNode> {

        private final JsonParser parser;
        private final int length;
        private final Deque<JsonNode> pending = new ArrayDeque<>();
        private int decoded;
        private boolean finished;

        ValueIterator(JsonParser parser, int length) {
            this.parser = parser;
            this.length = length;
        }

        @Override
        public boolean hasNext() {
            while (pending.isEmpty() && !finished) {
                readNextValue();
            }
            return !pending.isEmpty();
        }

        @Override
        public JsonNode next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return pending.poll();
        }

        private void readNextValue() {
            long offset = parser.currentLocation().getCharOffset();
            try {
                JsonToken token = parser.nextToken();
                if (token == null) {
                    finish();
                    return;
                }
                offset = parser.currentTokenLocation().getCharOffset();
                JsonNode value = objectMapper.readTree(parser);
                if (value.isArray()) {
                    value.forEach(pending::add);
                } else {
                    pending.add(value);
                }
                decoded++;
            } catch (IOException e) {
                String detail = e.getMessage();
                if (e instanceof JsonProcessingException jpe) {
                    detail = jpe.getOriginalMessage();
                    if (jpe.getLocation() != null && jpe.getLocation().getCharOffset() >= 0) {
                        offset = jpe.getLocation().getCharOffset();
                    }
                }
                logger.warn("Failed to decode JSON value at char offset {} of {}: {}. Keeping {} value(s) decoded before it.",
                        offset, length, detail, decoded);
                finish();
            }
        }

        private void finish() {
            if (!finished) {
                finished = true;
                logger.debug("Decoded {} top-level JSON value(s) from {} chars", decoded, length);
                close();
            }
        }

        void close() {
            try {
                parser.close();
            } catch (IOException e) {
                logger.debug("Ignoring failure while closing JSON parser: {}", e.getMessage());
            }
        }
    }
}
