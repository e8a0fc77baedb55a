package com.rulebook.graph;

import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.SerializableString;
import com.fasterxml.jackson.core.io.CharacterEscapes;
import com.fasterxml.jackson.core.io.SerializedString;
import com.fasterxml.jackson.core.util.MinimalPrettyPrinter;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.rulebook.exception.RulebookException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Content hashes over canonical JSON: keys sorted, {@code ", "} and {@code ": "}
 * separators, everything outside printable ASCII written as a lower-case
 * escape ({@code \\u00e9}). Hashes computed by other tools over the same
 * sorted-key JSON form therefore agree with these.
 */
public final class TemplateHasher {

    private static final String PREFIX = "sha256:";
    private static final int TEMPLATE_HASH_LENGTH = 16;
    private static final int DOCUMENT_HASH_LENGTH = 32;

    private static final Comparator<List<String>> EDGE_ORDER = (a, b) -> {
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            int c = a.get(i).compareTo(b.get(i));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(a.size(), b.size());
    };

    private static final ObjectWriter CANONICAL = JsonMapper.builder(
                    new JsonFactoryBuilder().characterEscapes(new AsciiEscapes()).build())
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build()
            .writer(new CanonicalPrinter());

    private TemplateHasher() {
    }

    /**
     * Hash of a graph's structure and its formula text: {@code sha256:} plus 16 hex digits.
     * Node and edge order do not affect the result.
     */
    public static String templateHash(Map<String, NodeDescriptor> nodes, List<List<String>> edges, String formula) {
        List<List<Object>> sortedNodes = new ArrayList<>();
        new TreeMap<>(nodes).forEach((id, node) -> sortedNodes.add(List.<Object>of(id, node)));

        List<List<String>> sortedEdges = new ArrayList<>(edges);
        sortedEdges.sort(EDGE_ORDER);

        Map<String, Object> canonical = new HashMap<>();
        canonical.put("formula", formula);
        canonical.put("nodes", sortedNodes);
        canonical.put("edges", sortedEdges);
        return hash(canonical, TEMPLATE_HASH_LENGTH);
    }

    /**
     * Hash of a whole document, e.g. a rulebook: {@code sha256:} plus 32 hex digits.
     */
    public static String documentHash(Map<String, ?> document) {
        return hash(document, DOCUMENT_HASH_LENGTH);
    }

    static String canonicalJson(Object value) {
        try {
            return CANONICAL.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RulebookException("Failed to serialize canonical form", e);
        }
    }

    private static String hash(Object value, int length) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(canonicalJson(value).getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder();
            for (byte b : bytes) {
                hex.append(String.format("%02x", b));
            }
            return PREFIX + hex.substring(0, length);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Short escapes for quote, backslash and the usual control characters;
     * a hex escape for other control characters, DEL and all non-ASCII.
     */
    private static final class AsciiEscapes extends CharacterEscapes {

        private final int[] asciiEscapes;

        AsciiEscapes() {
            asciiEscapes = CharacterEscapes.standardAsciiEscapesForJSON();
            for (int c = 0; c < 0x20; c++) {
                if (asciiEscapes[c] == ESCAPE_STANDARD) {
                    asciiEscapes[c] = ESCAPE_CUSTOM;
                }
            }
            asciiEscapes[0x7F] = ESCAPE_CUSTOM;
        }

        @Override
        public int[] getEscapeCodesForAscii() {
            return asciiEscapes;
        }

        @Override
        public SerializableString getEscapeSequence(int ch) {
            return new SerializedString(String.format("\\u%04x", ch));
        }
    }

    /**
     * Single-line output with a space after each separator.
     */
    private static final class CanonicalPrinter extends MinimalPrettyPrinter {

        @Override
        public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(": ");
        }

        @Override
        public void writeObjectEntrySeparator(JsonGenerator g) throws IOException {
            g.writeRaw(", ");
        }

        @Override
        public void writeArrayValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(", ");
        }
    }
}
