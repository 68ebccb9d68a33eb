package io.schemanode.core.testkit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.io.UncheckedIOException;

/** JSON literals for tests. */
public final class TestData {

    private static final ObjectMapper JSON = new ObjectMapper();

    private TestData() {}

    /** Parses a JSON literal, e.g. {@code json("{\"a\": 1}")}. */
    public static JsonNode json(String literal) {
        try {
            return JSON.readTree(literal);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static JsonNode text(String value) {
        return TextNode.valueOf(value);
    }

    public static JsonNode number(int value) {
        return IntNode.valueOf(value);
    }
}
