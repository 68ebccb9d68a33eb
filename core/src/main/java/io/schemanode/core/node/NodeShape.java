package io.schemanode.core.node;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.function.Predicate;

/**
 * Runtime shapes a leaf node can accept. The label is what type errors report, e.g.
 * {@code Invalid type, expected "integer" or "string".}
 */
public enum NodeShape {
    OBJECT("object", JsonNode::isObject),
    ARRAY("array", JsonNode::isArray),
    STRING("string", JsonNode::isTextual),
    /** Integral numbers only; {@code 1.0} is not an integer. */
    INTEGER("integer", JsonNode::isIntegralNumber),
    /** Any number, integral or floating point. */
    NUMBER("number", JsonNode::isNumber),
    BOOLEAN("boolean", JsonNode::isBoolean);

    private final String label;
    private final Predicate<JsonNode> test;

    NodeShape(String label, Predicate<JsonNode> test) {
        this.label = label;
        this.test = test;
    }

    /** Returns the label used in type error messages. */
    public String label() {
        return label;
    }

    /** Returns {@code true} if the (present) value has this shape. */
    public boolean matches(JsonNode value) {
        return test.test(value);
    }
}
