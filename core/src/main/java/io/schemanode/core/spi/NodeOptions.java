package io.schemanode.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import io.schemanode.core.error.InvalidOptionException;
import io.schemanode.core.node.JsonValues;
import io.schemanode.core.node.SchemaNode;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Option bag a node is created from, with typed accessors. A present option with the wrong JSON
 * type is an {@link InvalidOptionException}; an absent one reads as {@code null}.
 */
public final class NodeOptions {

    /** Options every node kind recognizes. */
    public static final Set<String> COMMON = Set.of("name", "required", "default", "description", "example", "enum");

    private final String type;
    private final Map<String, JsonNode> values;

    public NodeOptions(String type, Map<String, ? extends JsonNode> values) {
        this.type = type;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /** The type tag the options belong to. */
    public String type() {
        return type;
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    /** Returns the raw option value, or {@code null}. */
    public JsonNode get(String key) {
        return values.get(key);
    }

    public String text(String key) {
        JsonNode value = values.get(key);
        if (value == null) {
            return null;
        }
        if (!value.isTextual()) {
            throw invalid(key, "a string");
        }
        return value.textValue();
    }

    public Boolean bool(String key) {
        JsonNode value = values.get(key);
        if (value == null) {
            return null;
        }
        if (!value.isBoolean()) {
            throw invalid(key, "a boolean");
        }
        return value.booleanValue();
    }

    public Integer integer(String key) {
        JsonNode value = values.get(key);
        if (value == null) {
            return null;
        }
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw invalid(key, "an integer");
        }
        return value.intValue();
    }

    public BigDecimal decimal(String key) {
        JsonNode value = values.get(key);
        if (value == null) {
            return null;
        }
        if (!value.isNumber() || JsonValues.isNonFinite(value)) {
            throw invalid(key, "a finite number");
        }
        return value.decimalValue();
    }

    /**
     * Applies the {@link #COMMON} options to a builder.
     *
     * @return the same builder
     */
    public <N extends SchemaNode, B extends SchemaNode.Builder<N, B>> B applyCommon(B builder) {
        String name = text("name");
        if (name != null) {
            builder.name(name);
        }
        Boolean required = bool("required");
        if (required != null) {
            builder.required(required);
        }
        if (has("default")) {
            builder.defaultValue(get("default"));
        }
        String description = text("description");
        if (description != null) {
            builder.description(description);
        }
        if (has("example")) {
            builder.example(get("example"));
        }
        JsonNode enumValues = get("enum");
        if (enumValues != null) {
            if (!enumValues.isArray()) {
                throw invalid("enum", "an array");
            }
            List<JsonNode> literals = new ArrayList<>();
            enumValues.forEach(literals::add);
            builder.enumValues(literals);
        }
        return builder;
    }

    private InvalidOptionException invalid(String key, String expected) {
        return new InvalidOptionException(
                "Option \"" + key + "\" of node \"" + type + "\" must be " + expected + ".", List.of(key));
    }

    @Override
    public String toString() {
        return "NodeOptions[type=" + type + ", keys=" + values.keySet() + "]";
    }
}
