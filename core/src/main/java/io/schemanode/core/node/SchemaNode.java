package io.schemanode.core.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.schemanode.core.error.DataValidationException;
import io.schemanode.core.error.InvalidNodeException;
import io.schemanode.core.result.ValidationResult;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A node in a schema tree: defines what valid data means at one position.
 *
 * <p>
 * Owns the attributes shared by every node kind (name, required flag, default value, enumerated
 * values, description and example metadata) and the generic validation pipeline. Concrete nodes
 * extend {@link #validateInto(JsonNode, ValidationResult)}, always calling through to the
 * pipeline first.
 *
 * <p>
 * Nodes are created by a {@link Builder} and are immutable once built, so a tree can be
 * validated from any number of threads. Building itself is not thread-safe and must complete
 * before the tree is shared.
 */
public abstract class SchemaNode {

    static final String VALUE_MUST_BE_GIVEN = "Value must be given.";

    private final String name;
    private final boolean required;
    private final JsonNode defaultValue;
    private final List<JsonNode> enumValues;
    private final String description;
    private final JsonNode example;

    /** Lookup-only link to the enclosing node; assigned once when the parent is built. */
    private SchemaNode parent;

    protected SchemaNode(Builder<?, ?> builder) {
        this.name = builder.name;
        this.required = builder.required;
        this.defaultValue = JsonValues.isAbsent(builder.defaultValue) ? null : builder.defaultValue.deepCopy();
        this.enumValues = builder.enumValues != null ? distinct(builder.enumValues) : null;
        this.description = builder.description;
        this.example = builder.example != null ? builder.example.deepCopy() : null;
    }

    /** Returns the type tag of this node, e.g. {@code "string"} or {@code "any_of"}. */
    public abstract String type();

    /**
     * Runtime shapes this node accepts. An empty set (the default, and what every combinator
     * returns) skips the type check.
     */
    protected Set<NodeShape> allowedShapes() {
        return Set.of();
    }

    /** Ordered child nodes; empty for scalar leaves. */
    public List<SchemaNode> children() {
        return List.of();
    }

    /** Returns the node name, or {@code null} if unnamed. */
    public String name() {
        return name;
    }

    public boolean isRequired() {
        return required;
    }

    /** Returns a copy of the default value, or {@code null} if none is configured. */
    public JsonNode defaultValue() {
        return defaultValue != null ? defaultValue.deepCopy() : null;
    }

    /** Returns the permitted values, or empty if no enum is configured. */
    public Optional<List<JsonNode>> enumValues() {
        return Optional.ofNullable(enumValues);
    }

    public String description() {
        return description;
    }

    public JsonNode example() {
        return example;
    }

    /** Returns the enclosing node, or empty for a root. */
    public Optional<SchemaNode> parent() {
        return Optional.ofNullable(parent);
    }

    /**
     * Validates data against this node.
     *
     * @param data the value to validate; {@code null}, JSON null and missing nodes count as absent
     * @return a fresh result holding every error found
     */
    public final ValidationResult validate(JsonNode data) {
        ValidationResult result = new ValidationResult();
        validateInto(data, result);
        return result;
    }

    /** Returns {@code true} if the data conforms to this node. */
    public final boolean isValid(JsonNode data) {
        return validate(data).isValid();
    }

    /**
     * Validates data and returns it with defaults applied.
     *
     * @param data the value to validate
     * @return the effective data, or {@code null} when the value is absent and has no default
     * @throws DataValidationException if the data does not conform
     */
    public final JsonNode validateOrFail(JsonNode data) {
        ValidationResult result = new ValidationResult();
        JsonNode effective = validateInto(data, result);
        if (!result.isValid()) {
            throw new DataValidationException(result.errors());
        }
        return effective;
    }

    /**
     * Runs the generic pipeline: required check, default substitution, type check and enum check.
     * Overrides must call this first and stop when it returns {@code null}.
     *
     * <p>
     * A failed enum check is recorded but does not stop the pipeline; a failed type check does.
     *
     * @param data   the value at this node's position, possibly absent
     * @param result the result errors are recorded into, rooted at this node's position
     * @return the effective (post-default) data, or {@code null} when there is nothing further
     *     to check
     */
    protected JsonNode validateInto(JsonNode data, ValidationResult result) {
        JsonNode value = data;
        if (JsonValues.isAbsent(value)) {
            if (required) {
                result.error(VALUE_MUST_BE_GIVEN);
                return null;
            }
            if (defaultValue == null) {
                return null;
            }
            value = defaultValue.deepCopy();
        }

        Set<NodeShape> shapes = allowedShapes();
        if (!shapes.isEmpty() && !matchesAny(shapes, value)) {
            result.error("Invalid type, expected " + typeLabels(shapes) + ".");
            return null;
        }

        if (enumValues != null && !JsonValues.contains(enumValues, value)) {
            result.error("Value not included in enum " + JsonValues.render(enumValues) + ".");
        }

        return value;
    }

    /**
     * Checks structural invariants once the node is fully constructed. Runs from
     * {@link Builder#build()}; a violation fails construction with an
     * {@link InvalidNodeException}.
     */
    protected void validateSelf() {}

    /**
     * Makes this node the parent of all its {@link #children()}. Either every child is attached
     * or none is.
     *
     * @throws InvalidNodeException if a child already has a parent or is listed twice
     */
    private void adoptChildren() {
        Set<SchemaNode> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (SchemaNode child : children()) {
            if (child.parent != null || !seen.add(child)) {
                throw new InvalidNodeException("Node \"" + child.type() + "\" is already attached to a parent.");
            }
        }
        for (SchemaNode child : seen) {
            child.parent = this;
        }
    }

    private static boolean matchesAny(Set<NodeShape> shapes, JsonNode value) {
        for (NodeShape shape : shapes) {
            if (shape.matches(value)) {
                return true;
            }
        }
        return false;
    }

    private static String typeLabels(Set<NodeShape> shapes) {
        return shapes.stream()
                .map(NodeShape::label)
                .distinct()
                .sorted()
                .map(label -> "\"" + label + "\"")
                .collect(Collectors.joining(" or "));
    }

    private static List<JsonNode> distinct(List<JsonNode> values) {
        List<JsonNode> unique = new ArrayList<>();
        for (JsonNode value : values) {
            JsonNode literal = value != null ? value.deepCopy() : NullNode.getInstance();
            if (!JsonValues.contains(unique, literal)) {
                unique.add(literal);
            }
        }
        return List.copyOf(unique);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[type=" + type() + (name != null ? ", name=" + name : "") + "]";
    }

    /**
     * Base builder collecting the options shared by every node kind. {@link #build()} creates the
     * node and runs {@link SchemaNode#validateSelf()} before handing it out.
     *
     * @param <N> the node type built
     * @param <B> the concrete builder type
     */
    public abstract static class Builder<N extends SchemaNode, B extends Builder<N, B>> {

        private String name;
        private boolean required;
        private JsonNode defaultValue;
        private List<JsonNode> enumValues;
        private String description;
        private JsonNode example;

        protected Builder() {}

        public B name(String name) {
            this.name = name;
            return self();
        }

        public B required(boolean required) {
            this.required = required;
            return self();
        }

        public B defaultValue(JsonNode defaultValue) {
            this.defaultValue = defaultValue;
            return self();
        }

        public B enumValues(JsonNode... values) {
            return enumValues(Arrays.asList(values));
        }

        public B enumValues(Collection<? extends JsonNode> values) {
            Objects.requireNonNull(values, "values must not be null");
            this.enumValues = new ArrayList<>(values);
            return self();
        }

        public B description(String description) {
            this.description = description;
            return self();
        }

        public B example(JsonNode example) {
            this.example = example;
            return self();
        }

        /**
         * Creates the node, checks its structural invariants and attaches its children. A failed
         * build leaves the children free for another parent.
         */
        public final N build() {
            N node = create();
            node.validateSelf();
            ((SchemaNode) node).adoptChildren();
            return node;
        }

        protected abstract B self();

        protected abstract N create();
    }
}
