package io.schemanode.core.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import io.schemanode.core.error.InvalidNodeException;
import io.schemanode.core.result.ValidationResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Accepts arrays, optionally bounded in size and free of duplicates. An item schema, when given,
 * validates every element under its index ({@code /0}, {@code /1}, ...); the effective array then
 * holds the elements with defaults applied.
 */
public final class ArrayTypeNode extends SchemaNode {

    private final Integer minItems;
    private final Integer maxItems;
    private final boolean uniqueItems;
    private final SchemaNode items;

    private ArrayTypeNode(Builder builder) {
        super(builder);
        this.minItems = builder.minItems;
        this.maxItems = builder.maxItems;
        this.uniqueItems = builder.uniqueItems;
        this.items = builder.items;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String type() {
        return "array";
    }

    @Override
    protected Set<NodeShape> allowedShapes() {
        return Set.of(NodeShape.ARRAY);
    }

    @Override
    public List<SchemaNode> children() {
        return items != null ? List.of(items) : List.of();
    }

    @Override
    protected JsonNode validateInto(JsonNode data, ValidationResult result) {
        JsonNode value = super.validateInto(data, result);
        if (value == null) {
            return null;
        }

        int size = value.size();
        if (minItems != null && size < minItems) {
            result.error("Array has " + size + " items but must have at least " + minItems + ".");
        }
        if (maxItems != null && size > maxItems) {
            result.error("Array has " + size + " items but must have at most " + maxItems + ".");
        }
        if (uniqueItems && hasDuplicates(value)) {
            result.error("Array has duplicate items.");
        }
        if (items == null) {
            return value;
        }

        ArrayNode effective = JsonNodeFactory.instance.arrayNode(size);
        for (int i = 0; i < size; i++) {
            ValidationResult elementResult = new ValidationResult();
            JsonNode element = items.validateInto(value.get(i), elementResult);
            result.merge(elementResult, String.valueOf(i));
            effective.add(element != null ? element : NullNode.getInstance());
        }
        return effective;
    }

    @Override
    protected void validateSelf() {
        if (minItems != null && minItems < 0) {
            throw new InvalidNodeException("Option \"min_items\" must not be negative.");
        }
        if (maxItems != null && maxItems < 0) {
            throw new InvalidNodeException("Option \"max_items\" must not be negative.");
        }
        if (minItems != null && maxItems != null && minItems > maxItems) {
            throw new InvalidNodeException("Option \"min_items\" must not exceed \"max_items\".");
        }
    }

    private static boolean hasDuplicates(JsonNode array) {
        List<JsonNode> seen = new ArrayList<>();
        for (JsonNode element : array) {
            if (JsonValues.contains(seen, element)) {
                return true;
            }
            seen.add(element);
        }
        return false;
    }

    /** Builder for {@link ArrayTypeNode}. */
    public static final class Builder extends SchemaNode.Builder<ArrayTypeNode, Builder> {

        private Integer minItems;
        private Integer maxItems;
        private boolean uniqueItems;
        private SchemaNode items;

        Builder() {}

        public Builder minItems(int minItems) {
            this.minItems = minItems;
            return this;
        }

        public Builder maxItems(int maxItems) {
            this.maxItems = maxItems;
            return this;
        }

        public Builder uniqueItems(boolean uniqueItems) {
            this.uniqueItems = uniqueItems;
            return this;
        }

        /** Sets the schema every element must conform to. */
        public Builder items(SchemaNode items) {
            this.items = items;
            return this;
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        protected ArrayTypeNode create() {
            return new ArrayTypeNode(this);
        }
    }
}
