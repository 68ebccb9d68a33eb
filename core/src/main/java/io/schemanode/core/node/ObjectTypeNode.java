package io.schemanode.core.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.schemanode.core.error.InvalidNodeException;
import io.schemanode.core.result.ValidationResult;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Accepts objects whose properties conform to named child nodes. Each property is validated under
 * its name, missing ones as absent values, so required properties report
 * {@code Value must be given.} at {@code /name}. Keys without a property node are reported as
 * obsolete unless additional properties are allowed.
 *
 * <p>
 * The effective object is a new object with defaults filled in; allowed additional properties
 * are carried over unchanged.
 */
public final class ObjectTypeNode extends SchemaNode {

    private final List<SchemaNode> properties;
    private final boolean additionalProperties;

    private ObjectTypeNode(Builder builder) {
        super(builder);
        this.properties = List.copyOf(builder.properties);
        this.additionalProperties = builder.additionalProperties;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String type() {
        return "object";
    }

    @Override
    protected Set<NodeShape> allowedShapes() {
        return Set.of(NodeShape.OBJECT);
    }

    @Override
    public List<SchemaNode> children() {
        return properties;
    }

    public boolean allowsAdditionalProperties() {
        return additionalProperties;
    }

    @Override
    protected JsonNode validateInto(JsonNode data, ValidationResult result) {
        JsonNode value = super.validateInto(data, result);
        if (value == null) {
            return null;
        }

        ObjectNode effective = JsonNodeFactory.instance.objectNode();
        Set<String> known = new HashSet<>();
        for (SchemaNode property : properties) {
            String name = property.name();
            known.add(name);
            ValidationResult propertyResult = new ValidationResult();
            JsonNode propertyValue = property.validateInto(value.get(name), propertyResult);
            result.merge(propertyResult, name);
            if (propertyValue != null) {
                effective.set(name, propertyValue);
            }
        }

        Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (known.contains(field.getKey())) {
                continue;
            }
            if (additionalProperties) {
                effective.set(field.getKey(), field.getValue());
            } else {
                result.error("Obsolete property \"" + field.getKey() + "\".");
            }
        }
        return effective;
    }

    @Override
    protected void validateSelf() {
        Set<String> names = new HashSet<>();
        for (SchemaNode property : properties) {
            String name = property.name();
            if (name == null || name.isBlank()) {
                throw new InvalidNodeException(
                        "Properties of node \"object\" need a name, got unnamed node \"" + property.type() + "\".");
            }
            if (!names.add(name)) {
                throw new InvalidNodeException("Property \"" + name + "\" is defined more than once.");
            }
        }
    }

    /** Builder for {@link ObjectTypeNode}. */
    public static final class Builder extends SchemaNode.Builder<ObjectTypeNode, Builder> {

        private final List<SchemaNode> properties = new ArrayList<>();
        private boolean additionalProperties;

        Builder() {}

        /** Adds a named property node. */
        public Builder property(SchemaNode property) {
            properties.add(Objects.requireNonNull(property, "property must not be null"));
            return this;
        }

        public Builder additionalProperties(boolean additionalProperties) {
            this.additionalProperties = additionalProperties;
            return this;
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        protected ObjectTypeNode create() {
            return new ObjectTypeNode(this);
        }
    }
}
