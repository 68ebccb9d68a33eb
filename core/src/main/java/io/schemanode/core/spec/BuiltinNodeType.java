package io.schemanode.core.spec;

import io.schemanode.core.error.InvalidNodeException;
import io.schemanode.core.node.AllOfNode;
import io.schemanode.core.node.AnyOfNode;
import io.schemanode.core.node.ArrayTypeNode;
import io.schemanode.core.node.BooleanTypeNode;
import io.schemanode.core.node.IntegerTypeNode;
import io.schemanode.core.node.NumberRangeNode;
import io.schemanode.core.node.NumberTypeNode;
import io.schemanode.core.node.ObjectTypeNode;
import io.schemanode.core.node.OneOfNode;
import io.schemanode.core.node.SchemaNode;
import io.schemanode.core.node.StringTypeNode;
import io.schemanode.core.spi.NodeOptions;
import io.schemanode.core.spi.NodeType;
import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

/** The node kinds every {@link NodeTypeRegistry#withBuiltins() default registry} knows. */
public enum BuiltinNodeType implements NodeType {
    BOOLEAN("boolean") {
        @Override
        public SchemaNode create(NodeOptions options, List<SchemaNode> children) {
            requireNoChildren(children);
            return options.applyCommon(BooleanTypeNode.builder()).build();
        }
    },

    STRING("string", "min_length", "max_length", "pattern") {
        @Override
        public SchemaNode create(NodeOptions options, List<SchemaNode> children) {
            requireNoChildren(children);
            StringTypeNode.Builder builder = options.applyCommon(StringTypeNode.builder());
            Integer minLength = options.integer("min_length");
            if (minLength != null) {
                builder.minLength(minLength);
            }
            Integer maxLength = options.integer("max_length");
            if (maxLength != null) {
                builder.maxLength(maxLength);
            }
            String pattern = options.text("pattern");
            if (pattern != null) {
                builder.pattern(pattern);
            }
            return builder.build();
        }
    },

    INTEGER("integer", "minimum", "maximum", "exclusive_minimum", "exclusive_maximum", "multiple_of") {
        @Override
        public SchemaNode create(NodeOptions options, List<SchemaNode> children) {
            requireNoChildren(children);
            IntegerTypeNode.Builder builder = options.applyCommon(IntegerTypeNode.builder());
            applyRange(builder, options);
            return builder.build();
        }
    },

    NUMBER("number", "minimum", "maximum", "exclusive_minimum", "exclusive_maximum", "multiple_of") {
        @Override
        public SchemaNode create(NodeOptions options, List<SchemaNode> children) {
            requireNoChildren(children);
            NumberTypeNode.Builder builder = options.applyCommon(NumberTypeNode.builder());
            applyRange(builder, options);
            return builder.build();
        }
    },

    ARRAY("array", "min_items", "max_items", "unique_items") {
        @Override
        public SchemaNode create(NodeOptions options, List<SchemaNode> children) {
            if (children.size() > 1) {
                throw new InvalidNodeException(
                        "Node \"array\" takes at most 1 item schema, got " + children.size() + ".");
            }
            ArrayTypeNode.Builder builder = options.applyCommon(ArrayTypeNode.builder());
            Integer minItems = options.integer("min_items");
            if (minItems != null) {
                builder.minItems(minItems);
            }
            Integer maxItems = options.integer("max_items");
            if (maxItems != null) {
                builder.maxItems(maxItems);
            }
            Boolean uniqueItems = options.bool("unique_items");
            if (uniqueItems != null) {
                builder.uniqueItems(uniqueItems);
            }
            if (!children.isEmpty()) {
                builder.items(children.get(0));
            }
            return builder.build();
        }
    },

    OBJECT("object", "additional_properties") {
        @Override
        public SchemaNode create(NodeOptions options, List<SchemaNode> children) {
            ObjectTypeNode.Builder builder = options.applyCommon(ObjectTypeNode.builder());
            Boolean additionalProperties = options.bool("additional_properties");
            if (additionalProperties != null) {
                builder.additionalProperties(additionalProperties);
            }
            children.forEach(builder::property);
            return builder.build();
        }
    },

    ANY_OF("any_of") {
        @Override
        public SchemaNode create(NodeOptions options, List<SchemaNode> children) {
            return options.applyCommon(AnyOfNode.builder()).items(children).build();
        }
    },

    ONE_OF("one_of") {
        @Override
        public SchemaNode create(NodeOptions options, List<SchemaNode> children) {
            return options.applyCommon(OneOfNode.builder()).items(children).build();
        }
    },

    ALL_OF("all_of") {
        @Override
        public SchemaNode create(NodeOptions options, List<SchemaNode> children) {
            return options.applyCommon(AllOfNode.builder()).items(children).build();
        }
    };

    private final String id;
    private final Set<String> options;

    BuiltinNodeType(String id, String... options) {
        this.id = id;
        this.options = Set.of(options);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public Set<String> options() {
        return options;
    }

    void requireNoChildren(List<SchemaNode> children) {
        if (!children.isEmpty()) {
            throw new InvalidNodeException("Node \"" + id + "\" does not support children.");
        }
    }

    static void applyRange(NumberRangeNode.Builder<?, ?> builder, NodeOptions options) {
        BigDecimal minimum = options.decimal("minimum");
        if (minimum != null) {
            builder.minimum(minimum);
        }
        BigDecimal maximum = options.decimal("maximum");
        if (maximum != null) {
            builder.maximum(maximum);
        }
        BigDecimal exclusiveMinimum = options.decimal("exclusive_minimum");
        if (exclusiveMinimum != null) {
            builder.exclusiveMinimum(exclusiveMinimum);
        }
        BigDecimal exclusiveMaximum = options.decimal("exclusive_maximum");
        if (exclusiveMaximum != null) {
            builder.exclusiveMaximum(exclusiveMaximum);
        }
        BigDecimal multipleOf = options.decimal("multiple_of");
        if (multipleOf != null) {
            builder.multipleOf(multipleOf);
        }
    }
}
