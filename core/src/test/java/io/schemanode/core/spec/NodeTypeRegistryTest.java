package io.schemanode.core.spec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.schemanode.core.error.InvalidNodeException;
import io.schemanode.core.error.InvalidOptionException;
import io.schemanode.core.error.UnknownNodeTypeException;
import io.schemanode.core.node.AnyOfNode;
import io.schemanode.core.node.ArrayTypeNode;
import io.schemanode.core.node.SchemaNode;
import io.schemanode.core.node.StringTypeNode;
import io.schemanode.core.spi.NodeOptions;
import io.schemanode.core.spi.NodeType;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class NodeTypeRegistryTest {

    private final NodeTypeRegistry registry = NodeTypeRegistry.withBuiltins();

    @Nested
    class Registration {

        @Test
        void builtinsAreRegistered() {
            assertThat(registry.size()).isEqualTo(BuiltinNodeType.values().length);
            for (String id : List.of(
                    "boolean", "string", "integer", "number", "array", "object", "any_of", "one_of", "all_of")) {
                assertThat(registry.hasType(id)).as(id).isTrue();
            }
        }

        @Test
        void emptyRegistry() {
            NodeTypeRegistry empty = new NodeTypeRegistry();

            assertThat(empty.size()).isZero();
            assertThat(empty.getType("string")).isEmpty();
            assertThat(empty.getType(null)).isEmpty();
        }

        @Test
        void unknownTagFailsLookup() {
            assertThatThrownBy(() -> registry.requireType("uuid"))
                    .isInstanceOf(UnknownNodeTypeException.class)
                    .hasMessage("Could not find node for type \"uuid\".");
        }

        @Test
        void customTypeIsResolved() {
            registry.register(new UppercaseType());

            SchemaNode node = registry.create("uppercase", Map.of());

            assertThat(node.type()).isEqualTo("string");
            assertThat(node.isValid(TextNode.valueOf("ABC"))).isTrue();
            assertThat(node.isValid(TextNode.valueOf("abc"))).isFalse();
        }

        @Test
        void registeringSameIdReplaces() {
            NodeType replacement = new UppercaseType() {
                @Override
                public String id() {
                    return "string";
                }
            };

            registry.register(replacement);

            assertThat(registry.requireType("string")).isSameAs(replacement);
            assertThat(registry.size()).isEqualTo(BuiltinNodeType.values().length);
        }

        @Test
        void nullTypeRejected() {
            assertThatThrownBy(() -> registry.register(null))
                    .isInstanceOf(NullPointerException.class)
                    .hasMessage("type must not be null");
        }

        @Test
        void emptyIdRejected() {
            NodeType blank = new UppercaseType() {
                @Override
                public String id() {
                    return "";
                }
            };

            assertThatThrownBy(() -> registry.register(blank)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class Creation {

        @Test
        void optionsAreApplied() {
            Map<String, JsonNode> options = new LinkedHashMap<>();
            options.put("name", TextNode.valueOf("code"));
            options.put("required", BooleanNode.TRUE);
            options.put("max_length", IntNode.valueOf(3));

            SchemaNode node = registry.create("string", options);

            assertThat(node).isInstanceOf(StringTypeNode.class);
            assertThat(node.name()).isEqualTo("code");
            assertThat(node.isRequired()).isTrue();
            assertThat(node.isValid(TextNode.valueOf("abcd"))).isFalse();
        }

        @Test
        void unknownOptionsAreListedInDeclarationOrder() {
            Map<String, JsonNode> options = new LinkedHashMap<>();
            options.put("max_lenght", IntNode.valueOf(3));
            options.put("required", BooleanNode.TRUE);
            options.put("formatt", TextNode.valueOf("email"));

            assertThatThrownBy(() -> registry.create("string", options))
                    .isInstanceOfSatisfying(InvalidOptionException.class,
                            e -> assertThat(e.options()).containsExactly("max_lenght", "formatt"))
                    .hasMessage("Options [max_lenght, formatt] are not allowed for node \"string\".");
        }

        @Test
        void optionOfAnotherKindIsRejected() {
            assertThatThrownBy(() -> registry.create("boolean", Map.of("min_length", IntNode.valueOf(1))))
                    .isInstanceOf(InvalidOptionException.class)
                    .hasMessage("Options [min_length] are not allowed for node \"boolean\".");
        }

        @Test
        void badlyTypedOption() {
            assertThatThrownBy(() -> registry.create("string", Map.of("min_length", TextNode.valueOf("3"))))
                    .isInstanceOf(InvalidOptionException.class)
                    .hasMessage("Option \"min_length\" of node \"string\" must be an integer.");
        }

        @Test
        void infiniteBoundIsRejected() {
            assertThatThrownBy(() -> registry.create("number",
                            Map.of("minimum", DoubleNode.valueOf(Double.POSITIVE_INFINITY))))
                    .isInstanceOf(InvalidOptionException.class)
                    .hasMessage("Option \"minimum\" of node \"number\" must be a finite number.");
        }

        @Test
        void enumMustBeAnArray() {
            assertThatThrownBy(() -> registry.create("string", Map.of("enum", TextNode.valueOf("a"))))
                    .isInstanceOf(InvalidOptionException.class)
                    .hasMessage("Option \"enum\" of node \"string\" must be an array.");
        }

        @Test
        void childrenBecomeCombinatorItems() {
            SchemaNode item = StringTypeNode.builder().build();

            SchemaNode node = registry.create("any_of", Map.of(), List.of(item));

            assertThat(node).isInstanceOf(AnyOfNode.class);
            assertThat(node.children()).containsExactly(item);
        }

        @Test
        void emptyCombinatorFailsToBuild() {
            assertThatThrownBy(() -> registry.create("one_of", Map.of()))
                    .isInstanceOf(InvalidNodeException.class)
                    .hasMessage("Node \"one_of\" makes only sense with at least 1 item.");
        }

        @Test
        void leafRejectsChildren() {
            List<SchemaNode> children = List.of(StringTypeNode.builder().build());

            assertThatThrownBy(() -> registry.create("integer", Map.of(), children))
                    .isInstanceOf(InvalidNodeException.class)
                    .hasMessage("Node \"integer\" does not support children.");
        }

        @Test
        void arrayTakesOneItemSchema() {
            SchemaNode one = registry.create("array", Map.of(), List.of(StringTypeNode.builder().build()));

            assertThat(one).isInstanceOf(ArrayTypeNode.class);
            assertThatThrownBy(() -> registry.create("array", Map.of(),
                            List.of(StringTypeNode.builder().build(), StringTypeNode.builder().build())))
                    .isInstanceOf(InvalidNodeException.class)
                    .hasMessage("Node \"array\" takes at most 1 item schema, got 2.");
        }
    }

    /** A string node that only accepts upper case text. */
    private static class UppercaseType implements NodeType {

        @Override
        public String id() {
            return "uppercase";
        }

        @Override
        public Set<String> options() {
            return Set.of();
        }

        @Override
        public SchemaNode create(NodeOptions options, List<SchemaNode> children) {
            return options.applyCommon(StringTypeNode.builder()).pattern("^[A-Z]+$").build();
        }
    }
}
