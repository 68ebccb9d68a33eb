package io.schemanode.core.node;

import com.fasterxml.jackson.databind.JsonNode;
import io.schemanode.core.error.InvalidNodeException;
import io.schemanode.core.result.ValidationResult;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * A node composing child schemas ("items") instead of checking a shape itself. Combinators
 * declare no allowed shapes; type restrictions are left entirely to the items.
 *
 * <p>
 * A combinator needs at least one item. An empty item list fails {@link Builder#build()}, never
 * validation.
 */
public abstract class CombinationNode extends SchemaNode {

    private final List<SchemaNode> items;

    protected CombinationNode(Builder<?, ?> builder) {
        super(builder);
        this.items = List.copyOf(builder.items);
    }

    /** The items in declaration order. */
    public List<SchemaNode> items() {
        return items;
    }

    @Override
    public List<SchemaNode> children() {
        return items;
    }

    @Override
    protected void validateSelf() {
        if (items.isEmpty()) {
            throw new InvalidNodeException("Node \"" + type() + "\" makes only sense with at least 1 item.");
        }
    }

    /**
     * Probes an item against a disposable result. Nothing the item records reaches the caller's
     * result.
     */
    protected final boolean matches(SchemaNode item, JsonNode data) {
        ValidationResult probe = new ValidationResult();
        item.validateInto(data, probe);
        return probe.isValid();
    }

    /** Builder collecting the ordered items of a combinator. */
    public abstract static class Builder<N extends CombinationNode, B extends Builder<N, B>>
            extends SchemaNode.Builder<N, B> {

        private final List<SchemaNode> items = new ArrayList<>();

        protected Builder() {}

        /** Appends an item; items are tried in the order they are added. */
        public B item(SchemaNode item) {
            items.add(Objects.requireNonNull(item, "item must not be null"));
            return self();
        }

        public B items(Collection<? extends SchemaNode> items) {
            items.forEach(this::item);
            return self();
        }
    }
}
