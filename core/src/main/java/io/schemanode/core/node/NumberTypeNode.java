package io.schemanode.core.node;

import java.util.Set;

/** Accepts any number, integral or floating point. */
public final class NumberTypeNode extends NumberRangeNode {

    private NumberTypeNode(Builder builder) {
        super(builder);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String type() {
        return "number";
    }

    @Override
    protected Set<NodeShape> allowedShapes() {
        return Set.of(NodeShape.NUMBER);
    }

    /** Builder for {@link NumberTypeNode}. */
    public static final class Builder extends NumberRangeNode.Builder<NumberTypeNode, Builder> {

        Builder() {}

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        protected NumberTypeNode create() {
            return new NumberTypeNode(this);
        }
    }
}
