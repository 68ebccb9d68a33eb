package io.schemanode.core.node;

import java.util.Set;

/** Accepts {@code true} and {@code false}; strings and numbers are type errors. */
public final class BooleanTypeNode extends SchemaNode {

    private BooleanTypeNode(Builder builder) {
        super(builder);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String type() {
        return "boolean";
    }

    @Override
    protected Set<NodeShape> allowedShapes() {
        return Set.of(NodeShape.BOOLEAN);
    }

    /** Builder for {@link BooleanTypeNode}. */
    public static final class Builder extends SchemaNode.Builder<BooleanTypeNode, Builder> {

        Builder() {}

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        protected BooleanTypeNode create() {
            return new BooleanTypeNode(this);
        }
    }
}
