package io.schemanode.core.node;

import java.util.Set;

/** Accepts integral numbers. Floating point values, including {@code 1.0}, are type errors. */
public final class IntegerTypeNode extends NumberRangeNode {

    private IntegerTypeNode(Builder builder) {
        super(builder);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String type() {
        return "integer";
    }

    @Override
    protected Set<NodeShape> allowedShapes() {
        return Set.of(NodeShape.INTEGER);
    }

    /** Builder for {@link IntegerTypeNode}. */
    public static final class Builder extends NumberRangeNode.Builder<IntegerTypeNode, Builder> {

        Builder() {}

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        protected IntegerTypeNode create() {
            return new IntegerTypeNode(this);
        }
    }
}
