package io.schemanode.core.node;

import com.fasterxml.jackson.databind.JsonNode;
import io.schemanode.core.result.ValidationResult;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Matches if the data conforms to at least one item. Items are probed in declaration order and
 * the first clean one wins: it is validated again against the real result, and its effective
 * data becomes this node's. When no item matches, a single aggregate error is reported and the
 * individual item errors are dropped.
 */
public final class AnyOfNode extends CombinationNode {

    private static final Logger LOG = LoggerFactory.getLogger(AnyOfNode.class);

    static final String NO_MATCH = "Does not match any anyOf condition.";

    private AnyOfNode(Builder builder) {
        super(builder);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String type() {
        return "any_of";
    }

    @Override
    protected JsonNode validateInto(JsonNode data, ValidationResult result) {
        JsonNode value = super.validateInto(data, result);
        if (value == null) {
            return null;
        }

        List<SchemaNode> items = items();
        for (int i = 0; i < items.size(); i++) {
            SchemaNode item = items.get(i);
            if (matches(item, value)) {
                LOG.debug("anyOf matched item {} of {} ({})", i, items.size(), item.type());
                return item.validateInto(value, result);
            }
        }

        LOG.debug("anyOf matched none of {} items", items.size());
        result.error(NO_MATCH);
        return null;
    }

    /** Builder for {@link AnyOfNode}. */
    public static final class Builder extends CombinationNode.Builder<AnyOfNode, Builder> {

        Builder() {}

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        protected AnyOfNode create() {
            return new AnyOfNode(this);
        }
    }
}
