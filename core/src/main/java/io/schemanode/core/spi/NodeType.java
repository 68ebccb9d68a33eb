package io.schemanode.core.spi;

import io.schemanode.core.node.SchemaNode;
import java.util.List;
import java.util.Set;

/**
 * Pluggable node kind. Implementations turn a type tag plus an option bag into a built
 * {@link SchemaNode} and are registered with a {@code NodeTypeRegistry}, which resolves tags found
 * in schema definitions.
 *
 * <p>Implementations MUST be stateless and thread-safe.
 */
public interface NodeType {

    /**
     * Returns the type tag, e.g. {@code "string"} or {@code "any_of"}. Definitions select the node
     * kind with this tag in their {@code type} key.
     *
     * @return a non-null, non-empty tag (lowercase, no spaces)
     */
    String id();

    /**
     * Option keys recognized in addition to {@link NodeOptions#COMMON}. The registry rejects any
     * other key before {@link #create} is called.
     */
    Set<String> options();

    /**
     * Creates and builds the node.
     *
     * @param options  the option bag, containing recognized keys only
     * @param children child nodes in declaration order; empty for most leaves
     * @return the built node
     * @throws io.schemanode.core.error.SchemaDefinitionException if the options or children do
     *     not describe a valid node
     */
    SchemaNode create(NodeOptions options, List<SchemaNode> children);
}
