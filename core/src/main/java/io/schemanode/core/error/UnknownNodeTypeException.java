package io.schemanode.core.error;

/** Thrown when no node type is registered for a type tag. */
public final class UnknownNodeTypeException extends SchemaDefinitionException {

    private static final long serialVersionUID = 1L;

    private final String typeTag;

    public UnknownNodeTypeException(String typeTag) {
        super("Could not find node for type \"" + typeTag + "\".", null);
        this.typeTag = typeTag;
    }

    /** The type tag that could not be resolved. */
    public String typeTag() {
        return typeTag;
    }
}
