package io.schemanode.core.error;

import java.util.List;

/** Thrown when a node is created with unrecognized option keys or a badly typed option value. */
public final class InvalidOptionException extends SchemaDefinitionException {

    private static final long serialVersionUID = 1L;

    private final List<String> options;

    public InvalidOptionException(String message, List<String> options) {
        super(message, null);
        this.options = List.copyOf(options);
    }

    /** The offending option keys. */
    public List<String> options() {
        return options;
    }
}
