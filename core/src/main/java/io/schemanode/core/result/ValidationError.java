package io.schemanode.core.result;

import java.io.Serializable;
import java.util.Objects;

/**
 * A single validation failure: a slash-delimited location within the data tree and a message.
 *
 * @param path    location of the failing value, {@code /} for the root
 * @param message human-readable description
 */
public record ValidationError(String path, String message) implements Serializable {

    public ValidationError {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    @Override
    public String toString() {
        return path + ": " + message;
    }
}
