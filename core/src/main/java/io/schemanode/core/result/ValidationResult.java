package io.schemanode.core.result;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Call-scoped accumulator of path-tagged validation errors.
 *
 * <p>
 * A result is rooted at the node it was created for: errors recorded without an explicit path
 * land on {@link #ROOT_PATH}. Containers validate each child into a fresh result and
 * {@link #merge(ValidationResult, String) merge} it under the child's segment, so paths are
 * built up as validation recurses. Combinators use fresh results as disposable probes.
 *
 * <p>
 * Not thread-safe. A result lives only for the validation call that created it.
 */
public final class ValidationResult {

    /** Path of the value a result was created for. */
    public static final String ROOT_PATH = "/";

    private final List<ValidationError> errors = new ArrayList<>();

    /** Records an error at the root of this result. */
    public void error(String message) {
        error(message, ROOT_PATH);
    }

    /**
     * Records an error at an explicit path.
     *
     * @param message human-readable description
     * @param path    slash-delimited path relative to this result
     */
    public void error(String message, String path) {
        errors.add(new ValidationError(path, message));
    }

    /**
     * Appends the errors of a child result, re-keyed under {@code segment}. A child error at
     * {@code /} becomes {@code /segment}; one at {@code /a/b} becomes {@code /segment/a/b}.
     * Segments are not escaped, so a segment containing {@code /} yields an ambiguous path.
     *
     * @param child   result the child value was validated into
     * @param segment property name or array index the child was found under
     */
    public void merge(ValidationResult child, String segment) {
        Objects.requireNonNull(child, "child must not be null");
        Objects.requireNonNull(segment, "segment must not be null");
        for (ValidationError error : child.errors) {
            errors.add(new ValidationError(join(segment, error.path()), error.message()));
        }
    }

    /** Returns {@code true} if no error has been recorded. */
    public boolean isValid() {
        return errors.isEmpty();
    }

    /** The recorded errors in insertion order. */
    public List<ValidationError> errors() {
        return Collections.unmodifiableList(errors);
    }

    /** The recorded messages grouped by path, paths in order of first occurrence. */
    public Map<String, List<String>> messages() {
        Map<String, List<String>> messages = new LinkedHashMap<>();
        for (ValidationError error : errors) {
            messages.computeIfAbsent(error.path(), p -> new ArrayList<>()).add(error.message());
        }
        return messages;
    }

    static String join(String segment, String childPath) {
        String prefix = ROOT_PATH + segment;
        return ROOT_PATH.equals(childPath) ? prefix : prefix + childPath;
    }

    @Override
    public String toString() {
        return isValid() ? "ValidationResult[VALID]" : "ValidationResult[INVALID, errors=" + errors + "]";
    }
}
