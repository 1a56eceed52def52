package com.cmlarchitect.core.workspace;

import java.util.List;

/**
 * Outcome of {@link ModelWorkspace#batchAddElements(BatchRequest, boolean)}.
 *
 * @param success whether every element was added
 * @param created created (or, for identifiers, reused) elements; empty on failure
 * @param errors rejected elements; empty on success
 */
public record BatchResult(
    boolean success,
    List<CreatedElement> created,
    List<BatchError> errors
) {
    /**
     * Compact constructor with validation.
     */
    public BatchResult {
        created = created == null ? List.of() : List.copyOf(created);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    static BatchResult succeeded(List<CreatedElement> created) {
        return new BatchResult(true, created, List.of());
    }

    static BatchResult failed(List<BatchError> errors) {
        return new BatchResult(false, List.of(), errors);
    }

    /**
     * An element added by a batch.
     *
     * @param type element type
     * @param id element id
     * @param name final (sanitized) name
     */
    public record CreatedElement(ElementType type, String id, String name) {}

    /**
     * An element a batch rejected.
     *
     * @param type element type, {@code null} when the batch target itself was not found
     * @param name offending name
     * @param error reason
     */
    public record BatchError(ElementType type, String name, String error) {}
}
