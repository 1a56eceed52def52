package com.cmlarchitect.core.workspace;

/**
 * Outcome of a single workspace mutation.
 *
 * <p>A failed mutation never changes the workspace.
 *
 * @param success whether the element was added
 * @param id id of the created element, {@code null} on failure
 * @param error reason for rejection, {@code null} on success
 * @param suggestion what to do instead, may be {@code null}
 */
public record MutationResult(
    boolean success,
    String id,
    String error,
    String suggestion
) {
    static MutationResult created(String id) {
        return new MutationResult(true, id, null, null);
    }

    static MutationResult rejected(String error) {
        return new MutationResult(false, null, error, null);
    }

    static MutationResult rejected(String error, String suggestion) {
        return new MutationResult(false, null, error, suggestion);
    }
}
