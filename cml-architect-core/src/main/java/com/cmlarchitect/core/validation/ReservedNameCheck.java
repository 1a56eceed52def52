package com.cmlarchitect.core.validation;

import java.util.List;

/**
 * Result of checking a domain object name against the structural blacklist.
 *
 * @param reserved true if the name may not be used
 * @param suggestions alternative names, empty when the name is not reserved
 */
public record ReservedNameCheck(
    boolean reserved,
    List<String> suggestions
) {
    /**
     * Compact constructor with validation.
     */
    public ReservedNameCheck {
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    static ReservedNameCheck allowed() {
        return new ReservedNameCheck(false, List.of());
    }

    /**
     * Returns the suggestions as one comma separated string.
     *
     * @return suggestions joined for display
     */
    public String suggestionText() {
        return String.join(", ", suggestions);
    }
}
