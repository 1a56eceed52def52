package com.cmlarchitect.core.util;

import java.util.UUID;

/**
 * Generates identifiers for model elements.
 *
 * <p>Identifiers exist so that callers can address individual elements of a model. They are
 * random, never derived from names, and play no part in validation or ordering.
 */
public final class IdGenerator {

    private IdGenerator() {
        // Utility class
    }

    /**
     * Returns a fresh identifier.
     *
     * @return random UUID string
     */
    public static String newId() {
        return UUID.randomUUID().toString();
    }
}
