package com.cmlarchitect.core.validation;

import java.util.regex.Pattern;

/**
 * Identifier checks and cleanup for names coming from outside a document.
 */
public final class Identifiers {

    private static final Pattern VALID = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");
    private static final Pattern INVALID_CHARACTER = Pattern.compile("[^a-zA-Z0-9_]");
    private static final Pattern CONTEXT_SUFFIX = Pattern.compile("(Platform|Context|Server)$");

    /** Returned for names that contain nothing usable. */
    public static final String UNNAMED = "_unnamed";

    private Identifiers() {
        // Utility class
    }

    /**
     * Returns whether a name is a plain CML identifier.
     *
     * @param name candidate name
     * @return true for letters, digits and underscores not starting with a digit
     */
    public static boolean isValid(String name) {
        return name != null && VALID.matcher(name).matches();
    }

    /**
     * Turns arbitrary text into an identifier: every invalid character becomes {@code _}
     * and a leading digit gets a {@code _} prefix.
     *
     * @param rawName raw name, may be {@code null}
     * @return a valid identifier, {@value #UNNAMED} for empty input
     */
    public static String sanitize(String rawName) {
        if (rawName == null || rawName.isEmpty()) {
            return UNNAMED;
        }
        String sanitized = INVALID_CHARACTER.matcher(rawName).replaceAll("_");
        if (Character.isDigit(sanitized.charAt(0))) {
            sanitized = "_" + sanitized;
        }
        return sanitized;
    }

    /**
     * Derives the prefix suggested for disambiguating a domain object name, e.g.
     * {@code DatabricksPlatform} becomes {@code Databricks}.
     *
     * @param contextName bounded context name
     * @return context name without a trailing Platform, Context or Server
     */
    public static String contextPrefix(String contextName) {
        String prefix = CONTEXT_SUFFIX.matcher(contextName).replaceFirst("");
        return prefix.isEmpty() ? contextName : prefix;
    }
}
