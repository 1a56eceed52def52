package com.cmlarchitect.core.validation;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks attribute type strings against the closed type grammar of CML attributes.
 *
 * <p>Accepted shapes:
 * <ul>
 *   <li>a primitive such as {@code String}, {@code int} or {@code BigDecimal}</li>
 *   <li>a bare domain object reference such as {@code CustomerId}</li>
 *   <li>a marked reference such as {@code - CustomerId}</li>
 *   <li>{@code List<T>} or {@code Set<T>} where {@code T} is a plain identifier</li>
 * </ul>
 * Bare names shaped like maps, tuples, dynamic or function types are rejected, as are nested
 * and other generics. A marked reference always names a declared domain object and is only
 * checked for identifier syntax. Every rejection carries a suggestion expressed in accepted syntax.
 */
public final class AttributeTypeValidator {

    private static final Set<String> PRIMITIVES = Set.of(
        "String", "int", "Integer", "long", "Long", "double", "Double", "float", "Float",
        "boolean", "Boolean", "BigDecimal", "BigInteger", "Date", "DateTime", "LocalDate",
        "LocalDateTime", "Instant", "Timestamp", "UUID", "byte", "Byte", "short", "Short",
        "char", "Character", "Blob", "Clob", "Duration"
    );

    private static final Set<String> COLLECTIONS = Set.of("List", "Set");

    private static final Pattern GENERIC = Pattern.compile("^(\\w+)\\s*<(.*)>$");
    private static final Pattern REFERENCE = Pattern.compile("^-\\s*(.*)$");
    private static final Pattern MAP_LIKE = Pattern.compile("(?i)(hash|tree|linkedhash|concurrent)?map|dict(ionary)?");
    // Only map, tuple, dynamic and callable shapes; ordinary domain names such as Action stay legal.
    private static final Pattern FORBIDDEN = Pattern.compile(
        "(?i)(hash|tree|linkedhash|concurrent)?map|dict(ionary)?|tuple\\d*|any|dynamic"
            + "|func(tion)?\\d*|callback|lambda");

    private AttributeTypeValidator() {
        // Utility class
    }

    /**
     * Validates one attribute type string.
     *
     * @param type type as written in a document or passed to a workspace mutation
     * @return acceptance with the type's shape, or rejection with error and suggestion
     */
    public static TypeCheck validateAttributeType(String type) {
        if (type == null || type.isBlank()) {
            return TypeCheck.rejected("Attribute type must not be empty", "String");
        }
        String trimmed = type.trim();

        Matcher reference = REFERENCE.matcher(trimmed);
        if (reference.matches()) {
            String target = reference.group(1).trim();
            if (!Identifiers.isValid(target)) {
                return TypeCheck.rejected(
                    "Reference type '" + trimmed + "' must name a single domain object",
                    "- " + Identifiers.sanitize(target));
            }
            return TypeCheck.accepted(AttributeTypeKind.REFERENCE);
        }

        Matcher generic = GENERIC.matcher(trimmed);
        if (generic.matches()) {
            return checkGeneric(trimmed, generic.group(1), generic.group(2).trim());
        }

        if (!Identifiers.isValid(trimmed)) {
            String base = trimmed.replaceAll("[^a-zA-Z0-9_].*$", "");
            return TypeCheck.rejected(
                "Invalid attribute type syntax '" + trimmed + "'",
                Identifiers.isValid(base) ? "List<" + base + ">" : "String");
        }
        if (PRIMITIVES.contains(trimmed)) {
            return TypeCheck.accepted(AttributeTypeKind.PRIMITIVE);
        }
        return checkNamed(trimmed, AttributeTypeKind.REFERENCE);
    }

    /**
     * Returns whether a type is one of the built-in primitives.
     *
     * @param type type name
     * @return true for primitives such as {@code String}
     */
    public static boolean isPrimitive(String type) {
        return type != null && PRIMITIVES.contains(type.trim());
    }

    private static TypeCheck checkGeneric(String type, String outer, String inner) {
        if (MAP_LIKE.matcher(outer).matches()) {
            return TypeCheck.rejected(
                "Map types are not supported: '" + type + "'",
                "Model the entries as a ValueObject and use List<EntryValueObject>");
        }
        if (!COLLECTIONS.contains(outer)) {
            return TypeCheck.rejected(
                "Generic type '" + outer + "' is not supported, only List<T> and Set<T> are allowed",
                "List<" + firstIdentifier(inner) + ">");
        }
        if (inner.contains("<")) {
            return TypeCheck.rejected(
                "Nested generic types are not supported: '" + type + "'",
                "Wrap the inner collection in a ValueObject and use " + outer + "<WrapperValueObject>");
        }
        if (inner.contains(",")) {
            return TypeCheck.rejected(
                outer + " takes exactly one type argument: '" + type + "'",
                outer + "<" + firstIdentifier(inner) + ">");
        }
        if (!Identifiers.isValid(inner)) {
            return TypeCheck.rejected(
                "Invalid element type '" + inner + "' in '" + type + "'",
                outer + "<String>");
        }
        if (FORBIDDEN.matcher(inner).matches()) {
            return TypeCheck.rejected(
                "Element type '" + inner + "' is not supported in '" + type + "'",
                outer + "<" + inner + "ValueObject>");
        }
        return TypeCheck.accepted(AttributeTypeKind.COLLECTION);
    }

    private static TypeCheck checkNamed(String name, AttributeTypeKind kind) {
        if (FORBIDDEN.matcher(name).matches()) {
            return TypeCheck.rejected(
                "Type '" + name + "' is not supported in CML",
                MAP_LIKE.matcher(name).matches() ? "List<EntryValueObject>" : "String");
        }
        return TypeCheck.accepted(kind);
    }

    private static String firstIdentifier(String text) {
        String candidate = text.replaceAll("[^a-zA-Z0-9_].*$", "");
        return Identifiers.isValid(candidate) ? candidate : "String";
    }
}
