package com.cmlarchitect.core.validation;

/**
 * Shape of an accepted attribute type.
 */
public enum AttributeTypeKind {
    /** One of the built-in scalar types such as {@code String} or {@code BigDecimal} */
    PRIMITIVE,

    /** A domain object reference, bare ({@code CustomerId}) or marked ({@code - CustomerId}) */
    REFERENCE,

    /** {@code List<T>} or {@code Set<T>} */
    COLLECTION
}
