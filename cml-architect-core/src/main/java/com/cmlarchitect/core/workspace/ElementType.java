package com.cmlarchitect.core.workspace;

/**
 * Kinds of elements a batch can add to an aggregate, in the order a batch processes them.
 */
public enum ElementType {
    IDENTIFIER("Identifier"),
    VALUE_OBJECT("Value Object"),
    ENTITY("Entity"),
    DOMAIN_EVENT("Domain Event"),
    COMMAND("Command"),
    SERVICE("Service");

    private final String displayName;

    ElementType(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
