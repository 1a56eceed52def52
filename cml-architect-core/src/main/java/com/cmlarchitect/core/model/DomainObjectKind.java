package com.cmlarchitect.core.model;

/**
 * Kinds of named elements inside an aggregate.
 */
public enum DomainObjectKind {
    ENTITY("Entity"),
    VALUE_OBJECT("Value Object"),
    DOMAIN_EVENT("Domain Event"),
    COMMAND("Command"),
    SERVICE("Service");

    private final String displayName;

    DomainObjectKind(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Returns the human-readable kind name used in messages.
     *
     * @return display name
     */
    public String displayName() {
        return displayName;
    }
}
