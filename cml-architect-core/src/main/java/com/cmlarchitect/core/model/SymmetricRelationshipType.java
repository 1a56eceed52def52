package com.cmlarchitect.core.model;

/**
 * Kinds of symmetric relationships.
 */
public enum SymmetricRelationshipType {
    PARTNERSHIP("Partnership"),
    SHARED_KERNEL("SharedKernel");

    private final String keyword;

    SymmetricRelationshipType(String keyword) {
        this.keyword = keyword;
    }

    /**
     * Returns the CML keyword for this type.
     *
     * @return keyword as written in documents
     */
    public String keyword() {
        return keyword;
    }
}
