package com.cmlarchitect.core.model;

/**
 * Knowledge level of a bounded context or aggregate.
 */
public enum KnowledgeLevel {
    META,
    CONCRETE
}
