package com.cmlarchitect.core.model;

/**
 * Patterns a downstream context can apply. Not mutually exclusive.
 */
public enum DownstreamPattern {
    /** Anti-Corruption Layer */
    ACL,

    /** Conformist */
    CF
}
