package com.cmlarchitect.core.model;

/**
 * Patterns an upstream context can offer. Not mutually exclusive.
 */
public enum UpstreamPattern {
    /** Open Host Service */
    OHS,

    /** Published Language */
    PL
}
