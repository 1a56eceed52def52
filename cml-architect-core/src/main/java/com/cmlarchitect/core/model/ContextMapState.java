package com.cmlarchitect.core.model;

/**
 * Whether a context map describes the current or the intended landscape.
 */
public enum ContextMapState {
    /** Snapshot of the landscape as it is today */
    AS_IS,

    /** Target landscape */
    TO_BE
}
