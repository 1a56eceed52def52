package com.cmlarchitect.core.validation;

/**
 * Severity of a validation diagnostic.
 */
public enum Severity {
    /** The model violates a rule; it is still a usable value but not valid */
    ERROR,

    /** The model is valid but probably not what the author intended */
    WARNING
}
