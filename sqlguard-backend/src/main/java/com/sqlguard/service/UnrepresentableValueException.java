package com.sqlguard.service;

/**
 * Thrown when a backend value has no faithful text form. The result is refused rather than
 * padded with a guessed value.
 */
public class UnrepresentableValueException extends IllegalStateException {
    /**
     * Create a new exception.
     *
     * @param valueType backend class that could not be normalized
     */
    public UnrepresentableValueException(String valueType) {
        super("Cannot normalize backend value of type " + valueType);
    }
}
