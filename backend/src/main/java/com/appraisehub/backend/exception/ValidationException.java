package com.appraisehub.backend.exception;

/**
 * Thrown for malformed input or a transition whose preconditions are not met.
 */
public class ValidationException extends AppraisalException {

    public ValidationException(String message) {
        super(message);
    }
}
