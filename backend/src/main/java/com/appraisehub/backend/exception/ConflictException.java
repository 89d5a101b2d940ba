package com.appraisehub.backend.exception;

/**
 * Thrown when a request collides with existing state, such as a duplicate
 * group membership or a task that was already processed.
 */
public class ConflictException extends AppraisalException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
