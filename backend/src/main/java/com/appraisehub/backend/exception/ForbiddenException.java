package com.appraisehub.backend.exception;

/**
 * Thrown when the actor's role or relationship to a record does not allow the request.
 */
public class ForbiddenException extends AppraisalException {

    public ForbiddenException(String message) {
        super(message);
    }
}
