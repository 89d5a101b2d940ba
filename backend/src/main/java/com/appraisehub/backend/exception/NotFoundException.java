package com.appraisehub.backend.exception;

/**
 * Thrown when a campaign, group, evaluation or task does not exist.
 */
public class NotFoundException extends AppraisalException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException of(String entity, Object id) {
        return new NotFoundException(entity + " not found: " + id);
    }
}
