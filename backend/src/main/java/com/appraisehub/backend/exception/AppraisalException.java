package com.appraisehub.backend.exception;

/**
 * Base exception for the appraisal lifecycle.
 */
public class AppraisalException extends RuntimeException {

    public AppraisalException(String message) {
        super(message);
    }

    public AppraisalException(String message, Throwable cause) {
        super(message, cause);
    }
}
