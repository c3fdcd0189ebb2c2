package com.alexberriman.domauditor.exception;

/**
 * Base exception for all visual-dom-auditor application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class DomAuditorException extends RuntimeException {

    public DomAuditorException(String message) {
        super(message);
    }

    public DomAuditorException(String message, Throwable cause) {
        super(message, cause);
    }
}
