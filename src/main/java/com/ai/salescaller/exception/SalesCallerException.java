package com.ai.salescaller.exception;

/**
 * Base exception for application errors. Everything the call engine throws on purpose extends this.
 */
public class SalesCallerException extends RuntimeException {

    public SalesCallerException(String message) {
        super(message);
    }

    public SalesCallerException(String message, Throwable cause) {
        super(message, cause);
    }
}
