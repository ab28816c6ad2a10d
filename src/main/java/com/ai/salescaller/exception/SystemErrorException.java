package com.ai.salescaller.exception;

/**
 * Unexpected failure inside the engine itself. The call is closed with an apology and
 * recorded for manual follow-up.
 */
public class SystemErrorException extends SalesCallerException {

    public SystemErrorException(String message) {
        super(message);
    }

    public SystemErrorException(String message, Throwable cause) {
        super(message, cause);
    }
}
