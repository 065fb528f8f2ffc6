package com.wom.openings.exception;

/**
 * The discovery request, after defaults are applied, cannot form a query. Reported to the caller as 400.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
