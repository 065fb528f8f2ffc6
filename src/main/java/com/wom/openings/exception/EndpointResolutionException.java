package com.wom.openings.exception;

/**
 * Neither API-description discovery nor probing produced a usable registry endpoint.
 */
public class EndpointResolutionException extends RuntimeException {

    public EndpointResolutionException(String message) {
        super(message);
    }
}
