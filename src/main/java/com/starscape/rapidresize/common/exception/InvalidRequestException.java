package com.starscape.rapidresize.common.exception;

/**
 * Thrown when a session or run is requested with inputs that cannot be processed,
 * before any background work starts.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
