package com.starscape.rapidresize.common.exception;

/**
 * Thrown when a working set already has a load session or save run in flight.
 */
public class OperationInProgressException extends RuntimeException {

    public OperationInProgressException(String message) {
        super(message);
    }
}
