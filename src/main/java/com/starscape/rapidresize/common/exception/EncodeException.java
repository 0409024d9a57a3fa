package com.starscape.rapidresize.common.exception;

import java.io.IOException;

/**
 * Thrown when an encoder rejects the image or the requested parameters.
 */
public class EncodeException extends IOException {

    public EncodeException(String message) {
        super(message);
    }

    public EncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
