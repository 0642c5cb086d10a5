package com.dococr.exception;

/**
 * Root of the failures that abort a whole recognition request.
 */
public class OcrException extends RuntimeException {

    public OcrException(String message) {
        super(message);
    }

    public OcrException(String message, Throwable cause) {
        super(message, cause);
    }
}
