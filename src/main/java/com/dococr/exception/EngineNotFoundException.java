package com.dococr.exception;

/**
 * Raised when the native Tesseract library cannot be located. Kept apart from
 * {@link RecognitionException} so callers can point users at the installation instead of
 * reporting a generic failure.
 */
public class EngineNotFoundException extends OcrException {

    public EngineNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
