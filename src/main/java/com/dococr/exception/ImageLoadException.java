package com.dococr.exception;

public class ImageLoadException extends OcrException {

    public ImageLoadException(String message) {
        super(message);
    }

    public ImageLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
