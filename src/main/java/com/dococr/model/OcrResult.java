package com.dococr.model;

/**
 * Durable output of a recognition request. The dimensions are those of the conditioned image
 * handed to Tesseract, not of the uploaded file.
 */
public record OcrResult(String text, int processedWidth, int processedHeight) {

    public OcrResult {
        text = text == null ? "" : text;
    }
}
