package com.dococr.model;

import org.bytedeco.opencv.opencv_core.Mat;

/**
 * Result of a recognition request together with the binary image that was submitted to the
 * engine, kept for previews. The caller owns the image and should close it once done.
 */
public record RecognitionOutcome(OcrResult result, Mat conditionedImage) {
}
