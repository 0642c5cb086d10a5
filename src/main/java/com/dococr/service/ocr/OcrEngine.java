package com.dococr.service.ocr;

import org.bytedeco.opencv.opencv_core.Mat;

/**
 * External OCR engine returning per-word detections.
 */
public interface OcrEngine {

    /**
     * @throws com.dococr.exception.EngineNotFoundException if the engine cannot be located
     * @throws com.dococr.exception.RecognitionException for any other engine failure
     */
    WordDetections detectWords(Mat image, EngineConfiguration configuration);
}
