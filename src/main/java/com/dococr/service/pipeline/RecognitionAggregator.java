package com.dococr.service.pipeline;

import com.dococr.config.OcrProperties;
import com.dococr.model.OcrResult;
import com.dococr.model.RecognitionOptions;
import com.dococr.service.ocr.EngineConfiguration;
import com.dococr.service.ocr.OcrEngine;
import com.dococr.service.ocr.WordDetections;
import java.util.ArrayList;
import java.util.List;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Runs the OCR engine on a conditioned image and folds its per-word output into one line of
 * text. Words below the confidence threshold or blank after trimming are dropped; engine order
 * is preserved. A malformed word record only costs that word.
 */
@Component
public class RecognitionAggregator {

    private static final Logger log = LoggerFactory.getLogger(RecognitionAggregator.class);

    private final OcrEngine engine;
    private final double minConfidence;

    @Autowired
    public RecognitionAggregator(OcrEngine engine, OcrProperties properties) {
        this(engine, properties.aggregation().minConfidence());
    }

    RecognitionAggregator(OcrEngine engine, double minConfidence) {
        this.engine = engine;
        this.minConfidence = minConfidence;
    }

    public OcrResult recognize(Mat conditioned, RecognitionOptions options) {
        EngineConfiguration configuration = EngineConfiguration.from(options);
        log.info("Running OCR with config: {}", configuration.toCommandLine());
        WordDetections detections = engine.detectWords(conditioned, configuration);
        String text = aggregate(detections);
        return new OcrResult(text, conditioned.cols(), conditioned.rows());
    }

    public String aggregate(WordDetections detections) {
        if (detections.size() == 0) {
            log.info("Tesseract returned no text boxes");
            return "";
        }
        List<String> kept = new ArrayList<>();
        for (int i = 0; i < detections.size(); i++) {
            try {
                double confidence = detections.confidence(i);
                String text = detections.text(i).trim();
                if (confidence >= minConfidence && !text.isEmpty()) {
                    kept.add(text);
                }
            } catch (IndexOutOfBoundsException | NullPointerException | IllegalArgumentException ex) {
                log.warn("Skipping word {} due to data error: {}", i, ex.getMessage());
            }
        }
        log.info("Kept {} of {} words with confidence >= {}", kept.size(), detections.size(), minConfidence);
        return String.join(" ", kept).trim();
    }
}
