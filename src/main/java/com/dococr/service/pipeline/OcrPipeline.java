package com.dococr.service.pipeline;

import com.dococr.config.OcrProperties;
import com.dococr.exception.OcrException;
import com.dococr.exception.RecognitionException;
import com.dococr.model.OcrResult;
import com.dococr.model.RecognitionOptions;
import com.dococr.model.RecognitionOutcome;
import com.dococr.model.StageOutcome;
import com.dococr.service.preprocessing.ImageConditioner;
import com.dococr.service.spelling.TextCorrector;
import java.nio.file.Path;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Entry point of a recognition request: condition, recognise, correct. Runs synchronously on the
 * calling thread and keeps no state between calls.
 */
@Service
public class OcrPipeline {

    private static final Logger log = LoggerFactory.getLogger(OcrPipeline.class);

    private final ImageConditioner conditioner;
    private final RecognitionAggregator aggregator;
    private final TextCorrector corrector;
    private final RecognitionOptions defaults;

    @Autowired
    public OcrPipeline(ImageConditioner conditioner,
                       RecognitionAggregator aggregator,
                       TextCorrector corrector,
                       OcrProperties properties) {
        this(conditioner, aggregator, corrector, properties.defaults().toOptions());
    }

    OcrPipeline(ImageConditioner conditioner,
                RecognitionAggregator aggregator,
                TextCorrector corrector,
                RecognitionOptions defaults) {
        this.conditioner = conditioner;
        this.aggregator = aggregator;
        this.corrector = corrector;
        this.defaults = defaults;
    }

    /**
     * Options used for anything a caller leaves unspecified.
     */
    public RecognitionOptions defaultOptions() {
        return defaults;
    }

    /**
     * @throws com.dococr.exception.ImageLoadException if the file cannot be read or decoded
     * @throws com.dococr.exception.EngineNotFoundException if Tesseract is not installed
     * @throws RecognitionException for any other failure, with the original cause attached
     */
    public RecognitionOutcome recognize(Path imagePath, RecognitionOptions options) {
        log.info("Performing OCR on {} with lang={}, psm={}, oem={}, blur={}",
                imagePath.getFileName(), options.language(), options.pageSegmentationMode(),
                options.engineMode(), options.blurType());
        try {
            Mat conditioned = conditioner.condition(imagePath, options);
            OcrResult raw = aggregator.recognize(conditioned, options);

            StageOutcome<String> corrected = corrector.correct(raw.text(), options);
            log.debug("Spell check {}: {}", corrected.status(), corrected.detail());

            OcrResult result = new OcrResult(corrected.value(), raw.processedWidth(), raw.processedHeight());
            return new RecognitionOutcome(result, conditioned);
        } catch (OcrException ex) {
            if (ex instanceof RecognitionException) {
                log.error("OCR failed for {}", imagePath, ex);
            }
            throw ex;
        } catch (RuntimeException ex) {
            log.error("Unexpected error during OCR of {}", imagePath, ex);
            throw new RecognitionException("Unexpected error during OCR: " + ex.getClass().getSimpleName(), ex);
        }
    }
}
