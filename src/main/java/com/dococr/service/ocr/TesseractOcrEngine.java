package com.dococr.service.ocr;

import com.dococr.exception.EngineNotFoundException;
import com.dococr.exception.RecognitionException;
import com.dococr.util.ImageUtils;
import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import net.sourceforge.tess4j.ITessAPI;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Word;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs Tesseract through Tess4J at word level. A new Tess4J instance is configured per call.
 */
@Component
public class TesseractOcrEngine implements OcrEngine {

    private static final Logger log = LoggerFactory.getLogger(TesseractOcrEngine.class);

    private final TesseractFactory factory;
    private final TessdataResolver tessdataResolver;

    public TesseractOcrEngine(TesseractFactory factory, TessdataResolver tessdataResolver) {
        this.factory = Objects.requireNonNull(factory, "factory");
        this.tessdataResolver = Objects.requireNonNull(tessdataResolver, "tessdataResolver");
    }

    @Override
    public WordDetections detectWords(Mat image, EngineConfiguration configuration) {
        log.debug("Running Tesseract with config: {}", configuration.toCommandLine());
        try {
            ITesseract tesseract = configure(factory.create(), configuration);
            BufferedImage buffered = ImageUtils.matToBufferedImage(image);
            List<Word> words = tesseract.getWords(buffered, ITessAPI.TessPageIteratorLevel.RIL_WORD);
            return toDetections(words);
        } catch (UnsatisfiedLinkError | NoClassDefFoundError ex) {
            log.error("Tesseract native library could not be loaded", ex);
            throw new EngineNotFoundException(
                    "Tesseract OCR engine not found. Install Tesseract or set ocr.engine.library-path", ex);
        } catch (Error ex) {
            if ("Invalid memory access".equalsIgnoreCase(ex.getMessage())) {
                String message = String.format(
                        "Tesseract native layer failed. Verify that the tessdata directory contains %s.traineddata",
                        configuration.language());
                log.error(message, ex);
                throw new RecognitionException(message, ex);
            }
            throw ex;
        } catch (RuntimeException ex) {
            throw new RecognitionException("Tesseract failed: " + ex.getMessage(), ex);
        }
    }

    private ITesseract configure(ITesseract tesseract, EngineConfiguration configuration) {
        tesseract.setOcrEngineMode(configuration.engineMode());
        tesseract.setPageSegMode(configuration.pageSegmentationMode());
        tesseract.setLanguage(configuration.language());
        String datapath = configuration.tessdataOverride()
                .or(() -> tessdataResolver.resolve(configuration.language()).map(Path::toString))
                .orElse(null);
        if (datapath != null) {
            tesseract.setDatapath(datapath);
        }
        return tesseract;
    }

    private static WordDetections toDetections(List<Word> words) {
        if (words == null || words.isEmpty()) {
            return WordDetections.empty();
        }
        List<String> texts = new ArrayList<>(words.size());
        List<Float> confidences = new ArrayList<>(words.size());
        List<Rectangle> boxes = new ArrayList<>(words.size());
        for (Word word : words) {
            texts.add(word == null ? null : word.getText());
            confidences.add(word == null ? null : word.getConfidence());
            boxes.add(word == null ? null : word.getBoundingBox());
        }
        return new WordDetections(texts, confidences, boxes);
    }
}
