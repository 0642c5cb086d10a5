package com.dococr.service.preprocessing;

import com.dococr.config.OcrProperties;
import com.dococr.exception.ImageLoadException;
import com.dococr.exception.RecognitionException;
import com.dococr.model.RecognitionOptions;
import com.dococr.model.StageOutcome;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.bytedeco.opencv.global.opencv_imgcodecs;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Turns a scanned or photographed page into the inverted binary raster Tesseract is calibrated
 * for: grayscale, optional deskew, optional CLAHE, optional blur and a mandatory Gaussian
 * adaptive threshold. The steps always run in that order.
 */
@Component
public class ImageConditioner {

    private static final Logger log = LoggerFactory.getLogger(ImageConditioner.class);

    private final SkewCorrector skewCorrector;
    private final OcrProperties.Conditioning settings;

    @Autowired
    public ImageConditioner(SkewCorrector skewCorrector, OcrProperties properties) {
        this(skewCorrector, properties.conditioning());
    }

    ImageConditioner(SkewCorrector skewCorrector, OcrProperties.Conditioning settings) {
        this.skewCorrector = skewCorrector;
        this.settings = settings;
        requireOddAboveOne(settings.thresholdBlockSize(), "threshold block size");
        requireOddAboveOne(settings.blurKernelSize(), "blur kernel size");
    }

    public Mat condition(Path imagePath, RecognitionOptions options) {
        try {
            Mat current = loadGrayscale(imagePath);

            if (options.applyDeskew()) {
                StageOutcome<Mat> deskewed = skewCorrector.correct(current);
                log.debug("Deskew {}: {}", deskewed.status(), deskewed.detail());
                current = deskewed.value();
            } else {
                log.debug("Skipping deskew");
            }

            if (options.applyClahe()) {
                current = equalize(current);
            } else {
                log.debug("Skipping CLAHE");
            }

            current = blur(current, options);
            return binarize(current);
        } catch (ImageLoadException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new RecognitionException("Image conditioning failed for " + imagePath, ex);
        }
    }

    /**
     * Decodes the file and converts it to a single channel image.
     */
    public Mat loadGrayscale(Path imagePath) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(imagePath);
        } catch (IOException ex) {
            throw new ImageLoadException("Unable to read image file " + imagePath, ex);
        }
        Mat raw = bytes.length == 0 ? null : opencv_imgcodecs.imdecode(new Mat(bytes), opencv_imgcodecs.IMREAD_COLOR);
        if (raw == null || raw.empty()) {
            throw new ImageLoadException("Unable to decode image file " + imagePath);
        }
        Mat gray = new Mat();
        opencv_imgproc.cvtColor(raw, gray, opencv_imgproc.COLOR_BGR2GRAY);
        log.debug("Loaded {} as {}x{} grayscale", imagePath.getFileName(), gray.cols(), gray.rows());
        return gray;
    }

    Mat equalize(Mat gray) {
        Mat equalized = new Mat();
        int tiles = settings.claheTileGridSize();
        opencv_imgproc.createCLAHE(settings.claheClipLimit(), new Size(tiles, tiles)).apply(gray, equalized);
        return equalized;
    }

    Mat blur(Mat gray, RecognitionOptions options) {
        int kernel = settings.blurKernelSize();
        Mat blurred = new Mat();
        switch (options.blurType()) {
            case GAUSSIAN -> opencv_imgproc.GaussianBlur(gray, blurred, new Size(kernel, kernel), 0);
            case MEDIAN -> opencv_imgproc.medianBlur(gray, blurred, kernel);
            case NONE -> {
                log.debug("Skipping blur");
                return gray;
            }
            default -> {
                log.warn("Unsupported blur type {}; skipping blur", options.blurType());
                return gray;
            }
        }
        return blurred;
    }

    /**
     * Gaussian-weighted adaptive threshold, inverted so text ends up white on black.
     */
    Mat binarize(Mat gray) {
        Mat binary = new Mat();
        opencv_imgproc.adaptiveThreshold(gray, binary, 255,
                opencv_imgproc.ADAPTIVE_THRESH_GAUSSIAN_C,
                opencv_imgproc.THRESH_BINARY_INV,
                settings.thresholdBlockSize(),
                settings.thresholdBias());
        log.debug("Applied adaptive threshold (block {}, bias {})",
                settings.thresholdBlockSize(), settings.thresholdBias());
        return binary;
    }

    private static void requireOddAboveOne(int value, String name) {
        if (value <= 1 || value % 2 == 0) {
            throw new IllegalArgumentException(name + " must be an odd number greater than 1 but was " + value);
        }
    }
}
