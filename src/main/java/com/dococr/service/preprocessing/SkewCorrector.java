package com.dococr.service.preprocessing;

import com.dococr.config.OcrProperties;
import com.dococr.model.StageOutcome;
import java.util.OptionalDouble;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Point2f;
import org.bytedeco.opencv.opencv_core.RotatedRect;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.bytedeco.opencv.opencv_core.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Estimates document rotation from the minimum-area rectangle enclosing all foreground pixels
 * and rotates the page back when the skew is significant.
 */
@Component
public class SkewCorrector {

    private static final Logger log = LoggerFactory.getLogger(SkewCorrector.class);

    private final double minAngle;

    @Autowired
    public SkewCorrector(OcrProperties properties) {
        this(properties.conditioning().deskewMinAngle());
    }

    SkewCorrector(double minAngle) {
        this.minAngle = minAngle;
    }

    /**
     * Rotates {@code gray} so its text lines run horizontally. Any failure hands the input back
     * unchanged.
     */
    public StageOutcome<Mat> correct(Mat gray) {
        try {
            OptionalDouble estimate = estimateAngle(gray);
            if (estimate.isEmpty()) {
                log.debug("Deskew skipped: no foreground pixels found");
                return StageOutcome.unchanged(gray, "no foreground pixels");
            }
            double angle = estimate.getAsDouble();
            log.debug("Estimated skew angle {} degrees", String.format("%.2f", angle));
            if (Math.abs(angle) <= minAngle) {
                return StageOutcome.unchanged(gray, "angle below threshold");
            }
            Mat rotated = rotate(gray, angle);
            return StageOutcome.corrected(rotated, String.format("rotated by %.2f degrees", angle));
        } catch (RuntimeException ex) {
            log.warn("Deskew failed, keeping original image: {}", ex.getMessage());
            return StageOutcome.unchanged(gray, "estimation failed: " + ex.getMessage());
        }
    }

    /**
     * Returns the signed rotation in degrees that aligns the page, or empty when the image has
     * no candidate text pixels.
     */
    public OptionalDouble estimateAngle(Mat gray) {
        Mat inverted = new Mat();
        opencv_core.bitwise_not(gray, inverted);
        Mat thresh = new Mat();
        opencv_imgproc.threshold(inverted, thresh, 0, 255,
                opencv_imgproc.THRESH_BINARY | opencv_imgproc.THRESH_OTSU);
        if (opencv_core.countNonZero(thresh) == 0) {
            return OptionalDouble.empty();
        }

        // Points are collected as (row, col); the sign convention below depends on it.
        Mat transposed = new Mat();
        opencv_core.transpose(thresh, transposed);
        Mat points = new Mat();
        opencv_core.findNonZero(transposed, points);
        RotatedRect rect = opencv_imgproc.minAreaRect(points);
        return OptionalDouble.of(normalize(rect.angle()));
    }

    /**
     * Maps a rectangle angle onto a signed rotation relative to the horizontal axis. Angles are
     * first folded into [-90, 0) so both OpenCV rectangle conventions behave the same.
     */
    static double normalize(double rectAngle) {
        double angle = rectAngle;
        while (angle >= 0) {
            angle -= 90;
        }
        while (angle < -90) {
            angle += 90;
        }
        if (angle < -45) {
            return -(90 + angle);
        }
        return -angle;
    }

    private Mat rotate(Mat gray, double angle) {
        int width = gray.cols();
        int height = gray.rows();
        Point2f center = new Point2f(width / 2, height / 2);
        Mat matrix = opencv_imgproc.getRotationMatrix2D(center, angle, 1.0);
        Mat rotated = new Mat();
        opencv_imgproc.warpAffine(gray, rotated, matrix, new Size(width, height),
                opencv_imgproc.INTER_CUBIC, opencv_core.BORDER_REPLICATE, new Scalar());
        return rotated;
    }
}
