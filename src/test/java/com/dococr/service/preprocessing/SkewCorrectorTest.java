package com.dococr.service.preprocessing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.dococr.model.StageOutcome;
import com.dococr.support.TestImages;
import java.util.OptionalDouble;
import org.bytedeco.opencv.opencv_core.Mat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SkewCorrectorTest {

    private final SkewCorrector corrector = new SkewCorrector(0.5);

    @Test
    void blankPageIsReturnedUnchanged() {
        Mat blank = TestImages.blankPage();

        StageOutcome<Mat> outcome = corrector.correct(blank);

        assertFalse(outcome.isCorrected());
        assertSame(blank, outcome.value());
    }

    @Test
    void alignedPageIsReturnedUnchanged() {
        Mat page = TestImages.textPage();

        StageOutcome<Mat> outcome = corrector.correct(page);

        assertFalse(outcome.isCorrected());
        assertSame(page, outcome.value());
    }

    @Test
    void estimatesRotationOfSyntheticPage() {
        Mat skewed = TestImages.rotated(TestImages.textPage(), 10);

        OptionalDouble angle = corrector.estimateAngle(skewed);

        assertTrue(angle.isPresent());
        assertEquals(10.0, Math.abs(angle.getAsDouble()), 1.0);
    }

    @Test
    void correctsTenDegreeRotation() {
        Mat skewed = TestImages.rotated(TestImages.textPage(), 10);

        StageOutcome<Mat> outcome = corrector.correct(skewed);

        assertTrue(outcome.isCorrected());
        Mat corrected = outcome.value();
        assertEquals(skewed.cols(), corrected.cols());
        assertEquals(skewed.rows(), corrected.rows());
        OptionalDouble residual = corrector.estimateAngle(corrected);
        assertTrue(residual.isPresent());
        assertTrue(Math.abs(residual.getAsDouble()) < 1.0,
                "Residual skew should be below one degree but was " + residual.getAsDouble());
    }

    @Test
    void correctsClockwiseRotation() {
        Mat skewed = TestImages.rotated(TestImages.textPage(), -7);

        StageOutcome<Mat> outcome = corrector.correct(skewed);

        assertTrue(outcome.isCorrected());
        assertTrue(Math.abs(corrector.estimateAngle(outcome.value()).getAsDouble()) < 1.0);
    }

    @Test
    void failureHandsBackTheInput() {
        Mat empty = new Mat();

        StageOutcome<Mat> outcome = corrector.correct(empty);

        assertFalse(outcome.isCorrected());
        assertSame(empty, outcome.value());
    }

    @Nested
    @DisplayName("normalize")
    class Normalize {

        @Test
        void axisAlignedRectanglesMapToZero() {
            assertEquals(0.0, SkewCorrector.normalize(-90.0), 1e-9);
            assertEquals(0.0, SkewCorrector.normalize(90.0), 1e-9);
        }

        @Test
        void anglesBelowMinusFortyFiveAreMirrored() {
            assertEquals(-10.0, SkewCorrector.normalize(-80.0), 1e-9);
        }

        @Test
        void anglesAboveMinusFortyFiveAreNegated() {
            assertEquals(10.0, SkewCorrector.normalize(-10.0), 1e-9);
        }

        @Test
        void positiveRectangleAnglesAreFoldedFirst() {
            assertEquals(-10.0, SkewCorrector.normalize(10.0), 1e-9);
            assertEquals(10.0, SkewCorrector.normalize(80.0), 1e-9);
        }
    }
}
