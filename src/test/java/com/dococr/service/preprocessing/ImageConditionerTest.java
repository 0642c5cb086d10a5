package com.dococr.service.preprocessing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.dococr.config.OcrProperties;
import com.dococr.exception.ImageLoadException;
import com.dococr.model.BlurType;
import com.dococr.model.RecognitionOptions;
import com.dococr.support.TestImages;
import com.dococr.support.TestProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.opencv_core.Mat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class ImageConditionerTest {

    @TempDir
    Path tempDir;

    private final ImageConditioner conditioner =
            new ImageConditioner(new SkewCorrector(0.5), TestProperties.conditioning());

    @ParameterizedTest
    @EnumSource(BlurType.class)
    void producesStrictlyBinaryOutput(BlurType blurType) {
        Path page = TestImages.writePng(TestImages.rotated(TestImages.textPage(), 4), tempDir, "page.png");
        RecognitionOptions options = RecognitionOptions.builder().blurType(blurType).build();

        Mat binary = conditioner.condition(page, options);

        assertEquals(1, binary.channels());
        for (byte sample : TestImages.samples(binary)) {
            int value = sample & 0xFF;
            assertTrue(value == 0 || value == 255, "Unexpected sample " + value);
        }
    }

    @Test
    void keepsDimensionsOfTheInput() {
        Path page = TestImages.writePng(TestImages.textPage(), tempDir, "page.png");

        Mat binary = conditioner.condition(page, RecognitionOptions.defaults());

        assertEquals(TestImages.WIDTH, binary.cols());
        assertEquals(TestImages.HEIGHT, binary.rows());
    }

    @Test
    void textBecomesWhiteOnBlack() {
        Path page = TestImages.writePng(TestImages.textPage(), tempDir, "page.png");
        RecognitionOptions options = RecognitionOptions.builder()
                .applyDeskew(false)
                .applyClahe(false)
                .blurType(BlurType.NONE)
                .build();

        Mat binary = conditioner.condition(page, options);

        int white = opencv_core.countNonZero(binary);
        assertTrue(white > 0, "Bar edges should be foreground");
        assertTrue(white < TestImages.WIDTH * TestImages.HEIGHT / 2, "Background should be black");
    }

    @Test
    void undecodableFileFailsWithImageLoadError() throws IOException {
        Path garbage = Files.writeString(tempDir.resolve("not-an-image.png"), "definitely not a png");

        assertThrows(ImageLoadException.class,
                () -> conditioner.condition(garbage, RecognitionOptions.defaults()));
    }

    @Test
    void missingFileFailsWithImageLoadError() {
        assertThrows(ImageLoadException.class,
                () -> conditioner.condition(tempDir.resolve("missing.png"), RecognitionOptions.defaults()));
    }

    @Test
    void rejectsEvenThresholdBlockSize() {
        OcrProperties.Conditioning invalid = new OcrProperties.Conditioning(2.0, 8, 5, 10, 4, 0.5);

        assertThrows(IllegalArgumentException.class,
                () -> new ImageConditioner(new SkewCorrector(0.5), invalid));
    }
}
