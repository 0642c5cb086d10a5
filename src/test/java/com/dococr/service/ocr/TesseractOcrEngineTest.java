package com.dococr.service.ocr;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.dococr.exception.EngineNotFoundException;
import com.dococr.exception.RecognitionException;
import com.dococr.model.RecognitionOptions;
import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import net.sourceforge.tess4j.ITessAPI;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Word;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TesseractOcrEngineTest {

    @TempDir
    Path tempDir;

    private ITesseract tesseract;
    private TessdataResolver resolver;
    private TesseractOcrEngine engine;
    private final Mat image = new Mat(20, 40, opencv_core.CV_8UC1, new Scalar(0, 0, 0, 0));

    @BeforeEach
    void setUp() {
        tesseract = mock(ITesseract.class);
        resolver = mock(TessdataResolver.class);
        when(resolver.resolve(anyString())).thenReturn(Optional.empty());
        engine = new TesseractOcrEngine(() -> tesseract, resolver);
    }

    @Test
    void convertsWordsIntoParallelColumns() {
        when(tesseract.getWords(any(BufferedImage.class), anyInt())).thenReturn(List.of(
                new Word("Hello", 91.5f, new Rectangle(1, 2, 3, 4)),
                new Word("World", 62f, new Rectangle(5, 6, 7, 8))));

        WordDetections detections = engine.detectWords(image, EngineConfiguration.from(RecognitionOptions.defaults()));

        assertEquals(2, detections.size());
        assertEquals("Hello", detections.text(0));
        assertEquals(91.5, detections.confidence(0), 1e-6);
        assertEquals(new Rectangle(5, 6, 7, 8), detections.boxes().get(1));
        verify(tesseract).getWords(any(BufferedImage.class), eq(ITessAPI.TessPageIteratorLevel.RIL_WORD));
    }

    @Test
    void nullWordsBecomeMalformedRecords() {
        when(tesseract.getWords(any(BufferedImage.class), anyInt()))
                .thenReturn(Arrays.asList(new Word("ok", 80f, new Rectangle()), null));

        WordDetections detections = engine.detectWords(image, EngineConfiguration.from(RecognitionOptions.defaults()));

        assertEquals(2, detections.size());
        assertNull(detections.text(1));
        assertThrows(NullPointerException.class, () -> detections.confidence(1));
    }

    @Test
    void appliesModesLanguageAndTessdataOverride() {
        when(tesseract.getWords(any(BufferedImage.class), anyInt())).thenReturn(List.of());
        RecognitionOptions options = RecognitionOptions.builder()
                .language("ind")
                .pageSegmentationMode(11)
                .engineMode(1)
                .tessdataDir(tempDir.toString())
                .build();

        engine.detectWords(image, EngineConfiguration.from(options));

        verify(tesseract).setOcrEngineMode(1);
        verify(tesseract).setPageSegMode(11);
        verify(tesseract).setLanguage("ind");
        verify(tesseract).setDatapath(tempDir.toString().replace('\\', '/'));
    }

    @Test
    void fallsBackToResolvedTessdataDirectory() {
        when(tesseract.getWords(any(BufferedImage.class), anyInt())).thenReturn(List.of());
        when(resolver.resolve("eng")).thenReturn(Optional.of(tempDir));

        engine.detectWords(image, EngineConfiguration.from(RecognitionOptions.defaults()));

        verify(tesseract).setDatapath(tempDir.toString());
    }

    @Test
    void usesBundledTessdataWhenNoInstalledDirectoryHasTheLanguage() throws IOException {
        when(tesseract.getWords(any(BufferedImage.class), anyInt())).thenReturn(List.of());
        Files.createFile(tempDir.resolve("zzq.traineddata"));
        TessdataResolver bundledOnly = new TessdataResolver(List.of(), () -> tempDir);
        TesseractOcrEngine withBundled = new TesseractOcrEngine(() -> tesseract, bundledOnly);

        withBundled.detectWords(image, EngineConfiguration.from(RecognitionOptions.builder().language("zzq").build()));

        verify(tesseract).setDatapath(tempDir.toString());
    }

    @Test
    void leavesDatapathAloneWhenNothingResolves() {
        when(tesseract.getWords(any(BufferedImage.class), anyInt())).thenReturn(List.of());

        engine.detectWords(image, EngineConfiguration.from(RecognitionOptions.defaults()));

        verify(tesseract, never()).setDatapath(anyString());
    }

    @Test
    void missingNativeLibraryIsReportedAsEngineNotFound() {
        when(tesseract.getWords(any(BufferedImage.class), anyInt()))
                .thenThrow(new UnsatisfiedLinkError("Unable to load library 'tesseract'"));

        assertThrows(EngineNotFoundException.class,
                () -> engine.detectWords(image, EngineConfiguration.from(RecognitionOptions.defaults())));
    }

    @Test
    void otherEngineFailuresBecomeRecognitionErrors() {
        when(tesseract.getWords(any(BufferedImage.class), anyInt()))
                .thenThrow(new IllegalStateException("boom"));

        assertThrows(RecognitionException.class,
                () -> engine.detectWords(image, EngineConfiguration.from(RecognitionOptions.defaults())));
    }

    @Test
    void invalidMemoryAccessPointsAtTraineddata() {
        when(tesseract.getWords(any(BufferedImage.class), anyInt()))
                .thenThrow(new Error("Invalid memory access"));

        RecognitionException ex = assertThrows(RecognitionException.class,
                () -> engine.detectWords(image, EngineConfiguration.from(RecognitionOptions.defaults())));
        assertTrue(ex.getMessage().contains("eng.traineddata"));
    }
}
