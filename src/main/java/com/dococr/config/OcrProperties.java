package com.dococr.config;

import com.dococr.model.BlurType;
import com.dococr.model.RecognitionOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "ocr")
public record OcrProperties(
        @DefaultValue Engine engine,
        @DefaultValue Defaults defaults,
        @DefaultValue Conditioning conditioning,
        @DefaultValue Aggregation aggregation,
        @DefaultValue Spelling spelling) {

    /**
     * Location of the native engine. Both values are optional; when absent the JNA search path
     * and the usual tessdata install locations are used.
     */
    public record Engine(
            String libraryPath,
            String tessdataPath) {
    }

    public record Defaults(
            @DefaultValue("eng") String language,
            @DefaultValue("3") int pageSegmentationMode,
            @DefaultValue("3") int engineMode,
            @DefaultValue("GAUSSIAN") BlurType blurType,
            @DefaultValue("true") boolean applyDeskew,
            @DefaultValue("true") boolean applyClahe,
            @DefaultValue("true") boolean applySpellcheck) {

        public RecognitionOptions toOptions() {
            return RecognitionOptions.builder()
                    .language(language)
                    .pageSegmentationMode(pageSegmentationMode)
                    .engineMode(engineMode)
                    .blurType(blurType)
                    .applyDeskew(applyDeskew)
                    .applyClahe(applyClahe)
                    .applySpellcheck(applySpellcheck)
                    .build();
        }
    }

    public record Conditioning(
            @DefaultValue("2.0") double claheClipLimit,
            @DefaultValue("8") int claheTileGridSize,
            @DefaultValue("5") int blurKernelSize,
            @DefaultValue("11") int thresholdBlockSize,
            @DefaultValue("4") double thresholdBias,
            @DefaultValue("0.5") double deskewMinAngle) {
    }

    public record Aggregation(
            @DefaultValue("35") double minConfidence) {
    }

    public record Spelling(
            @DefaultValue("eng") String englishLanguageCode,
            @DefaultValue("en-US") String dictionaryLanguage) {
    }
}
