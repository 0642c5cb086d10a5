package com.dococr.model;

import java.util.Objects;

/**
 * Immutable option set consumed by every stage of a recognition request. Construction fails
 * fast on values Tesseract would reject, so downstream stages never re-validate.
 *
 * @param language Tesseract language code, composite codes such as {@code ind+eng} allowed
 * @param pageSegmentationMode Tesseract page segmentation mode, 0 to 13
 * @param engineMode Tesseract OCR engine mode, 0 to 3
 * @param tessdataDir optional language data override, ignored unless it is a directory
 */
public record RecognitionOptions(
        String language,
        int pageSegmentationMode,
        int engineMode,
        String tessdataDir,
        boolean applyDeskew,
        boolean applyClahe,
        boolean applySpellcheck,
        BlurType blurType) {

    public static final String DEFAULT_LANGUAGE = "eng";

    public RecognitionOptions {
        if (language == null || language.isBlank()) {
            throw new IllegalArgumentException("language must not be blank");
        }
        language = language.trim();
        if (PageSegmentationMode.fromCode(pageSegmentationMode).isEmpty()) {
            throw new IllegalArgumentException(
                    "page segmentation mode must be between 0 and 13 but was " + pageSegmentationMode);
        }
        if (EngineMode.fromCode(engineMode).isEmpty()) {
            throw new IllegalArgumentException("engine mode must be between 0 and 3 but was " + engineMode);
        }
        if (tessdataDir != null && tessdataDir.isBlank()) {
            tessdataDir = null;
        }
        Objects.requireNonNull(blurType, "blurType");
    }

    public static RecognitionOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .language(language)
                .pageSegmentationMode(pageSegmentationMode)
                .engineMode(engineMode)
                .tessdataDir(tessdataDir)
                .applyDeskew(applyDeskew)
                .applyClahe(applyClahe)
                .applySpellcheck(applySpellcheck)
                .blurType(blurType);
    }

    public static final class Builder {

        private String language = DEFAULT_LANGUAGE;
        private int pageSegmentationMode = PageSegmentationMode.AUTO.code();
        private int engineMode = EngineMode.DEFAULT.code();
        private String tessdataDir;
        private boolean applyDeskew = true;
        private boolean applyClahe = true;
        private boolean applySpellcheck = true;
        private BlurType blurType = BlurType.GAUSSIAN;

        private Builder() {
        }

        public Builder language(String language) {
            this.language = language;
            return this;
        }

        public Builder pageSegmentationMode(int pageSegmentationMode) {
            this.pageSegmentationMode = pageSegmentationMode;
            return this;
        }

        public Builder engineMode(int engineMode) {
            this.engineMode = engineMode;
            return this;
        }

        public Builder tessdataDir(String tessdataDir) {
            this.tessdataDir = tessdataDir;
            return this;
        }

        public Builder applyDeskew(boolean applyDeskew) {
            this.applyDeskew = applyDeskew;
            return this;
        }

        public Builder applyClahe(boolean applyClahe) {
            this.applyClahe = applyClahe;
            return this;
        }

        public Builder applySpellcheck(boolean applySpellcheck) {
            this.applySpellcheck = applySpellcheck;
            return this;
        }

        public Builder blurType(BlurType blurType) {
            this.blurType = blurType;
            return this;
        }

        public RecognitionOptions build() {
            return new RecognitionOptions(language, pageSegmentationMode, engineMode, tessdataDir,
                    applyDeskew, applyClahe, applySpellcheck, blurType);
        }
    }
}
