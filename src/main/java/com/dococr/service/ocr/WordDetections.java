package com.dococr.service.ocr;

import java.awt.Rectangle;
import java.util.List;

/**
 * Raw per-word engine output as parallel columns, the way Tesseract reports it. Entries may be
 * missing or null for malformed records, so readers must expect per-index failures.
 */
public record WordDetections(List<String> texts, List<Float> confidences, List<Rectangle> boxes) {

    public WordDetections {
        texts = texts == null ? List.of() : texts;
        confidences = confidences == null ? List.of() : confidences;
        boxes = boxes == null ? List.of() : boxes;
    }

    public static WordDetections empty() {
        return new WordDetections(List.of(), List.of(), List.of());
    }

    public int size() {
        return texts.size();
    }

    public String text(int index) {
        return texts.get(index);
    }

    /**
     * @throws NullPointerException if the engine reported no confidence for this word
     */
    public double confidence(int index) {
        Float value = confidences.get(index);
        if (value == null) {
            throw new NullPointerException("no confidence for word " + index);
        }
        return value;
    }
}
