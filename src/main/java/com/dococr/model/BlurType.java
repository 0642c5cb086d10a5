package com.dococr.model;

import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Noise suppression applied right before adaptive binarisation.
 */
public enum BlurType {
    NONE,
    GAUSSIAN,
    MEDIAN;

    private static final Logger log = LoggerFactory.getLogger(BlurType.class);

    /**
     * Lenient parser for caller supplied labels such as {@code "Gaussian"} or {@code "median"}.
     * Unknown labels disable blurring instead of failing the request.
     */
    public static BlurType fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return NONE;
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT);
        for (BlurType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        log.warn("Unknown blur type '{}'; skipping blur", label);
        return NONE;
    }
}
