package com.dococr.model;

import java.util.Arrays;
import java.util.Optional;

public enum EngineMode {
    LEGACY(0, "Legacy engine only"),
    LSTM(1, "Neural nets LSTM engine only"),
    LEGACY_LSTM(2, "Legacy and LSTM engines combined"),
    DEFAULT(3, "Default, based on what is available");

    private final int code;
    private final String description;

    EngineMode(int code, String description) {
        this.code = code;
        this.description = description;
    }

    public int code() {
        return code;
    }

    public String description() {
        return description;
    }

    public static Optional<EngineMode> fromCode(int code) {
        return Arrays.stream(values()).filter(mode -> mode.code == code).findFirst();
    }
}
