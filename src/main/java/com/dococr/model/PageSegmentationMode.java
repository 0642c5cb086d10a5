package com.dococr.model;

import java.util.Arrays;
import java.util.Optional;

public enum PageSegmentationMode {
    OSD_ONLY(0, "Orientation and script detection only"),
    AUTO_OSD(1, "Automatic page segmentation with orientation and script detection"),
    AUTO_ONLY(2, "Automatic page segmentation, no OSD or OCR"),
    AUTO(3, "Fully automatic page segmentation, no OSD"),
    SINGLE_COLUMN(4, "Single column of text of variable sizes"),
    SINGLE_BLOCK_VERT_TEXT(5, "Single uniform block of vertically aligned text"),
    SINGLE_BLOCK(6, "Single uniform block of text"),
    SINGLE_LINE(7, "Single text line"),
    SINGLE_WORD(8, "Single word"),
    CIRCLE_WORD(9, "Single word in a circle"),
    SINGLE_CHAR(10, "Single character"),
    SPARSE_TEXT(11, "Sparse text in no particular order"),
    SPARSE_TEXT_OSD(12, "Sparse text with orientation and script detection"),
    RAW_LINE(13, "Raw line, bypassing Tesseract specific hacks");

    private final int code;
    private final String description;

    PageSegmentationMode(int code, String description) {
        this.code = code;
        this.description = description;
    }

    public int code() {
        return code;
    }

    public String description() {
        return description;
    }

    public static Optional<PageSegmentationMode> fromCode(int code) {
        return Arrays.stream(values()).filter(mode -> mode.code == code).findFirst();
    }
}
