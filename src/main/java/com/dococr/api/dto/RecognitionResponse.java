package com.dococr.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

public record RecognitionResponse(
        @Schema(description = "Recognised text after confidence filtering and optional spelling correction")
        String text,
        @Schema(description = "Width in pixels of the image submitted to the OCR engine")
        int processedWidth,
        @Schema(description = "Height in pixels of the image submitted to the OCR engine")
        int processedHeight,
        @Schema(description = "Base64 encoded PNG of the conditioned image, present when requested")
        String previewPng) {
}
