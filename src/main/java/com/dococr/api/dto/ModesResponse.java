package com.dococr.api.dto;

import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;

@Schema(description = "Tesseract modes accepted by the recognition endpoint")
public record ModesResponse(
        @ArraySchema(arraySchema = @Schema(description = "Page segmentation modes"))
        List<ModeDescriptor> pageSegmentationModes,
        @ArraySchema(arraySchema = @Schema(description = "OCR engine modes"))
        List<ModeDescriptor> engineModes) {
}
