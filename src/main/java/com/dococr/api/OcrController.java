package com.dococr.api;

import com.dococr.api.dto.ModeDescriptor;
import com.dococr.api.dto.ModesResponse;
import com.dococr.api.dto.RecognitionResponse;
import com.dococr.model.BlurType;
import com.dococr.model.EngineMode;
import com.dococr.model.OcrResult;
import com.dococr.model.PageSegmentationMode;
import com.dococr.model.RecognitionOptions;
import com.dococr.model.RecognitionOutcome;
import com.dococr.service.pipeline.OcrPipeline;
import com.dococr.util.ImageUtils;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping(path = "/api/v1/ocr", produces = MediaType.APPLICATION_JSON_VALUE)
@Tag(name = "Document OCR")
public class OcrController {

    private static final Logger log = LoggerFactory.getLogger(OcrController.class);

    private final OcrPipeline pipeline;

    public OcrController(OcrPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @PostMapping(value = "/recognize", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Extract text from a document image",
            description = "Conditions the image, runs Tesseract and optionally corrects English spelling",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Recognition result",
                            content = @Content(schema = @Schema(implementation = RecognitionResponse.class))),
                    @ApiResponse(responseCode = "400", description = "Unreadable image or invalid options"),
                    @ApiResponse(responseCode = "503", description = "Tesseract is not installed")
            })
    public ResponseEntity<RecognitionResponse> recognize(
            @RequestPart("image") MultipartFile image,
            @RequestParam(required = false) String language,
            @RequestParam(required = false) Integer psm,
            @RequestParam(required = false) Integer oem,
            @RequestParam(required = false) String tessdataDir,
            @RequestParam(required = false) Boolean deskew,
            @RequestParam(required = false) Boolean clahe,
            @RequestParam(required = false) String blur,
            @RequestParam(required = false) Boolean spellcheck,
            @RequestParam(defaultValue = "false") boolean includePreview) {
        if (image == null || image.isEmpty()) {
            throw new IllegalArgumentException("Uploaded image must not be empty");
        }
        RecognitionOptions.Builder builder = pipeline.defaultOptions().toBuilder();
        if (StringUtils.hasText(language)) {
            builder.language(language);
        }
        if (psm != null) {
            builder.pageSegmentationMode(psm);
        }
        if (oem != null) {
            builder.engineMode(oem);
        }
        if (StringUtils.hasText(tessdataDir)) {
            builder.tessdataDir(tessdataDir);
        }
        if (deskew != null) {
            builder.applyDeskew(deskew);
        }
        if (clahe != null) {
            builder.applyClahe(clahe);
        }
        if (blur != null) {
            builder.blurType(BlurType.fromLabel(blur));
        }
        if (spellcheck != null) {
            builder.applySpellcheck(spellcheck);
        }
        RecognitionOptions options = builder.build();

        Path temp = null;
        try {
            temp = Files.createTempFile("ocr-upload-", suffixOf(image.getOriginalFilename()));
            image.transferTo(temp);
            RecognitionOutcome outcome = pipeline.recognize(temp, options);
            return ResponseEntity.ok(toResponse(outcome, includePreview));
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to read uploaded image", ex);
        } finally {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException ignore) {
                    log.debug("Unable to delete temporary upload {}", temp);
                }
            }
        }
    }

    @GetMapping("/modes")
    @Operation(summary = "List Tesseract page segmentation and engine modes")
    public ModesResponse modes() {
        List<ModeDescriptor> segmentation = Arrays.stream(PageSegmentationMode.values())
                .map(mode -> new ModeDescriptor(mode.code(), mode.name(), mode.description()))
                .toList();
        List<ModeDescriptor> engines = Arrays.stream(EngineMode.values())
                .map(mode -> new ModeDescriptor(mode.code(), mode.name(), mode.description()))
                .toList();
        return new ModesResponse(segmentation, engines);
    }

    RecognitionResponse toResponse(RecognitionOutcome outcome, boolean includePreview) {
        OcrResult result = outcome.result();
        Mat conditioned = outcome.conditionedImage();
        String preview = null;
        if (includePreview && conditioned != null && !conditioned.empty()) {
            preview = Base64.getEncoder().encodeToString(ImageUtils.encodePng(conditioned));
        }
        if (conditioned != null) {
            conditioned.close();
        }
        return new RecognitionResponse(result.text(), result.processedWidth(), result.processedHeight(), preview);
    }

    private static String suffixOf(String filename) {
        String extension = StringUtils.getFilenameExtension(filename);
        return extension == null ? ".img" : "." + extension;
    }
}
