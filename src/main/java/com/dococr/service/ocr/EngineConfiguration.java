package com.dococr.service.ocr;

import com.dococr.model.RecognitionOptions;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Engine settings derived from a request. The language data override is only kept when it names
 * an existing directory, with separators normalised to forward slashes.
 */
public record EngineConfiguration(int engineMode, int pageSegmentationMode, String language, String tessdataDir) {

    private static final Logger log = LoggerFactory.getLogger(EngineConfiguration.class);

    public static EngineConfiguration from(RecognitionOptions options) {
        return new EngineConfiguration(
                options.engineMode(),
                options.pageSegmentationMode(),
                options.language(),
                validTessdataDir(options.tessdataDir()).orElse(null));
    }

    public Optional<String> tessdataOverride() {
        return Optional.ofNullable(tessdataDir);
    }

    /**
     * Renders the settings with Tesseract's command line flags, e.g.
     * {@code --oem 3 --psm 3 -l eng --tessdata-dir C:/tessdata}.
     */
    public String toCommandLine() {
        StringBuilder builder = new StringBuilder()
                .append("--oem ").append(engineMode)
                .append(" --psm ").append(pageSegmentationMode)
                .append(" -l ").append(language);
        tessdataOverride().ifPresent(dir -> builder.append(" --tessdata-dir ").append(dir));
        return builder.toString();
    }

    private static Optional<String> validTessdataDir(String configured) {
        if (configured == null || configured.isBlank()) {
            return Optional.empty();
        }
        try {
            if (Files.isDirectory(Path.of(configured))) {
                return Optional.of(configured.replace('\\', '/'));
            }
        } catch (InvalidPathException ex) {
            log.debug("Tessdata directory {} is not a valid path: {}", configured, ex.getMessage());
            return Optional.empty();
        }
        log.debug("Ignoring tessdata directory {}: not a directory", configured);
        return Optional.empty();
    }
}
