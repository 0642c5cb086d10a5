package com.dococr.config;

import com.dococr.service.ocr.TesseractFactory;
import com.dococr.service.spelling.LanguageToolDictionary;
import com.dococr.service.spelling.SpellingDictionary;
import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;
import net.sourceforge.tess4j.Tesseract;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OcrConfiguration {

    private static final Logger log = LoggerFactory.getLogger(OcrConfiguration.class);

    static final String JNA_LIBRARY_PATH = "jna.library.path";

    @Bean
    public TesseractFactory tesseractFactory(OcrProperties properties) {
        configureLibraryPath(properties.engine().libraryPath());
        return Tesseract::new;
    }

    @Bean
    public SpellingDictionary spellingDictionary(OcrProperties properties) {
        return new LanguageToolDictionary(properties.spelling().dictionaryLanguage());
    }

    private static void configureLibraryPath(String configuredPath) {
        String libraryPath = Optional.ofNullable(configuredPath)
                .map(String::trim)
                .filter(path -> !path.isEmpty())
                .orElse(null);
        if (libraryPath == null) {
            log.info("No Tesseract library path configured; relying on the system library search path");
            return;
        }
        try {
            Path candidate = Path.of(libraryPath);
            if (!Files.isDirectory(candidate)) {
                log.warn("Configured Tesseract library path {} is not a directory; ignoring it", candidate);
                return;
            }
            String existing = System.getProperty(JNA_LIBRARY_PATH);
            String resolved = candidate.toAbsolutePath().toString();
            if (existing != null && !existing.isBlank()) {
                resolved = resolved + File.pathSeparator + existing;
            }
            System.setProperty(JNA_LIBRARY_PATH, resolved);
            log.info("Configured Tesseract library path: {}", resolved);
        } catch (InvalidPathException ex) {
            log.warn("Configured Tesseract library path {} is invalid: {}", libraryPath, ex.getMessage());
        }
    }
}
