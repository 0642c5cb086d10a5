package com.dococr.service.ocr;

import com.dococr.config.OcrProperties;
import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import net.sourceforge.tess4j.util.LoadLibs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Locates a tessdata directory holding every language a request asks for. Used when the request
 * carries no explicit override. Configured locations come first, then the usual install
 * directories, then the language data bundled with Tess4J.
 */
@Component
public class TessdataResolver {

    private static final Logger log = LoggerFactory.getLogger(TessdataResolver.class);

    private static final List<String> WELL_KNOWN_LOCATIONS = List.of(
            "/usr/share/tesseract-ocr/5/tessdata",
            "/usr/share/tesseract-ocr/4.00/tessdata",
            "/usr/local/share/tessdata",
            "/opt/homebrew/share/tessdata",
            "C:/Program Files/Tesseract-OCR/tessdata");

    private final List<String> configuredCandidates;
    private final Supplier<Path> bundledTessdata;
    private Path bundledPath;

    @Autowired
    public TessdataResolver(OcrProperties properties) {
        this(candidatesFrom(properties.engine().tessdataPath()), TessdataResolver::extractBundledTessdata);
    }

    TessdataResolver(List<String> configuredCandidates) {
        this(configuredCandidates, () -> null);
    }

    TessdataResolver(List<String> configuredCandidates, Supplier<Path> bundledTessdata) {
        this.configuredCandidates = List.copyOf(configuredCandidates);
        this.bundledTessdata = bundledTessdata;
    }

    public Optional<Path> resolve(String language) {
        List<String> candidates = new ArrayList<>(configuredCandidates);
        candidates.addAll(WELL_KNOWN_LOCATIONS);
        for (String candidate : candidates) {
            Optional<Path> valid = validateCandidate(candidate, language);
            if (valid.isPresent()) {
                return valid;
            }
        }
        Path bundled = bundledTessdata();
        if (bundled != null && containsLanguages(bundled, language)) {
            log.debug("Using bundled tessdata {} for language {}", bundled, language);
            return Optional.of(bundled);
        }
        log.debug("No tessdata directory found for language {}", language);
        return Optional.empty();
    }

    private synchronized Path bundledTessdata() {
        if (bundledPath == null) {
            bundledPath = bundledTessdata.get();
        }
        return bundledPath;
    }

    private static Path extractBundledTessdata() {
        try {
            File extracted = LoadLibs.extractTessResources("tessdata");
            return extracted == null ? null : extracted.toPath();
        } catch (RuntimeException ex) {
            log.warn("Unable to extract bundled tessdata: {}", ex.getMessage());
            return null;
        }
    }

    private Optional<Path> validateCandidate(String candidate, String language) {
        Path basePath;
        try {
            basePath = Paths.get(candidate).normalize();
        } catch (InvalidPathException ex) {
            log.debug("Tessdata candidate '{}' is not a valid path", candidate);
            return Optional.empty();
        }
        if (!Files.isDirectory(basePath)) {
            return Optional.empty();
        }
        if (containsLanguages(basePath, language)) {
            return Optional.of(basePath);
        }
        Path nested = basePath.resolve("tessdata");
        if (Files.isDirectory(nested) && containsLanguages(nested, language)) {
            return Optional.of(nested);
        }
        log.debug("Tessdata candidate '{}' does not contain traineddata for {}", candidate, language);
        return Optional.empty();
    }

    private static boolean containsLanguages(Path directory, String language) {
        for (String code : language.split("\\+")) {
            if (!code.isBlank() && !Files.isRegularFile(directory.resolve(code.trim() + ".traineddata"))) {
                return false;
            }
        }
        return true;
    }

    private static List<String> candidatesFrom(String configuredPath) {
        List<String> candidates = new ArrayList<>();
        if (configuredPath != null && !configuredPath.isBlank()) {
            candidates.add(configuredPath);
        }
        String envCandidate = System.getenv("TESSDATA_PREFIX");
        if (envCandidate != null && !envCandidate.isBlank()) {
            candidates.add(envCandidate);
        }
        String systemPropertyCandidate = System.getProperty("TESSDATA_PREFIX");
        if (systemPropertyCandidate != null && !systemPropertyCandidate.isBlank()) {
            candidates.add(systemPropertyCandidate);
        }
        return candidates;
    }
}
