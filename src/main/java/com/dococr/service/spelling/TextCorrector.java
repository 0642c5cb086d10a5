package com.dococr.service.spelling;

import com.dococr.config.OcrProperties;
import com.dococr.model.RecognitionOptions;
import com.dococr.model.StageOutcome;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Dictionary based spelling pass over aggregated OCR text. Runs for English only. Each unknown
 * word is corrected once and the correction is applied to every whole-word occurrence,
 * regardless of case, across the whole text.
 */
@Component
public class TextCorrector {

    private static final Logger log = LoggerFactory.getLogger(TextCorrector.class);

    private static final Pattern WORD = Pattern.compile("\\b\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);

    private final SpellingDictionary dictionary;
    private final String englishLanguageCode;

    @Autowired
    public TextCorrector(SpellingDictionary dictionary, OcrProperties properties) {
        this(dictionary, properties.spelling().englishLanguageCode());
    }

    TextCorrector(SpellingDictionary dictionary, String englishLanguageCode) {
        this.dictionary = dictionary;
        this.englishLanguageCode = englishLanguageCode;
    }

    public StageOutcome<String> correct(String text, RecognitionOptions options) {
        if (!options.applySpellcheck()) {
            return StageOutcome.unchanged(text, "spell check disabled");
        }
        if (!englishLanguageCode.equals(options.language())) {
            log.debug("Skipping spell check: not supported for language '{}'", options.language());
            return StageOutcome.unchanged(text, "language " + options.language() + " not supported");
        }
        try {
            return correctEnglish(text);
        } catch (RuntimeException ex) {
            log.warn("Spell check failed, keeping raw text: {}", ex.getMessage());
            return StageOutcome.unchanged(text, "spell check failed: " + ex.getMessage());
        }
    }

    private StageOutcome<String> correctEnglish(String text) {
        List<String> tokens = tokenize(text);
        if (tokens.isEmpty()) {
            return StageOutcome.unchanged(text, "no words");
        }
        Set<String> misspelled = dictionary.unknown(new LinkedHashSet<>(tokens));
        log.debug("Found {} potentially unknown words", misspelled.size());

        String corrected = text;
        int replaced = 0;
        for (String word : misspelled) {
            Optional<String> correction = dictionary.correction(word);
            if (correction.isPresent() && !correction.get().equals(word)) {
                log.debug("Correcting '{}' -> '{}'", word, correction.get());
                corrected = replaceWholeWord(corrected, word, correction.get());
                replaced++;
            }
        }
        if (replaced == 0) {
            return StageOutcome.unchanged(text, "no corrections");
        }
        return StageOutcome.corrected(corrected, replaced + " words corrected");
    }

    static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null) {
            return tokens;
        }
        Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }

    private static String replaceWholeWord(String text, String word, String correction) {
        Pattern pattern = Pattern.compile("\\b" + Pattern.quote(word) + "\\b",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS);
        return pattern.matcher(text)
                .replaceAll(match -> Matcher.quoteReplacement(matchCase(match.group(), correction)));
    }

    /**
     * Applies the case shape of {@code original} to {@code correction}: all caps stays all caps,
     * a leading capital stays a leading capital, anything else takes the dictionary form.
     */
    static String matchCase(String original, String correction) {
        if (correction.isEmpty()) {
            return correction;
        }
        boolean hasLetters = original.chars().anyMatch(Character::isLetter);
        if (hasLetters && original.length() > 1 && original.equals(original.toUpperCase(Locale.ROOT))) {
            return correction.toUpperCase(Locale.ROOT);
        }
        if (Character.isUpperCase(original.charAt(0))) {
            return Character.toUpperCase(correction.charAt(0)) + correction.substring(1);
        }
        return correction;
    }
}
