package com.dococr.service.spelling;

import java.io.IOException;
import java.net.URL;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import morfologik.speller.Speller;
import morfologik.stemming.Dictionary;
import org.languagetool.JLanguageTool;
import org.languagetool.Language;
import org.languagetool.Languages;
import org.languagetool.rules.Rule;
import org.languagetool.rules.RuleMatch;
import org.languagetool.rules.spelling.SpellingCheckRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SpellingDictionary} backed by LanguageTool's dictionary spelling rules. Grammar and
 * style rules are disabled. LanguageTool is loaded on first use and is not thread-safe, hence
 * the synchronised access.
 *
 * <p>LanguageTool's suggestions are candidates only. The correction is the candidate with the
 * smallest edit distance (a transposition counts as one edit), then the highest word frequency
 * in the Morfologik spelling dictionary, then the one keeping every letter of the token in order.
 */
public class LanguageToolDictionary implements SpellingDictionary {

    private static final Logger log = LoggerFactory.getLogger(LanguageToolDictionary.class);

    private final String languageCode;
    private JLanguageTool languageTool;
    private Speller frequencies;

    public LanguageToolDictionary(String languageCode) {
        this.languageCode = languageCode;
    }

    @Override
    public synchronized Set<String> unknown(Collection<String> tokens) {
        Set<String> unknown = new LinkedHashSet<>();
        for (String token : tokens) {
            if (!spellingMatches(token).isEmpty()) {
                unknown.add(token);
            }
        }
        return unknown;
    }

    @Override
    public synchronized Optional<String> correction(String token) {
        List<String> candidates = spellingMatches(token).stream()
                .flatMap(match -> match.getSuggestedReplacements().stream())
                .filter(suggestion -> suggestion != null && !suggestion.isBlank())
                .map(suggestion -> suggestion.toLowerCase(Locale.ROOT))
                .distinct()
                .toList();
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        String word = token.toLowerCase(Locale.ROOT);
        Speller speller = frequencies();
        Comparator<String> ranking = Comparator
                .comparingInt((String candidate) -> editDistance(word, candidate))
                .thenComparing(Comparator.comparingInt((String candidate) -> speller.getFrequency(candidate))
                        .reversed())
                .thenComparingInt(candidate -> isSubsequence(word, candidate) ? 0 : 1);
        // min() keeps the first of equally ranked candidates, i.e. LanguageTool's order
        Optional<String> best = candidates.stream().min(ranking);
        best.ifPresent(choice -> log.debug("Ranked {} candidates for '{}', picked '{}'",
                candidates.size(), token, choice));
        return best;
    }

    /**
     * Optimal string alignment distance: insertions, deletions, substitutions and adjacent
     * transpositions each cost one.
     */
    static int editDistance(String source, String target) {
        int[][] d = new int[source.length() + 1][target.length() + 1];
        for (int i = 0; i <= source.length(); i++) {
            d[i][0] = i;
        }
        for (int j = 0; j <= target.length(); j++) {
            d[0][j] = j;
        }
        for (int i = 1; i <= source.length(); i++) {
            for (int j = 1; j <= target.length(); j++) {
                int cost = source.charAt(i - 1) == target.charAt(j - 1) ? 0 : 1;
                d[i][j] = Math.min(Math.min(d[i - 1][j] + 1, d[i][j - 1] + 1), d[i - 1][j - 1] + cost);
                if (i > 1 && j > 1
                        && source.charAt(i - 1) == target.charAt(j - 2)
                        && source.charAt(i - 2) == target.charAt(j - 1)) {
                    d[i][j] = Math.min(d[i][j], d[i - 2][j - 2] + 1);
                }
            }
        }
        return d[source.length()][target.length()];
    }

    static boolean isSubsequence(String token, String candidate) {
        int next = 0;
        for (int i = 0; i < candidate.length() && next < token.length(); i++) {
            if (candidate.charAt(i) == token.charAt(next)) {
                next++;
            }
        }
        return next == token.length();
    }

    private List<RuleMatch> spellingMatches(String token) {
        try {
            return tool().check(token).stream()
                    .filter(match -> match.getRule() instanceof SpellingCheckRule)
                    .toList();
        } catch (IOException ex) {
            throw new IllegalStateException("Spell check failed for '" + token + "'", ex);
        }
    }

    private JLanguageTool tool() {
        if (languageTool == null) {
            Language language = Languages.getLanguageForShortCode(languageCode);
            JLanguageTool instance = new JLanguageTool(language);
            for (Rule rule : instance.getAllActiveRules()) {
                if (!(rule instanceof SpellingCheckRule)) {
                    instance.disableRule(rule.getId());
                }
            }
            log.info("Loaded {} spelling dictionary", language.getName());
            languageTool = instance;
        }
        return languageTool;
    }

    private Speller frequencies() {
        if (frequencies == null) {
            String resource = "/" + languageCode.replace('-', '_').substring(0, 2) + "/hunspell/"
                    + languageCode.replace('-', '_') + ".dict";
            URL url = JLanguageTool.getDataBroker().getFromResourceDirAsUrl(resource);
            if (url == null) {
                throw new IllegalStateException("No spelling dictionary found at " + resource);
            }
            try {
                frequencies = new Speller(Dictionary.read(url));
            } catch (IOException ex) {
                throw new IllegalStateException("Unable to load spelling dictionary " + resource, ex);
            }
            log.info("Loaded word frequencies from {}", resource);
        }
        return frequencies;
    }
}
