package com.dococr.service.spelling;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/**
 * Dictionary backing the spelling correction pass. Tokens are lowercase.
 */
public interface SpellingDictionary {

    /**
     * Returns the tokens the dictionary does not recognise as valid words.
     */
    Set<String> unknown(Collection<String> tokens);

    /**
     * Returns the single most likely correction for {@code token}, if any.
     */
    Optional<String> correction(String token);
}
