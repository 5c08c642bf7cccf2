package com.stellarcast.media.translate;

import com.stellarcast.common.result.Outcome;

/**
 * Translates the picture explanation into the configured language.
 */
public interface Translator {

    /** Back-end name for logs. */
    String name();

    Outcome<String> translate(String text);

    /**
     * Translate, falling back to the source text on failure.
     */
    default String translateOrOriginal(String text) {
        Outcome<String> outcome = translate(text);
        return outcome.isOk() ? outcome.get() : text;
    }
}
