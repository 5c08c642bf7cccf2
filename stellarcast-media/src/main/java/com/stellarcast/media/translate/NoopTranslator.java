package com.stellarcast.media.translate;

import com.stellarcast.common.result.Outcome;

/**
 * Identity translation, used when no back end is configured.
 */
public class NoopTranslator implements Translator {

    @Override
    public String name() {
        return "none";
    }

    @Override
    public Outcome<String> translate(String text) {
        return Outcome.ok(text);
    }
}
