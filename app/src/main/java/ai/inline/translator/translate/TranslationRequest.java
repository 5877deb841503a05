package ai.inline.translator.translate;

import ai.inline.translator.language.LanguageCode;
import java.util.Objects;

/**
 * Input to a {@link Translator}.
 */
public record TranslationRequest(String text, LanguageCode sourceLang, LanguageCode targetLang) {

    public TranslationRequest {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(sourceLang, "sourceLang");
        Objects.requireNonNull(targetLang, "targetLang");
    }
}
