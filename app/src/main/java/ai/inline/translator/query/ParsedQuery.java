package ai.inline.translator.query;

import ai.inline.translator.language.LanguageCode;
import ai.inline.translator.translate.TranslationRequest;
import java.util.Objects;

/**
 * Normalized query produced by {@link QueryInterpreter}.
 */
public record ParsedQuery(String text, LanguageCode sourceLang, LanguageCode targetLang) {

    public ParsedQuery {
        Objects.requireNonNull(text, "text");
        if (text.isEmpty()) {
            throw new IllegalArgumentException("text must not be empty");
        }
        Objects.requireNonNull(sourceLang, "sourceLang");
        Objects.requireNonNull(targetLang, "targetLang");
    }

    public TranslationRequest toRequest() {
        return new TranslationRequest(text, sourceLang, targetLang);
    }
}
