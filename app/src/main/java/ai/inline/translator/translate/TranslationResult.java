package ai.inline.translator.translate;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Structured outcome of a successful translation call.
 */
public record TranslationResult(String primaryText,
                                List<String> alternateTexts,
                                Optional<String> romanizedText,
                                long providerLatencyMs) {

    public TranslationResult {
        Objects.requireNonNull(primaryText, "primaryText");
        alternateTexts = List.copyOf(alternateTexts == null ? List.of() : alternateTexts);
        romanizedText = romanizedText == null ? Optional.empty() : romanizedText.filter(value -> !value.isBlank());
        if (providerLatencyMs < 0) {
            throw new IllegalArgumentException("providerLatencyMs must be zero or greater");
        }
    }
}
