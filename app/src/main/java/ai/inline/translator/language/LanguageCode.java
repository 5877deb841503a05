package ai.inline.translator.language;

import java.util.Locale;
import java.util.Optional;

/**
 * The two languages the relay translates between.
 */
public enum LanguageCode {
    EN,
    ZH;

    /**
     * Parses a two-letter code case-insensitively.
     */
    public static Optional<LanguageCode> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "en" -> Optional.of(EN);
            case "zh" -> Optional.of(ZH);
            default -> Optional.empty();
        };
    }

    public static LanguageCode from(String raw) {
        return parse(raw).orElseThrow(() -> new IllegalArgumentException("Unsupported language code: " + raw));
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return code();
    }
}
