package ai.inline.translator.query;

import ai.inline.translator.language.LanguageCode;
import ai.inline.translator.language.LanguageGuesser;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns raw chat text into a {@link ParsedQuery}.
 *
 * <p>An explicit direction prefix such as {@code en>zh:} or {@code zh -> en} wins. Without one the direction is
 * guessed from the text: any CJK character means Chinese to English, then the statistical guess, then any Latin
 * letter means English to Chinese, and finally the configured defaults.</p>
 *
 * <p>Instances hold no mutable state and may be shared between threads.</p>
 */
public class QueryInterpreter {

    private static final Logger LOGGER = LoggerFactory.getLogger(QueryInterpreter.class);

    private static final Pattern DIRECTION_PREFIX = Pattern.compile(
            "^(en|zh)\\s*(?:->|>)\\s*(en|zh)\\s*:?",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern CJK = Pattern.compile(
            "[\\u3000-\\u303F\\u3040-\\u30FF\\u3400-\\u4DBF\\u4E00-\\u9FFF\\uF900-\\uFAFF]");
    private static final Pattern LATIN_LETTER = Pattern.compile("[a-zA-Z]");

    private final LanguageGuesser languageGuesser;

    public QueryInterpreter(LanguageGuesser languageGuesser) {
        this.languageGuesser = Objects.requireNonNull(languageGuesser, "languageGuesser");
    }

    public Optional<ParsedQuery> interpret(String raw, LanguageCode defaultSource, LanguageCode defaultTarget) {
        Objects.requireNonNull(defaultSource, "defaultSource");
        Objects.requireNonNull(defaultTarget, "defaultTarget");
        String trimmed = raw == null ? "" : SegmentNormalizer.trimWhitespace(raw);
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }

        Direction direction;
        String candidate;
        Matcher prefix = DIRECTION_PREFIX.matcher(trimmed);
        if (prefix.find()) {
            direction = new Direction(LanguageCode.from(prefix.group(1)), LanguageCode.from(prefix.group(2)));
            candidate = SegmentNormalizer.trimWhitespace(trimmed.substring(prefix.end()));
        } else {
            direction = detectDirection(trimmed, defaultSource, defaultTarget);
            candidate = trimmed;
        }

        String normalized = SegmentNormalizer.normalize(candidate);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        LOGGER.debug("Interpreted query as {} -> {} ({} chars)", direction.source(), direction.target(), normalized.length());
        return Optional.of(new ParsedQuery(normalized, direction.source(), direction.target()));
    }

    Direction detectDirection(String text, LanguageCode defaultSource, LanguageCode defaultTarget) {
        if (CJK.matcher(text).find()) {
            return new Direction(LanguageCode.ZH, LanguageCode.EN);
        }
        Optional<LanguageCode> guessed = languageGuesser.guess(text);
        if (guessed.isPresent()) {
            return guessed.get() == LanguageCode.EN
                    ? new Direction(LanguageCode.EN, LanguageCode.ZH)
                    : new Direction(LanguageCode.ZH, LanguageCode.EN);
        }
        if (LATIN_LETTER.matcher(text).find()) {
            return new Direction(LanguageCode.EN, LanguageCode.ZH);
        }
        return new Direction(defaultSource, defaultTarget);
    }

    record Direction(LanguageCode source, LanguageCode target) {
    }
}
