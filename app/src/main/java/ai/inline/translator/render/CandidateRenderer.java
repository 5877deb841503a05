package ai.inline.translator.render;

import ai.inline.translator.language.LanguageCode;
import ai.inline.translator.query.ParsedQuery;
import ai.inline.translator.query.SegmentNormalizer;
import ai.inline.translator.translate.TranslationResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Builds inline-query answers from interpreted queries and translation results.
 */
public class CandidateRenderer {

    public static final int DESCRIPTION_LIMIT = 80;
    static final int MAX_ALTERNATES = 3;
    static final String ELLIPSIS = "…";

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final Supplier<String> idSupplier;

    public CandidateRenderer() {
        this(() -> UUID.randomUUID().toString());
    }

    CandidateRenderer(Supplier<String> idSupplier) {
        this.idSupplier = Objects.requireNonNull(idSupplier, "idSupplier");
    }

    /**
     * Returns the primary entry, then a romanized entry and an alternatives entry when the result has them.
     */
    public List<DisplayCandidate> renderTranslation(ParsedQuery query, TranslationResult result) {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(result, "result");
        String header = header(query.sourceLang(), query.targetLang());
        List<DisplayCandidate> candidates = new ArrayList<>();

        String primary = SegmentNormalizer.toLines(result.primaryText());
        candidates.add(candidate(header + " · Primary", header + "\n" + primary, primary));

        result.romanizedText().ifPresent(romanized -> {
            String display = SegmentNormalizer.toLines(romanized);
            candidates.add(candidate(header + " · Romanized", header + "\n" + display, display));
        });

        if (!result.alternateTexts().isEmpty()) {
            List<String> samples = result.alternateTexts().stream()
                    .limit(MAX_ALTERNATES)
                    .map(SegmentNormalizer::toLines)
                    .collect(Collectors.toList());
            String bullets = samples.stream()
                    .map(line -> "• " + line)
                    .collect(Collectors.joining("\n"));
            candidates.add(candidate(header + " · Alternatives", header + "\n" + bullets, samples.get(0)));
        }
        return List.copyOf(candidates);
    }

    public DisplayCandidate renderHelp(LanguageCode defaultSource, LanguageCode defaultTarget) {
        String body = """
                Type something after the bot handle. Use "%s" to separate segments when you want grouped translations (topic | detail).
                Examples:
                • @yourbot en>zh: sustainability roadmap | 2025 goals
                • @yourbot zh>en: 开会推迟到几点?
                Defaults to %s→%s when not detectable.""".formatted(SegmentNormalizer.DELIMITER, defaultSource, defaultTarget);
        return new DisplayCandidate(idSupplier.get(), "How to translate", body,
                "Prefix with en>zh or zh>en, and use | to split sentences.");
    }

    public DisplayCandidate renderError(String message) {
        String safeMessage = message == null ? "" : message;
        return new DisplayCandidate(idSupplier.get(), "Translation failed",
                "⚠️ Translation failed: " + safeMessage, describe(safeMessage));
    }

    public static String header(LanguageCode source, LanguageCode target) {
        return source.code().toUpperCase(Locale.ROOT) + " → " + target.code().toUpperCase(Locale.ROOT);
    }

    /**
     * Collapses whitespace to single spaces and shortens to {@link #DESCRIPTION_LIMIT} code points.
     */
    static String describe(String text) {
        String singleLine = WHITESPACE_RUN.matcher(text).replaceAll(" ").strip();
        if (singleLine.codePointCount(0, singleLine.length()) <= DESCRIPTION_LIMIT) {
            return singleLine;
        }
        int end = singleLine.offsetByCodePoints(0, DESCRIPTION_LIMIT - 1);
        return singleLine.substring(0, end) + ELLIPSIS;
    }

    private DisplayCandidate candidate(String title, String body, String preview) {
        return new DisplayCandidate(idSupplier.get(), title, body, describe(preview));
    }
}
