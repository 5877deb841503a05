package ai.inline.translator.language;

import com.github.pemistahl.lingua.api.Language;
import com.github.pemistahl.lingua.api.LanguageDetector;
import com.github.pemistahl.lingua.api.LanguageDetectorBuilder;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link LanguageGuesser} backed by the Lingua detector.
 *
 * <p>Each candidate is the only one for its script, so Lingua settles on a language by alphabet and short inputs
 * such as {@code "hello world"} are not lost to n-gram noise. Latin text is therefore English. Cyrillic, Hangul and
 * the other non-Latin scripts are reported as unknown so the caller falls through to its defaults.</p>
 */
public class LinguaLanguageGuesser implements LanguageGuesser {

    private static final Language[] CANDIDATES = {
            Language.ENGLISH,
            Language.CHINESE,
            Language.RUSSIAN,
            Language.KOREAN,
            Language.GREEK,
            Language.HEBREW,
            Language.ARABIC,
            Language.THAI
    };

    private final LanguageDetector detector;

    public LinguaLanguageGuesser() {
        this(LanguageDetectorBuilder.fromLanguages(CANDIDATES)
                .withLowAccuracyMode()
                .build());
    }

    LinguaLanguageGuesser(LanguageDetector detector) {
        this.detector = Objects.requireNonNull(detector, "detector");
    }

    @Override
    public Optional<LanguageCode> guess(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Language detected = detector.detectLanguageOf(text);
        if (detected == Language.ENGLISH) {
            return Optional.of(LanguageCode.EN);
        }
        if (detected == Language.CHINESE) {
            return Optional.of(LanguageCode.ZH);
        }
        return Optional.empty();
    }
}
