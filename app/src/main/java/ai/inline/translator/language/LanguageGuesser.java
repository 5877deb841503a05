package ai.inline.translator.language;

import java.util.Optional;

/**
 * Statistical guess of the language a text is written in.
 * Implementations must be deterministic and safe to share between threads.
 */
@FunctionalInterface
public interface LanguageGuesser {

    /**
     * Returns the detected language when it is one the relay supports, or empty for anything else.
     */
    Optional<LanguageCode> guess(String text);
}
