package ai.inline.translator.translate;

import java.util.concurrent.CompletableFuture;

/**
 * Translates a single request without blocking the caller.
 *
 * <p>Failures complete the returned future exceptionally with a {@link TranslationException}.</p>
 */
@FunctionalInterface
public interface Translator {

    CompletableFuture<TranslationResult> translate(TranslationRequest request);
}
