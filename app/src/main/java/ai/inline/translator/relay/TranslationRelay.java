package ai.inline.translator.relay;

import ai.inline.translator.language.LanguageCode;
import ai.inline.translator.query.ParsedQuery;
import ai.inline.translator.query.QueryInterpreter;
import ai.inline.translator.render.CandidateRenderer;
import ai.inline.translator.render.ChatReplyFormatter;
import ai.inline.translator.render.DisplayCandidate;
import ai.inline.translator.translate.TranslationResult;
import ai.inline.translator.translate.Translator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles inbound chat events: interprets the text, translates it and renders the answer.
 *
 * <p>Every event is independent. The relay keeps no per-event state, so concurrent events need no coordination
 * and may complete in any order.</p>
 */
public class TranslationRelay {

    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationRelay.class);

    private final QueryInterpreter interpreter;
    private final Translator translator;
    private final CandidateRenderer renderer;
    private final LanguageCode defaultSource;
    private final LanguageCode defaultTarget;

    public TranslationRelay(QueryInterpreter interpreter,
                            Translator translator,
                            CandidateRenderer renderer,
                            LanguageCode defaultSource,
                            LanguageCode defaultTarget) {
        this.interpreter = Objects.requireNonNull(interpreter, "interpreter");
        this.translator = Objects.requireNonNull(translator, "translator");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.defaultSource = Objects.requireNonNull(defaultSource, "defaultSource");
        this.defaultTarget = Objects.requireNonNull(defaultTarget, "defaultTarget");
    }

    /**
     * Answers an inline query. Never completes exceptionally: failures become an error candidate.
     */
    public CompletableFuture<List<DisplayCandidate>> answerInlineQuery(String rawQuery) {
        Optional<ParsedQuery> parsed = interpreter.interpret(rawQuery, defaultSource, defaultTarget);
        if (parsed.isEmpty()) {
            return CompletableFuture.completedFuture(List.of(renderer.renderHelp(defaultSource, defaultTarget)));
        }
        ParsedQuery query = parsed.get();
        return startTranslation(query)
                .thenApply(result -> renderer.renderTranslation(query, result))
                .exceptionally(error -> {
                    String message = failureMessage(error);
                    LOGGER.warn("Inline translation failed: {}", message);
                    return List.of(renderer.renderError(message));
                });
    }

    /**
     * Answers a direct chat message. Commands other than {@code /start} get no reply.
     */
    public CompletableFuture<List<String>> answerMessage(String text) {
        if (text == null) {
            return CompletableFuture.completedFuture(List.of());
        }
        if (text.startsWith("/")) {
            return CompletableFuture.completedFuture(
                    text.strip().equals("/start") ? List.of(ChatReplyFormatter.greeting()) : List.of());
        }
        Optional<ParsedQuery> parsed = interpreter.interpret(text, defaultSource, defaultTarget);
        if (parsed.isEmpty()) {
            return CompletableFuture.completedFuture(List.of(ChatReplyFormatter.notUnderstood()));
        }
        ParsedQuery query = parsed.get();
        return startTranslation(query)
                .thenApply(result -> ChatReplyFormatter.translated(query, result))
                .exceptionally(error -> {
                    String message = failureMessage(error);
                    LOGGER.warn("Message translation failed: {}", message);
                    return List.of(ChatReplyFormatter.failed(message));
                });
    }

    private CompletableFuture<TranslationResult> startTranslation(ParsedQuery query) {
        try {
            return translator.translate(query.toRequest());
        } catch (RuntimeException ex) {
            return CompletableFuture.failedFuture(ex);
        }
    }

    static String failureMessage(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
