package ai.inline.translator.translate;

import java.util.Objects;

/**
 * Runtime exception used to propagate translation failures.
 */
public class TranslationException extends RuntimeException {

    /**
     * What went wrong while talking to the provider.
     */
    public enum Failure {
        /** Connection failure, I/O error or timeout. */
        NETWORK,
        /** Provider answered with a non-2xx status. */
        PROVIDER_STATUS,
        /** Provider answered 2xx but the envelope could not be read. */
        DECODE
    }

    private final Failure failure;

    public TranslationException(Failure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = Objects.requireNonNull(failure, "failure");
    }

    public TranslationException(Failure failure, String message) {
        this(failure, message, null);
    }

    public Failure failure() {
        return failure;
    }
}
