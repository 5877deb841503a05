package ai.inline.translator.translate;

/**
 * Raised when the provider answers with a non-success HTTP status.
 */
public class ProviderStatusException extends TranslationException {

    private final int statusCode;
    private final String responseBody;

    public ProviderStatusException(int statusCode, String responseBody) {
        super(Failure.PROVIDER_STATUS,
                "Translation provider failed (" + statusCode + "): " + (responseBody == null ? "" : responseBody));
        this.statusCode = statusCode;
        this.responseBody = responseBody == null ? "" : responseBody;
    }

    public int statusCode() {
        return statusCode;
    }

    public String responseBody() {
        return responseBody;
    }
}
