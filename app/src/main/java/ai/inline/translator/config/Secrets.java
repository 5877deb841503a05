package ai.inline.translator.config;

/**
 * Credentials for the chat platform and the translation provider.
 */
public record Secrets(String botToken, String providerApiKey) {

    public Secrets {
        botToken = requireNonBlank(botToken, "botToken");
        providerApiKey = requireNonBlank(providerApiKey, "providerApiKey");
    }

    @Override
    public String toString() {
        return "Secrets[botToken=***, providerApiKey=***]";
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
