package ai.inline.translator.config;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Holds runtime settings for the translation provider.
 */
public record TranslatorConfig(URI baseUrl, String modelName, Duration timeout) {

    public TranslatorConfig {
        baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        if (baseUrl.getScheme() == null || baseUrl.getHost() == null) {
            throw new IllegalArgumentException("baseUrl must be an absolute http(s) URL: " + baseUrl);
        }
        if (modelName == null || modelName.isBlank()) {
            throw new IllegalArgumentException("modelName must not be blank");
        }
        timeout = Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }
}
