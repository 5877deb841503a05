package ai.inline.translator.config;

import java.util.Optional;

/**
 * Source of startup settings keyed by environment variable name.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    /**
     * Returns the stripped value, treating blank values as absent.
     */
    default Optional<String> getNonBlank(String key) {
        return get(key)
                .map(String::strip)
                .filter(value -> !value.isEmpty());
    }
}
