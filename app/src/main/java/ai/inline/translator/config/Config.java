package ai.inline.translator.config;

import ai.inline.translator.language.LanguageCode;
import java.util.Objects;

/**
 * Immutable runtime configuration assembled once at startup.
 */
public record Config(
        TranslatorConfig translatorConfig,
        Secrets secrets,
        LanguageCode defaultSourceLang,
        LanguageCode defaultTargetLang,
        LogFormat logFormat
) {

    public Config {
        Objects.requireNonNull(translatorConfig, "translatorConfig");
        Objects.requireNonNull(secrets, "secrets");
        Objects.requireNonNull(defaultSourceLang, "defaultSourceLang");
        Objects.requireNonNull(defaultTargetLang, "defaultTargetLang");
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
    }
}
