package ai.inline.translator.config;

import ai.inline.translator.cli.CliArguments;
import ai.inline.translator.language.LanguageCode;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Builds a {@link Config} from environment variables, letting CLI options override where both exist.
 */
public class ConfigLoader {

    static final String ENV_BOT_TOKEN = "BOT_TOKEN";
    static final String ENV_TRANSLATION_API_URL = "TRANSLATION_API_URL";
    static final String ENV_TRANSLATION_API_KEY = "TRANSLATION_API_KEY";
    static final String ENV_TRANSLATION_MODEL = "TRANSLATION_MODEL";
    static final String ENV_DEFAULT_SOURCE_LANG = "DEFAULT_SOURCE_LANG";
    static final String ENV_DEFAULT_TARGET_LANG = "DEFAULT_TARGET_LANG";
    static final String ENV_HTTP_TIMEOUT_MS = "HTTP_TIMEOUT_MS";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private static final String DEFAULT_SOURCE_LANG = "en";
    private static final String DEFAULT_TARGET_LANG = "zh";
    private static final long DEFAULT_HTTP_TIMEOUT_MS = 15_000L;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");

        String botToken = require(ENV_BOT_TOKEN);
        URI apiUrl = parseUri(require(ENV_TRANSLATION_API_URL));
        String apiKey = require(ENV_TRANSLATION_API_KEY);
        String model = require(ENV_TRANSLATION_MODEL);

        LanguageCode defaultSource = parseLanguage(ENV_DEFAULT_SOURCE_LANG, DEFAULT_SOURCE_LANG);
        LanguageCode defaultTarget = parseLanguage(ENV_DEFAULT_TARGET_LANG, DEFAULT_TARGET_LANG);

        Duration timeout = Duration.ofMillis(environmentReader.getNonBlank(ENV_HTTP_TIMEOUT_MS)
                .map(ConfigLoader::parseTimeoutMillis)
                .orElse(DEFAULT_HTTP_TIMEOUT_MS));

        LogFormat logFormat = resolveLogFormat(arguments);

        return new Config(new TranslatorConfig(apiUrl, model, timeout),
                new Secrets(botToken, apiKey),
                defaultSource,
                defaultTarget,
                logFormat);
    }

    private String require(String key) {
        return environmentReader.getNonBlank(key)
                .orElseThrow(() -> new IllegalStateException(key + " must be set"));
    }

    private LanguageCode parseLanguage(String key, String defaultValue) {
        String raw = environmentReader.getNonBlank(key).orElse(defaultValue);
        return LanguageCode.parse(raw)
                .orElseThrow(() -> new IllegalArgumentException("Invalid " + key + ": " + raw));
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.getNonBlank(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private static URI parseUri(String raw) {
        try {
            return URI.create(raw);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException(ENV_TRANSLATION_API_URL + " is not a valid URL: " + raw, ex);
        }
    }

    private static long parseTimeoutMillis(String raw) {
        try {
            long value = Long.parseLong(raw);
            if (value <= 0) {
                throw new IllegalArgumentException(ENV_HTTP_TIMEOUT_MS + " must be greater than zero");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(ENV_HTTP_TIMEOUT_MS + " must be a number", ex);
        }
    }
}
