package ai.inline.translator.translate;

import ai.inline.translator.config.TranslatorConfig;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translator talking to an OpenAI-compatible {@code chat/completions} endpoint.
 *
 * <p>One {@link HttpClient} is shared by every call. Each call is a single POST bounded by the configured timeout;
 * nothing is retried.</p>
 */
public class ChatCompletionTranslator implements Translator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatCompletionTranslator.class);

    static final String COMPLETIONS_PATH = "chat/completions";
    static final String SYSTEM_PROMPT = "Translate src->tgt. JSON: {\"t\":\"translation\",\"r\":\"romanized_if_zh\"}. "
            + "No alternatives. No commentary.";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ContentDecoder contentDecoder;
    private final URI endpoint;
    private final String apiKey;
    private final String modelName;
    private final Duration timeout;

    public ChatCompletionTranslator(TranslatorConfig config, String apiKey) {
        this(config, apiKey, HttpClient.newBuilder()
                .connectTimeout(config.timeout())
                .build(), new ObjectMapper());
    }

    public ChatCompletionTranslator(TranslatorConfig config, String apiKey, HttpClient httpClient, ObjectMapper objectMapper) {
        Objects.requireNonNull(config, "config");
        this.apiKey = requireNonBlank(apiKey, "apiKey");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.contentDecoder = new ContentDecoder(objectMapper);
        this.endpoint = resolveEndpoint(config.baseUrl());
        this.modelName = config.modelName();
        this.timeout = config.timeout();
    }

    @Override
    public CompletableFuture<TranslationResult> translate(TranslationRequest request) {
        Objects.requireNonNull(request, "request");
        long started = System.nanoTime();
        HttpRequest httpRequest;
        try {
            httpRequest = buildHttpRequest(request);
        } catch (JsonProcessingException ex) {
            return CompletableFuture.failedFuture(
                    new TranslationException(TranslationException.Failure.DECODE, "Failed to encode provider request", ex));
        }
        LOGGER.debug("Translating {} -> {} via {} ({} chars)",
                request.sourceLang(), request.targetLang(), endpoint, request.text().length());

        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8))
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((response, error) -> {
                    if (error != null) {
                        throw asNetworkFailure(error);
                    }
                    TranslationResult result = toResult(response, elapsedMillis(started));
                    LOGGER.debug("Translation finished in {} ms", result.providerLatencyMs());
                    return result;
                });
    }

    static URI resolveEndpoint(URI baseUrl) {
        Objects.requireNonNull(baseUrl, "baseUrl");
        String path = baseUrl.getRawPath() == null ? "" : baseUrl.getRawPath();
        if (path.endsWith("/" + COMPLETIONS_PATH)) {
            return baseUrl;
        }
        StringBuilder resolved = new StringBuilder()
                .append(baseUrl.getScheme()).append("://").append(baseUrl.getRawAuthority())
                .append(path.endsWith("/") ? path : path + "/").append(COMPLETIONS_PATH);
        if (baseUrl.getRawQuery() != null) {
            resolved.append('?').append(baseUrl.getRawQuery());
        }
        if (baseUrl.getRawFragment() != null) {
            resolved.append('#').append(baseUrl.getRawFragment());
        }
        return URI.create(resolved.toString());
    }

    static String userMessage(TranslationRequest request) {
        return "src=" + request.sourceLang().code() + ";tgt=" + request.targetLang().code() + ";text=" + request.text();
    }

    private HttpRequest buildHttpRequest(TranslationRequest request) throws JsonProcessingException {
        ChatCompletionBody body = new ChatCompletionBody(modelName, 0.0, List.of(
                new ChatMessage("system", SYSTEM_PROMPT),
                new ChatMessage("user", userMessage(request))));
        String payload = objectMapper.writeValueAsString(body);
        return HttpRequest.newBuilder(endpoint)
                .timeout(timeout)
                .header("Authorization", "Bearer " + apiKey)
                .header("Content-Type", "application/json; charset=utf-8")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload, StandardCharsets.UTF_8))
                .build();
    }

    private TranslationResult toResult(HttpResponse<String> response, long latencyMs) {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            LOGGER.warn("Translation provider answered with status {}", status);
            throw new ProviderStatusException(status, response.body());
        }
        String content = extractContent(response.body());
        ContentDecoder.DecodedContent decoded = contentDecoder.decode(content);
        ProviderPayload payload = decoded.payload();
        // alternatives are requested off and dropped even when the model sends some
        return new TranslationResult(payload.translation(), List.of(),
                Optional.ofNullable(payload.romanized()),
                latencyMs);
    }

    private String extractContent(String body) {
        JsonNode envelope;
        try {
            envelope = objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException ex) {
            throw new TranslationException(TranslationException.Failure.DECODE, "Provider response is not valid JSON", ex);
        }
        JsonNode content = envelope == null ? null : envelope.at("/choices/0/message/content");
        if (content == null || !content.isTextual()) {
            throw new TranslationException(TranslationException.Failure.DECODE, "Provider response missing content");
        }
        return content.asText();
    }

    private static TranslationException asNetworkFailure(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof TranslationException translationException) {
            return translationException;
        }
        if (cause instanceof HttpTimeoutException || cause instanceof TimeoutException) {
            LOGGER.warn("Translation provider timed out");
            return new TranslationException(TranslationException.Failure.NETWORK, "Translation provider timed out", cause);
        }
        if (cause instanceof IOException) {
            LOGGER.warn("Translation provider unreachable: {}", cause.getMessage());
            return new TranslationException(TranslationException.Failure.NETWORK,
                    "Failed to reach translation provider: " + cause.getMessage(), cause);
        }
        return new TranslationException(TranslationException.Failure.NETWORK,
                "Translation request failed: " + cause.getMessage(), cause);
    }

    private static long elapsedMillis(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }

    record ChatCompletionBody(@JsonProperty("model") String model,
                              @JsonProperty("temperature") double temperature,
                              @JsonProperty("messages") List<ChatMessage> messages) {
    }

    record ChatMessage(@JsonProperty("role") String role, @JsonProperty("content") String content) {
    }
}
