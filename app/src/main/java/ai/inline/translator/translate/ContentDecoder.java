package ai.inline.translator.translate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the model's reply into a {@link ProviderPayload}.
 *
 * <p>The reply may wrap its JSON object in prose or a Markdown fence, so the text between the first {@code '{'}
 * and the last {@code '}'} is tried first. When that is not a usable payload the whole reply, stripped, becomes the
 * translation. Decoding never fails.</p>
 */
class ContentDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(ContentDecoder.class);

    enum Source {
        STRUCTURED,
        RAW_FALLBACK
    }

    record DecodedContent(ProviderPayload payload, Source source) {

        DecodedContent {
            Objects.requireNonNull(payload, "payload");
            Objects.requireNonNull(source, "source");
        }
    }

    private final ObjectReader payloadReader;

    ContentDecoder(ObjectMapper objectMapper) {
        Objects.requireNonNull(objectMapper, "objectMapper");
        ObjectMapper strict = objectMapper.copy();
        // numbers and booleans are not text
        strict.coercionConfigFor(LogicalType.Textual)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
        this.payloadReader = strict.readerFor(ProviderPayload.class)
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    DecodedContent decode(String content) {
        Objects.requireNonNull(content, "content");
        Optional<ProviderPayload> structured = tryStructured(extractCandidate(content));
        if (structured.isPresent()) {
            return new DecodedContent(structured.get(), Source.STRUCTURED);
        }
        LOGGER.warn("Provider reply is not a translation object; using raw content as translation");
        return new DecodedContent(ProviderPayload.rawText(content.strip()), Source.RAW_FALLBACK);
    }

    static String extractCandidate(String content) {
        int start = content.indexOf('{');
        if (start < 0) {
            return content;
        }
        int end = content.lastIndexOf('}');
        if (end < start) {
            return content;
        }
        return content.substring(start, end + 1);
    }

    private Optional<ProviderPayload> tryStructured(String candidate) {
        ProviderPayload payload;
        try {
            payload = payloadReader.readValue(candidate);
        } catch (JsonProcessingException ex) {
            LOGGER.debug("Structured decode failed: {}", ex.getOriginalMessage());
            return Optional.empty();
        }
        if (payload == null || payload.translation() == null) {
            return Optional.empty();
        }
        return Optional.of(payload);
    }
}
