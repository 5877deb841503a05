package ai.inline.translator.translate;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * JSON object the model is asked to answer with. Short keys are accepted as aliases of the long ones.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderPayload(
        @JsonProperty("translation") @JsonAlias("t") String translation,
        @JsonProperty("alternatives") @JsonAlias("a") List<String> alternatives,
        @JsonProperty("romanized") @JsonAlias("r") String romanized) {

    static ProviderPayload rawText(String text) {
        return new ProviderPayload(text, null, null);
    }
}
