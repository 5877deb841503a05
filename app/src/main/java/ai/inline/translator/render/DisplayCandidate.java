package ai.inline.translator.render;

import java.util.Objects;

/**
 * One selectable entry in an inline-query answer.
 *
 * @param id          unique result id
 * @param title       short title shown in the result list
 * @param body        message text sent when the entry is picked
 * @param description single-line preview, at most {@link CandidateRenderer#DESCRIPTION_LIMIT} characters
 */
public record DisplayCandidate(String id, String title, String body, String description) {

    public DisplayCandidate {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(description, "description");
    }
}
