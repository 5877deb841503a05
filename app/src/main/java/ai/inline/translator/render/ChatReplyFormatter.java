package ai.inline.translator.render;

import ai.inline.translator.query.ParsedQuery;
import ai.inline.translator.translate.TranslationResult;
import java.util.ArrayList;
import java.util.List;

/**
 * Formats replies for direct chat messages.
 */
public final class ChatReplyFormatter {

    static final String GREETING = """
            👋 Inline Translation Bot
            Type the bot handle followed by text anywhere to translate between English and Chinese.
            You can also send me text directly here!""";
    static final String NOT_UNDERSTOOD = "Could not understand the input. Please try again.";

    private ChatReplyFormatter() {
    }

    public static String greeting() {
        return GREETING;
    }

    public static String notUnderstood() {
        return NOT_UNDERSTOOD;
    }

    public static List<String> translated(ParsedQuery query, TranslationResult result) {
        List<String> replies = new ArrayList<>(2);
        replies.add(CandidateRenderer.header(query.sourceLang(), query.targetLang()) + "\n\n" + result.primaryText());
        result.romanizedText().ifPresent(romanized -> replies.add("Romanized:\n" + romanized));
        return List.copyOf(replies);
    }

    public static String failed(String message) {
        return "⚠️ Translation failed: " + (message == null ? "" : message);
    }
}
