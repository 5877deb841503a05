package ai.inline.translator.cli;

import ai.inline.translator.config.LogFormat;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "inline-translator", mixinStandardHelpOptions = true, version = "inline-translator 0.1.0",
        description = "Translates between English and Chinese. Reads one event per stdin line when no text is given.")
public class CliArguments {

    @CommandLine.Option(names = "--inline", description = "Answer as an inline query (candidate list) instead of a chat message")
    private boolean inline;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Parameters(paramLabel = "TEXT", arity = "0..*", description = "Text to translate, optionally prefixed with en>zh: or zh>en:")
    private List<String> text = new ArrayList<>();

    public boolean inline() {
        return inline;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public List<String> text() {
        return text == null ? List.of() : List.copyOf(text);
    }
}
