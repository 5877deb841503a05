package ai.inline.translator.cli;

import ai.inline.translator.config.Config;
import ai.inline.translator.config.ConfigLoader;
import ai.inline.translator.config.SystemEnvironmentReader;
import ai.inline.translator.language.LinguaLanguageGuesser;
import ai.inline.translator.logging.LoggingConfigurator;
import ai.inline.translator.query.QueryInterpreter;
import ai.inline.translator.relay.TranslationRelay;
import ai.inline.translator.render.CandidateRenderer;
import ai.inline.translator.render.DisplayCandidate;
import ai.inline.translator.translate.ChatCompletionTranslator;
import ai.inline.translator.translate.Translator;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point standing in for the chat adapter: feeds text from the command line or stdin through the relay.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_CONFIG_ERROR = 2;

    private final ConfigLoader configLoader;
    private final Function<Config, Translator> translatorFactory;
    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()),
                config -> new ChatCompletionTranslator(config.translatorConfig(), config.secrets().providerApiKey()),
                System.in, System.out, System.err);
    }

    CliApplication(ConfigLoader configLoader,
                   Function<Config, Translator> translatorFactory,
                   InputStream in,
                   PrintStream out,
                   PrintStream err) {
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
        this.translatorFactory = Objects.requireNonNull(translatorFactory, "translatorFactory");
        this.in = Objects.requireNonNull(in, "in");
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            err.println(ex.getMessage());
            commandLine.usage(err);
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(out);
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(out);
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        Translator translator;
        try {
            config = configLoader.load(cliArguments);
            translator = translatorFactory.apply(config);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            err.println("Configuration error: " + ex.getMessage());
            return EXIT_CONFIG_ERROR;
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Starting translation relay: provider={} model={} defaults={}->{} timeout={}ms",
                config.translatorConfig().baseUrl(), config.translatorConfig().modelName(),
                config.defaultSourceLang(), config.defaultTargetLang(), config.translatorConfig().timeout().toMillis());

        TranslationRelay relay = new TranslationRelay(
                new QueryInterpreter(new LinguaLanguageGuesser()),
                translator,
                new CandidateRenderer(),
                config.defaultSourceLang(),
                config.defaultTargetLang());

        List<String> events = cliArguments.text().isEmpty()
                ? readLines()
                : List.of(String.join(" ", cliArguments.text()));

        List<CompletableFuture<String>> answers = new ArrayList<>(events.size());
        for (String event : events) {
            answers.add(cliArguments.inline()
                    ? relay.answerInlineQuery(event).thenApply(CliApplication::formatCandidates)
                    : relay.answerMessage(event).thenApply(replies -> String.join("\n\n", replies)));
        }
        for (CompletableFuture<String> answer : answers) {
            String rendered = answer.join();
            if (!rendered.isEmpty()) {
                out.println(rendered);
            }
        }
        return 0;
    }

    private List<String> readLines() {
        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read events from stdin", ex);
        }
        return lines;
    }

    static String formatCandidates(List<DisplayCandidate> candidates) {
        StringBuilder builder = new StringBuilder();
        for (DisplayCandidate candidate : candidates) {
            if (builder.length() > 0) {
                builder.append("\n\n");
            }
            builder.append("## ").append(candidate.title()).append('\n')
                    .append("> ").append(candidate.description()).append('\n')
                    .append(candidate.body());
        }
        return builder.toString();
    }
}
