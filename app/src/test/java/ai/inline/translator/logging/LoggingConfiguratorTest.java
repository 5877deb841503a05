package ai.inline.translator.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ai.inline.translator.config.LogFormat;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {

    @AfterEach
    void restoreTextFormat() {
        LoggingConfigurator.configure(LogFormat.TEXT);
    }

    @Test
    void switchesConsoleEncoderToJson() {
        int updated = LoggingConfigurator.configure(LogFormat.JSON);

        assertThat(updated).isPositive();
        ConsoleAppender<ILoggingEvent> console = consoleAppender();
        assertThat(console.getEncoder()).isInstanceOf(LayoutWrappingEncoder.class);
        assertThat(((LayoutWrappingEncoder<ILoggingEvent>) console.getEncoder()).getLayout())
                .isInstanceOf(SimpleJsonLayout.class);
        assertThat(console.isStarted()).isTrue();
    }

    @Test
    void switchesBackToPatternEncoder() {
        LoggingConfigurator.configure(LogFormat.JSON);

        LoggingConfigurator.configure(LogFormat.TEXT);

        assertThat(consoleAppender().getEncoder())
                .isInstanceOf(ch.qos.logback.classic.encoder.PatternLayoutEncoder.class);
    }

    private static ConsoleAppender<ILoggingEvent> consoleAppender() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        return (ConsoleAppender<ILoggingEvent>) root.getAppender("CONSOLE");
    }
}
