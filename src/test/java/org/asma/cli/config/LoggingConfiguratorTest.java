package org.asma.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.joran.spi.JoranException;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

/**
 * Tests for the LoggingConfigurator class.
 */
@Tag("unit")
class LoggingConfiguratorTest {

    private Level rootLevel;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        rootLevel = context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
        context().getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
        context().getLogger("org.asma.test").setLevel(null);
    }

    @Test
    void configure_withPlainFormat_shouldSelectPlainAppender() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              format = "PLAIN"
              default-level = "INFO"
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertEquals("STDOUT_PLAIN", context().getProperty(LoggingConfigurator.FORMAT_PROPERTY));
        assertEquals(Level.INFO, context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }

    @Test
    void configure_withJsonFormat_shouldSelectJsonAppender() {
        // Given
        final Config config = ConfigFactory.parseString("logging.format = \"json\"");

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertEquals("STDOUT", context().getProperty(LoggingConfigurator.FORMAT_PROPERTY));
    }

    @Test
    void configure_withLoggerLevels_shouldApplyEachLevel() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              levels {
                "org.asma.test" = "DEBUG"
              }
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertEquals(Level.DEBUG, context().getLogger("org.asma.test").getLevel());
    }

    @Test
    void configure_calledTwice_shouldOnlyApplyFirst() {
        // Given
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = \"ERROR\""));

        // When
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = \"TRACE\""));

        // Then
        assertEquals(Level.ERROR, context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }

    /**
     * The JSON appender must emit one parseable object per event, whatever the message holds.
     */
    @Test
    void jsonAppender_withQuotesBackslashesAndNewlines_shouldEmitValidJson() throws JoranException {
        // Given
        final LoggerContext isolated = new LoggerContext();
        isolated.putProperty(LoggingConfigurator.FORMAT_PROPERTY, "STDOUT");
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(isolated);
        configurator.doConfigure(LoggingConfiguratorTest.class.getResource("/logback.xml"));
        final ch.qos.logback.classic.Logger logger = isolated.getLogger("org.asma.test");
        final String message = "operand \"X'FF\\0'\"\nsecond line";

        try {
            final ConsoleAppender<?> appender = assertInstanceOf(ConsoleAppender.class,
                isolated.getLogger(Logger.ROOT_LOGGER_NAME).getAppender("STDOUT"));
            final JsonEncoder encoder = assertInstanceOf(JsonEncoder.class, appender.getEncoder());

            // When
            final byte[] encoded = encoder.encode(
                new LoggingEvent(LoggingConfiguratorTest.class.getName(), logger, Level.WARN, message, null, null));

            // Then
            final JsonObject json = JsonParser.parseString(new String(encoded, StandardCharsets.UTF_8).trim())
                .getAsJsonObject();
            assertEquals(message, json.get("message").getAsString());
            assertEquals("WARN", json.get("level").getAsString());
            assertEquals("org.asma.test", json.get("loggerName").getAsString());
        } finally {
            isolated.stop();
        }
    }

    private static LoggerContext context() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }
}
