package org.asma.cli;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
public class CommandLineInterfaceTest {

    @Test
    public void testCliInitialization() {
        CommandLineInterface cli = new CommandLineInterface();
        CommandLine cmd = new CommandLine(cli);
        assertEquals("asma", cmd.getCommandName());
        assertTrue(cmd.getSubcommands().containsKey("assemble"));
    }

    @Test
    public void testDefaultConfigurationIsLoaded() {
        CommandLineInterface cli = new CommandLineInterface();
        assertEquals("ZARCH", cli.getConfig().getString("asma.assembler.architecture"));
        assertEquals(16, cli.getConfig().getInt("asma.output.rc-chunk-size"));
    }

    @Test
    public void testBrokenLogbackFileFallsBackToConsoleLogging(@TempDir Path dir) throws IOException {
        // Given
        Path broken = Files.writeString(dir.resolve("logback.xml"), "<configuration><appender");
        LoggerContext context = new LoggerContext();
        try {
            // When
            boolean applied = CommandLineInterface.reconfigureLogback(context, broken.toUri().toURL());

            // Then
            assertFalse(applied);
            assertTrue(context.getLogger(Logger.ROOT_LOGGER_NAME).iteratorForAppenders().hasNext());
        } finally {
            context.stop();
        }
    }

    @Test
    public void testBundledLogbackFileIsApplied() {
        LoggerContext context = new LoggerContext();
        try {
            assertTrue(CommandLineInterface.reconfigureLogback(context,
                    CommandLineInterface.class.getClassLoader().getResource("logback.xml")));
            assertTrue(context.getLogger(Logger.ROOT_LOGGER_NAME).iteratorForAppenders().hasNext());
        } finally {
            context.stop();
        }
    }
}
