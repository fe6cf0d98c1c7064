package de.mirkosertic.mcp.controlmapper.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Switches the Logback configuration by run mode.
 * <p>
 * As an MCP server (STDIO transport) stdout belongs to JSON-RPC, so logback-deployed.xml
 * routes everything to a file below ~/.controlmapper/log. The command line mode keeps
 * the console configuration from logback.xml, which Logback loads on its own.
 */
public final class LoggingConfigurator {

    private static final Path LOG_DIR = ApplicationConfig.getConfigDirectory().resolve("log");
    private static final String DEPLOYED_CONFIG = "logback-deployed.xml";

    private LoggingConfigurator() {
    }

    /**
     * Must be called before the first logger is used.
     *
     * @param deployedMode true if running as MCP server on STDIO
     */
    public static void configure(final boolean deployedMode) {
        if (deployedMode) {
            ensureLogDirectoryExists();
            loadConfiguration(DEPLOYED_CONFIG);
        }
    }

    private static void ensureLogDirectoryExists() {
        try {
            Files.createDirectories(LOG_DIR);
        } catch (final IOException e) {
            System.err.println("Warning: Could not create log directory: " + LOG_DIR + " (" + e.getMessage() + ")");
        }
    }

    private static void loadConfiguration(final String configFile) {
        try {
            final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
            context.reset();

            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);

            try (InputStream configStream = LoggingConfigurator.class.getClassLoader()
                    .getResourceAsStream(configFile)) {
                if (configStream != null) {
                    configurator.doConfigure(configStream);
                } else {
                    System.err.println("Warning: Could not find " + configFile + " on classpath");
                }
            }
        } catch (final JoranException e) {
            System.err.println("Warning: Error loading logback configuration: " + e.getMessage());
        } catch (final IOException e) {
            System.err.println("Warning: Unexpected error configuring logging: " + e.getMessage());
        }
    }
}
