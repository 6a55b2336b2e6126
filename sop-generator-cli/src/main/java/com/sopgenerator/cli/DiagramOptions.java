package com.sopgenerator.cli;

import com.sopgenerator.core.config.ConfigLoader;
import com.sopgenerator.core.config.SopConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Options shared by the commands that read a diagram.
 */
public class DiagramOptions {

    private static final Logger log = LoggerFactory.getLogger(DiagramOptions.class);

    @Parameters(index = "0", description = "BPMN diagram file")
    Path diagram;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: sop-generator.yaml)"
    )
    Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    /**
     * Loads configuration, falling back to defaults when the file is absent.
     *
     * @return configuration
     */
    SopConfig loadConfiguration() {
        log.debug("Loading configuration from: {}", configPath.toAbsolutePath());
        return ConfigLoader.load(configPath);
    }

    /**
     * Reads the diagram markup.
     *
     * @return markup
     * @throws IOException if the file cannot be read
     */
    String readDiagram() throws IOException {
        log.debug("Reading diagram: {}", diagram.toAbsolutePath());
        if (!Files.isRegularFile(diagram)) {
            throw new IOException("Diagram not found: " + diagram);
        }
        return Files.readString(diagram, StandardCharsets.UTF_8);
    }
}
