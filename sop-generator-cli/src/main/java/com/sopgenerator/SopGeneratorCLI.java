package com.sopgenerator;

import ch.qos.logback.classic.Level;
import com.sopgenerator.cli.ExtractCommand;
import com.sopgenerator.cli.GenerateCommand;
import com.sopgenerator.cli.OutlineCommand;
import com.sopgenerator.cli.TemplateCommand;
import com.sopgenerator.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for the SOP generator.
 *
 * <p>Turns BPMN process diagrams into Guideline V2 Standard Operating Procedure documents.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code generate} - Render the SOP document of a diagram</li>
 *   <li>{@code extract} - Print the default document fields as JSON</li>
 *   <li>{@code outline} - Print the linearized steps</li>
 *   <li>{@code validate} - Check that a diagram can be converted</li>
 *   <li>{@code template} - Export the built-in Word template</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Generate the SOP of a diagram
 * sopgen generate purchase.bpmn -o purchase.docx -f process_owner="Jane Doe"
 *
 * # Inspect the steps before generating
 * sopgen outline purchase.bpmn
 * }</pre>
 */
@Command(
    name = "sopgen",
    mixinStandardHelpOptions = true,
    version = "SOP Generator 1.0.0-SNAPSHOT",
    description = "Generates Standard Operating Procedure documents from BPMN diagrams",
    subcommands = {
        GenerateCommand.class,
        ExtractCommand.class,
        OutlineCommand.class,
        ValidateCommand.class,
        TemplateCommand.class
    }
)
public class SopGeneratorCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SopGeneratorCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return; // Suppress banner in quiet mode
        }

        System.out.println("SOP Generator - BPMN to Standard Operating Procedure");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'sopgen --help' to see available commands");
        System.out.println("Use 'sopgen <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Log level set to {}", root.getLevel());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        SopGeneratorCLI cli = new SopGeneratorCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
