package com.sopgenerator.cli;

import com.sopgenerator.core.exception.SopGenerationException;
import com.sopgenerator.core.model.DocumentContext;
import com.sopgenerator.core.model.PipelineWarning;
import com.sopgenerator.core.parser.ParseResult;
import com.sopgenerator.core.pipeline.SopPipeline;
import com.sopgenerator.core.synthesis.SectionOverrides;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to check that a diagram can be converted.
 *
 * <p>Exit codes: 0 valid, 1 the diagram cannot be converted, 2 warnings found in
 * {@code --strict} mode.
 */
@Command(
    name = "validate",
    description = "Check that a BPMN diagram can be converted into an SOP",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    static final int EXIT_INVALID = 1;
    static final int EXIT_WARNINGS = 2;

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Mixin
    private DiagramOptions options;

    @Option(names = {"--strict"}, description = "Treat warnings as failures")
    private boolean strict;

    @Override
    public Integer call() {
        try {
            log.info("Validating diagram: {}", options.diagram);
            SopPipeline pipeline = new SopPipeline(options.loadConfiguration());
            ParseResult parsed = pipeline.ingest(options.readDiagram());
            DocumentContext document = pipeline.prepare(parsed.graph(), null, SectionOverrides.none());

            List<PipelineWarning> warnings = new ArrayList<>(parsed.warnings());
            warnings.addAll(document.warnings());
            System.out.println("✓ " + document.steps().size() + " steps from "
                + parsed.graph().elements().size() + " elements");
            GenerateCommand.printWarnings(warnings);

            if (strict && !warnings.isEmpty()) {
                System.err.println("✗ Validation failed: " + warnings.size() + " warnings in strict mode");
                return EXIT_WARNINGS;
            }
            System.out.println("✓ Diagram is valid");
            return 0;

        } catch (SopGenerationException e) {
            log.debug("Validation failed at stage {}", e.getStage(), e);
            String element = e.getElementId() == null ? "" : " [" + e.getElementId() + "]";
            System.err.println("✗ Invalid diagram (" + e.getStage() + ")" + element + ": " + e.getMessage());
            return EXIT_INVALID;
        } catch (Exception e) {
            log.error("Validate failed", e);
            System.err.println("✗ Validate failed: " + e.getMessage());
            return EXIT_INVALID;
        }
    }
}
