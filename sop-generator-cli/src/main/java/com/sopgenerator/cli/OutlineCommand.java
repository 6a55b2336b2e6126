package com.sopgenerator.cli;

import com.sopgenerator.core.model.DocumentContext;
import com.sopgenerator.core.model.Step;
import com.sopgenerator.core.parser.ParseResult;
import com.sopgenerator.core.pipeline.SopPipeline;
import com.sopgenerator.core.synthesis.SectionOverrides;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * Command to print the linearized steps of a diagram.
 */
@Command(
    name = "outline",
    description = "Print the procedure steps of a diagram",
    mixinStandardHelpOptions = true
)
public class OutlineCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(OutlineCommand.class);

    @Mixin
    private DiagramOptions options;

    @Option(names = {"--full"}, description = "Print every paragraph, not only step titles")
    private boolean full;

    @Override
    public Integer call() {
        try {
            SopPipeline pipeline = new SopPipeline(options.loadConfiguration());
            ParseResult parsed = pipeline.ingest(options.readDiagram());
            DocumentContext document = pipeline.prepare(parsed.graph(), null, SectionOverrides.none());

            for (Step step : document.steps()) {
                String indent = "    ".repeat(step.depth());
                String ref = step.ref().isEmpty() ? "" : step.ref() + "  ";
                System.out.println(indent + ref + step.title() + "  [" + step.kind() + "]");
                if (full) {
                    step.paragraphs().stream()
                        .skip(1)
                        .forEach(p -> System.out.println(indent + "      " + p.text()));
                }
            }
            GenerateCommand.printWarnings(document.warnings());
            return 0;

        } catch (Exception e) {
            log.error("Outline failed", e);
            System.err.println("✗ Outline failed: " + e.getMessage());
            return 1;
        }
    }
}
