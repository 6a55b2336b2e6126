package com.sopgenerator.cli;

import com.sopgenerator.core.config.SopConfig;
import com.sopgenerator.core.model.PipelineWarning;
import com.sopgenerator.core.parser.ParseResult;
import com.sopgenerator.core.pipeline.SopPipeline;
import com.sopgenerator.core.renderer.DocumentRenderer;
import com.sopgenerator.core.renderer.DocumentRenderers;
import com.sopgenerator.core.renderer.GeneratedDocument;
import com.sopgenerator.core.renderer.RenderContext;
import com.sopgenerator.core.synthesis.SectionOverrides;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to generate the SOP document of a diagram.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Word document with the built-in template
 * sopgen generate purchase.bpmn -o purchase.docx
 *
 * # Custom template and edited fields
 * sopgen generate purchase.bpmn --template corporate.docx -f process_code=PRC-001 -f issued_by=Finance
 *
 * # Markdown preview
 * sopgen generate purchase.bpmn --format markdown -o purchase.md
 * }</pre>
 */
@Command(
    name = "generate",
    description = "Generate the SOP document of a BPMN diagram",
    mixinStandardHelpOptions = true
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Mixin
    private DiagramOptions options;

    @Option(
        names = {"-o", "--output"},
        description = "Output file (default: <process name>.<extension> in the current directory)"
    )
    private Path output;

    @Option(
        names = {"-t", "--template"},
        description = "Word template (default: built-in Guideline V2 template)"
    )
    private Path template;

    @Option(
        names = {"-f", "--field"},
        description = "Document field value, e.g. -f process_owner=\"Jane Doe\""
    )
    private Map<String, String> fields = new LinkedHashMap<>();

    @Option(
        names = {"--format"},
        description = "Output format: docx or markdown (default: docx)",
        defaultValue = DocumentRenderers.DEFAULT_RENDERER
    )
    private String format;

    @Override
    public Integer call() {
        try {
            log.info("Generating SOP from: {}", options.diagram.toAbsolutePath());
            SopConfig config = options.loadConfiguration();
            SopPipeline pipeline = new SopPipeline(config);

            ParseResult parsed = pipeline.ingest(options.readDiagram());
            System.out.println("✓ Parsed " + parsed.graph().elements().size() + " elements");

            DocumentRenderer renderer = DocumentRenderers.find(format);
            RenderContext context = new RenderContext(template, config.style(), Map.of());
            GeneratedDocument document = pipeline.finalizeDocument(
                parsed, fields, SectionOverrides.none(), renderer, context);

            Path target = output != null ? output : Paths.get(document.fileName());
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(target, document.content());
            System.out.println("✓ Wrote " + target + " (" + document.size() + " bytes)");

            printWarnings(document.warnings());
            return 0;

        } catch (Exception e) {
            log.error("Generate failed", e);
            System.err.println("✗ Generate failed: " + e.getMessage());
            return 1;
        }
    }

    static void printWarnings(List<PipelineWarning> warnings) {
        if (warnings.isEmpty()) {
            return;
        }
        System.out.println();
        System.out.println("Warnings (" + warnings.size() + "):");
        for (PipelineWarning warning : warnings) {
            System.out.println("  ! " + warning.describe());
        }
    }
}
