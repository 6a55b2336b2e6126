package com.sopgenerator.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sopgenerator.core.model.PipelineWarning;
import com.sopgenerator.core.parser.ParseResult;
import com.sopgenerator.core.pipeline.SopPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to print the default document fields of a diagram as JSON.
 *
 * <p>Front ends use the output to pre-fill their edit forms.
 */
@Command(
    name = "extract",
    description = "Print the default document fields of a diagram as JSON",
    mixinStandardHelpOptions = true
)
public class ExtractCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExtractCommand.class);
    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Mixin
    private DiagramOptions options;

    @Override
    public Integer call() {
        try {
            SopPipeline pipeline = new SopPipeline(options.loadConfiguration());
            ParseResult parsed = pipeline.ingest(options.readDiagram());

            Map<String, Object> result = new LinkedHashMap<>();
            result.put("processId", parsed.graph().processId());
            result.put("metadata", pipeline.extractMetadata(parsed.graph()));
            result.put("warnings", parsed.warnings().stream().map(PipelineWarning::describe).toList());

            System.out.println(JSON.writeValueAsString(result));
            return 0;

        } catch (Exception e) {
            log.error("Extract failed", e);
            System.err.println("✗ Extract failed: " + e.getMessage());
            return 1;
        }
    }
}
