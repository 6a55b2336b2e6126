package com.sopgenerator.cli;

import com.sopgenerator.core.config.ConfigLoader;
import com.sopgenerator.core.config.SopConfig;
import com.sopgenerator.core.renderer.docx.DefaultTemplateFactory;
import com.sopgenerator.core.renderer.docx.DocumentStyle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to export the built-in Word template for customization.
 */
@Command(
    name = "template",
    description = "Export the built-in Guideline V2 Word template",
    mixinStandardHelpOptions = true
)
public class TemplateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TemplateCommand.class);

    @Option(
        names = {"-o", "--output"},
        description = "Output file (default: sop-template.docx)"
    )
    private Path output = Paths.get("sop-template.docx");

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: sop-generator.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        try {
            SopConfig config = ConfigLoader.load(configPath);
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(output)) {
                new DefaultTemplateFactory(new DocumentStyle(config.style())).write(out);
            }
            log.info("Exported template to {}", output.toAbsolutePath());
            System.out.println("✓ Wrote template " + output);
            return 0;

        } catch (Exception e) {
            log.error("Template export failed", e);
            System.err.println("✗ Template export failed: " + e.getMessage());
            return 1;
        }
    }
}
