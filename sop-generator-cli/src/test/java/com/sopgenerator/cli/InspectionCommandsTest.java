package com.sopgenerator.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.sopgenerator.cli.CommandTestSupport.copyDiagram;
import static com.sopgenerator.cli.CommandTestSupport.run;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the extract, outline and template commands.
 */
class InspectionCommandsTest {

    @TempDir
    Path tempDir;

    private Path diagram;
    private String config;

    @BeforeEach
    void setUp() {
        diagram = copyDiagram("purchase-approval.bpmn", tempDir);
        config = tempDir.resolve("sop-generator.yaml").toString();
    }

    @Test
    @DisplayName("Should print the field defaults as JSON")
    void extract_printsMetadataJson() throws IOException {
        CommandTestSupport.Run result = run("extract", diagram.toString(), "-c", config);

        assertThat(result.exitCode()).isZero();
        JsonNode json = new ObjectMapper().readTree(result.out());
        assertThat(json.get("processId").asText()).isEqualTo("Process_PA");
        assertThat(json.get("metadata").get("process_name").asText()).isEqualTo("Purchase Approval");
        assertThat(json.get("metadata").get("process_code").asText()).isEqualTo("PRC-001");
        assertThat(json.get("warnings").isArray()).isTrue();
        assertThat(json.get("warnings")).isEmpty();
    }

    @Test
    @DisplayName("Should print the steps indented by branch depth")
    void outline_printsSteps() {
        CommandTestSupport.Run result = run("outline", diagram.toString(), "-c", config);

        assertThat(result.exitCode()).isZero();
        assertThat(result.out())
            .contains("1  Submit PR  [ACTIVITY]")
            .contains("    1A  Case A: Yes  [BRANCH]")
            .contains("    2  Release Purchase Order  [ACTIVITY]");
    }

    @Test
    @DisplayName("Should print step narratives with --full")
    void outline_full_printsNarrative() {
        CommandTestSupport.Run result = run("outline", diagram.toString(), "-c", config, "--full");

        assertThat(result.exitCode()).isZero();
        assertThat(result.out()).contains("      The Requester shall fill in the PR form in the ERP system.");
    }

    @Test
    @DisplayName("Should export the built-in template")
    void template_writesTemplate() throws IOException {
        Path output = tempDir.resolve("templates/sop-template.docx");

        CommandTestSupport.Run result = run("template", "-o", output.toString(), "-c", config);

        assertThat(result.exitCode()).isZero();
        try (InputStream in = Files.newInputStream(output); XWPFDocument document = new XWPFDocument(in)) {
            assertThat(document.getTables()).hasSize(5);
            assertThat(document.getParagraphs().get(0).getText()).isEqualTo("{{process_name}}");
        }
    }
}
