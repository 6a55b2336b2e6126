package com.sopgenerator.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.sopgenerator.cli.CommandTestSupport.copyDiagram;
import static com.sopgenerator.cli.CommandTestSupport.run;
import static org.assertj.core.api.Assertions.assertThat;

class ValidateCommandTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should accept a well-formed diagram")
    void validate_validDiagram_returnsZero() {
        Path diagram = copyDiagram("purchase-approval.bpmn", tempDir);

        CommandTestSupport.Run result = run("validate", diagram.toString(), "-c", config());

        assertThat(result.exitCode()).isZero();
        assertThat(result.out()).contains("✓ 8 steps from").contains("✓ Diagram is valid");
    }

    @Test
    @DisplayName("Should accept warnings outside strict mode")
    void validate_warnings_returnsZero() {
        Path diagram = copyDiagram("unreachable-task.bpmn", tempDir);

        CommandTestSupport.Run result = run("validate", diagram.toString(), "-c", config());

        assertThat(result.exitCode()).isZero();
        assertThat(result.out()).contains("UNREACHABLE_ELEMENT");
    }

    @Test
    @DisplayName("Should fail on warnings in strict mode")
    void validate_warningsInStrictMode_returnsTwo() {
        Path diagram = copyDiagram("unreachable-task.bpmn", tempDir);

        CommandTestSupport.Run result = run("validate", diagram.toString(), "-c", config(), "--strict");

        assertThat(result.exitCode()).isEqualTo(ValidateCommand.EXIT_WARNINGS);
        assertThat(result.err()).contains("1 warnings in strict mode");
    }

    @Test
    @DisplayName("Should report the stage and element of a structural error")
    void validate_danglingFlow_reportsElement() throws IOException {
        Path diagram = tempDir.resolve("dangling.bpmn");
        Files.writeString(diagram, """
            <?xml version="1.0" encoding="UTF-8"?>
            <bpmn:definitions xmlns:bpmn="http://www.omg.org/spec/BPMN/20100524/MODEL" id="Defs_1">
              <bpmn:process id="Process_1">
                <bpmn:startEvent id="Start_1" />
                <bpmn:sequenceFlow id="Flow_1" sourceRef="Start_1" targetRef="Task_Missing" />
              </bpmn:process>
            </bpmn:definitions>
            """);

        CommandTestSupport.Run result = run("validate", diagram.toString(), "-c", config());

        assertThat(result.exitCode()).isEqualTo(ValidateCommand.EXIT_INVALID);
        assertThat(result.err()).contains("(PARSE) [Flow_1]");
    }

    @Test
    @DisplayName("Should reject content that is not a diagram")
    void validate_notXml_returnsOne() throws IOException {
        Path diagram = tempDir.resolve("notes.bpmn");
        Files.writeString(diagram, "meeting notes");

        CommandTestSupport.Run result = run("validate", diagram.toString(), "-c", config());

        assertThat(result.exitCode()).isEqualTo(ValidateCommand.EXIT_INVALID);
        assertThat(result.err()).contains("✗ Invalid diagram (PARSE)");
    }

    private String config() {
        return tempDir.resolve("sop-generator.yaml").toString();
    }
}
