package com.sopgenerator.core.linearizer;

import com.sopgenerator.core.model.PipelineWarning;
import com.sopgenerator.core.model.Step;
import com.sopgenerator.core.model.WarningType;

import java.util.List;

/**
 * Ordered procedure produced by the {@link StepLinearizer}.
 *
 * @param steps steps in document order
 * @param warnings recoverable findings (unreachable elements, unlabeled conditions)
 */
public record Linearization(
    List<Step> steps,
    List<PipelineWarning> warnings
) {
    public Linearization {
        steps = steps == null ? List.of() : List.copyOf(steps);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * Returns the ids of elements that no start event reaches.
     *
     * @return unreachable element ids in document order
     */
    public List<String> unreachableElementIds() {
        return warnings.stream()
            .filter(w -> w.type() == WarningType.UNREACHABLE_ELEMENT)
            .map(PipelineWarning::elementId)
            .toList();
    }
}
