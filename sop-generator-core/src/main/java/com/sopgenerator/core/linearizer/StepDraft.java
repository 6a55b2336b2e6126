package com.sopgenerator.core.linearizer;

import com.sopgenerator.core.model.DiagramElement;
import com.sopgenerator.core.model.SequenceFlow;
import com.sopgenerator.core.model.StepKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable step under construction. Narrative text is only composed once every activity has
 * its number, because routing sentences refer to steps that may be emitted later.
 */
final class StepDraft {

    final StepKind kind;
    final int depth;
    final int index;
    final List<String> elementIds = new ArrayList<>();

    /** Originating element; the boundary event for exception branches, null for markers. */
    DiagramElement element;
    String ref = "";
    /** Number of the activity preceding a split, used for case references. */
    String baseRef = "";
    String branchLabel;
    /** Letter of a decision case ("A", "B"), null for other drafts. */
    String caseLetter;
    boolean parallel;
    boolean inclusive;
    /** Flow a branch header follows. */
    SequenceFlow flow;
    /** Element a loop or jump marker points at. */
    String targetId;
    /** Element at which the branch ending with this draft continues. */
    String continueTo;
    /** Nearest preceding activity, whose lane is shown on routing rows. */
    StepDraft anchor;

    StepDraft(StepKind kind, int depth, int index) {
        this.kind = kind;
        this.depth = depth;
        this.index = index;
    }
}
