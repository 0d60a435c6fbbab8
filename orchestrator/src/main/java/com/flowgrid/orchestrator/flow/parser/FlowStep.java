package com.flowgrid.orchestrator.flow.parser;

import java.util.List;

/**
 * A named step as it appears in the source: its trimmed, non-empty body lines
 * and the keyword inferred from the first of them ({@code null} when the body
 * is empty or starts with something unrecognised).
 */
public record FlowStep(String name, OperationKeyword keyword, List<String> bodyLines, int startLine) {

    public FlowStep {
        bodyLines = List.copyOf(bodyLines);
    }

    public String firstLine() {
        return bodyLines.isEmpty() ? "" : bodyLines.get(0);
    }

    public List<String> continuationLines() {
        return bodyLines.isEmpty() ? List.of() : bodyLines.subList(1, bodyLines.size());
    }
}
