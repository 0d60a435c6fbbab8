package com.flowgrid.orchestrator.flow.parser;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/** Parsed FLOW document: header name, declared inputs and steps in source order. */
public record WorkflowAst(String name, List<FlowInputDecl> inputs, List<FlowStep> steps) {

    public WorkflowAst {
        inputs = List.copyOf(inputs);
        steps = List.copyOf(steps);
    }

    public Optional<FlowInputDecl> input(String inputName) {
        return inputs.stream().filter(i -> i.name().equals(inputName)).findFirst();
    }

    public Set<String> inputNames() {
        Set<String> names = new LinkedHashSet<>();
        inputs.forEach(i -> names.add(i.name()));
        return names;
    }
}
