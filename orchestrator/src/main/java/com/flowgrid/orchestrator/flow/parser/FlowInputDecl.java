package com.flowgrid.orchestrator.flow.parser;

/** One line of an {@code INPUTS ... END INPUTS} block: {@code <type> <name> [(optional)]}. */
public record FlowInputDecl(String name, FlowInputType type, boolean optional) {}
