package com.flowgrid.orchestrator.flow.ops;

/**
 * Closed catalogue of step operations. {@code category} and
 * {@code description} feed {@code FlowService.describeOperations()}.
 */
public enum OperationKind {

    LOAD_TABLE("data", "LOAD TABLE \"<table>\" - load a table-valued input"),
    LOAD_CSV("data", "LOAD CSV FROM <input> - load CSV text or rows from an input"),
    LOAD_JSON("data", "LOAD JSON FROM <input> - load a JSON value from an input"),
    FILTER("data", "FILTER <src> WHERE <field> <op> <value> - keep matching rows"),
    GROUP_AGG("data", "GROUP <src> BY <field> with AGG lines - group rows and aggregate count/sum"),
    SORT("data", "SORT <src> BY <field> [ASC|DESC] with optional TAKE <n> - stable sort"),
    TAKE("data", "TAKE <n> [FROM <src>] - first n rows"),
    RUN_AGENT("agent", "RUN AGENT \"<agent>\" [WITH <payload>] - inference job on the grid"),
    APX_EXEC("runtime", "APX_EXEC \"<target>\" WITH <payload> - external execution job on the grid"),
    BUILD_VPKG("runtime", "BUILD_VPKG <ref> - build a package artifact on the grid"),
    DEPLOY_SERVICE("runtime", "DEPLOY_SERVICE <ref> \"<name>\" - deploy a built package as a service"),
    RUN_VASM("runtime", "RUN VASM \"<program>\" WITH <payload> - run a bytecode program on the grid"),
    CALL_FLOW("runtime", "CALL FLOW \"<path>\" WITH <payload> - execute a sub-workflow in-process"),
    OUTPUT("io", "OUTPUT <src> [AS \"<label>\"] - expose a step result"),
    OUTPUT_TEXT("io", "OUTPUT_TEXT <literal> - emit a resolved text value");

    private final String category;
    private final String description;

    OperationKind(String category, String description) {
        this.category = category;
        this.description = description;
    }

    public String category()    { return category; }
    public String description() { return description; }
}
