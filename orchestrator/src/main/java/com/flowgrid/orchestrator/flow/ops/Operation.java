package com.flowgrid.orchestrator.flow.ops;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Typed descriptor of what a step does. The variants are closed: one record
 * per {@link OperationKind}, and callers switch on {@link #kind()} and cast.
 */
public sealed interface Operation permits
        Operation.LoadTable, Operation.LoadCsv, Operation.LoadJson, Operation.Filter,
        Operation.GroupAggregate, Operation.Sort, Operation.Take, Operation.Output, Operation.OutputText,
        Operation.RunAgent, Operation.ExternalExec, Operation.BuildPackage, Operation.DeployService,
        Operation.RunBytecode, Operation.CallSubflow {

    OperationKind kind();

    /**
     * String tokens inside the payload literal that may name another step
     * or input. Empty for operations without a payload.
     */
    default List<String> references() {
        return List.of();
    }

    // ------------------------------------------------------------------
    // Data operations
    // ------------------------------------------------------------------

    record LoadTable(String table) implements Operation {
        public OperationKind kind() { return OperationKind.LOAD_TABLE; }
    }

    record LoadCsv(String source) implements Operation {
        public OperationKind kind() { return OperationKind.LOAD_CSV; }
    }

    record LoadJson(String source) implements Operation {
        public OperationKind kind() { return OperationKind.LOAD_JSON; }
    }

    record Filter(String source, Condition condition) implements Operation {
        public OperationKind kind() { return OperationKind.FILTER; }
    }

    record GroupAggregate(String source, String groupBy, List<Aggregation> aggregations) implements Operation {
        public GroupAggregate {
            aggregations = List.copyOf(aggregations);
        }

        public OperationKind kind() { return OperationKind.GROUP_AGG; }
    }

    /** {@code limit} is null when the step has no trailing {@code TAKE} line. */
    record Sort(String source, String field, SortDirection direction, Integer limit) implements Operation {
        public OperationKind kind() { return OperationKind.SORT; }
    }

    record Take(String source, int count) implements Operation {
        public OperationKind kind() { return OperationKind.TAKE; }
    }

    record Output(String source, String label) implements Operation {
        public OperationKind kind() { return OperationKind.OUTPUT; }
    }

    record OutputText(JsonNode value) implements Operation {
        public OutputText {
            value = value.deepCopy();
        }

        public OperationKind kind() { return OperationKind.OUTPUT_TEXT; }

        @Override
        public List<String> references() { return textTokens(value); }
    }

    // ------------------------------------------------------------------
    // Grid-dispatched operations
    // ------------------------------------------------------------------

    record RunAgent(String agent, ObjectNode payload) implements Operation {
        public RunAgent {
            payload = payload.deepCopy();
        }

        public OperationKind kind() { return OperationKind.RUN_AGENT; }

        @Override
        public List<String> references() { return textTokens(payload); }
    }

    record ExternalExec(String target, JsonNode payload) implements Operation {
        public ExternalExec {
            payload = payload.deepCopy();
        }

        public OperationKind kind() { return OperationKind.APX_EXEC; }

        @Override
        public List<String> references() { return textTokens(payload); }
    }

    /** {@code stepReference} is true when {@code manifestRef} was an unquoted identifier. */
    record BuildPackage(String manifestRef, boolean stepReference) implements Operation {
        public OperationKind kind() { return OperationKind.BUILD_VPKG; }
    }

    record DeployService(String packageRef, boolean stepReference, String serviceName) implements Operation {
        public OperationKind kind() { return OperationKind.DEPLOY_SERVICE; }
    }

    record RunBytecode(String program, ObjectNode input) implements Operation {
        public RunBytecode {
            input = input.deepCopy();
        }

        public OperationKind kind() { return OperationKind.RUN_VASM; }

        @Override
        public List<String> references() { return textTokens(input); }
    }

    record CallSubflow(String path, ObjectNode input) implements Operation {
        public CallSubflow {
            input = input.deepCopy();
        }

        public OperationKind kind() { return OperationKind.CALL_FLOW; }

        @Override
        public List<String> references() { return textTokens(input); }
    }

    private static List<String> textTokens(JsonNode node) {
        List<String> tokens = new ArrayList<>();
        collect(node, tokens);
        return tokens;
    }

    private static void collect(JsonNode node, List<String> tokens) {
        if (node.isTextual()) {
            tokens.add(node.textValue());
        } else if (node.isContainerNode()) {
            node.elements().forEachRemaining(child -> collect(child, tokens));
        }
    }
}
