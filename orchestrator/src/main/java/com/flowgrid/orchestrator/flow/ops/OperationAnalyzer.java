package com.flowgrid.orchestrator.flow.ops;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.flowgrid.orchestrator.flow.parser.FlowStep;
import com.flowgrid.orchestrator.flow.parser.PayloadParseException;
import com.flowgrid.orchestrator.flow.parser.PayloadParser;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a step's body lines into a typed {@link Operation} plus the names it
 * hard-depends on.
 *
 * <p>Payload-bearing operations accept the literal inline after {@code WITH}
 * or on the following lines:
 * <pre>
 * STEP plan =
 *   RUN AGENT "planner"
 *   WITH {
 *     goal: brief.title,
 *     budget: 1200
 *   }
 * </pre>
 */
@Component
public class OperationAnalyzer {

    private static final String IDENT = "[A-Za-z0-9_]+";
    private static final String FIELD = "[A-Za-z0-9_.]+";
    private static final String WITH_TAIL = "(?:\\s+WITH\\b(.*))?";

    private static final Pattern LOAD_TABLE =
            ci("^LOAD\\s+TABLE\\s+(?:\"([^\"]+)\"|(" + IDENT + "))\\s*$");
    private static final Pattern LOAD_CSV = ci("^LOAD\\s+CSV\\s+FROM\\s+(" + IDENT + ")\\s*$");
    private static final Pattern LOAD_JSON = ci("^LOAD\\s+JSON\\s+FROM\\s+(" + IDENT + ")\\s*$");
    private static final Pattern FILTER =
            ci("^FILTER\\s+(" + IDENT + ")\\s+WHERE\\s+(" + FIELD + ")\\s*(==|!=|>=|<=|>|<)\\s*(.+?)\\s*$");
    private static final Pattern GROUP = ci("^GROUP\\s+(" + IDENT + ")\\s+BY\\s+(" + FIELD + ")\\s*$");
    private static final Pattern AGG = ci("^AGG\\s+(.+?)\\s+AS\\s+(" + IDENT + ")\\s*$");
    private static final Pattern COUNT_ALL = ci("^count\\s*\\(\\s*\\*\\s*\\)$");
    private static final Pattern SUM = ci("^sum\\s*\\(\\s*(" + FIELD + ")\\s*\\)$");
    private static final Pattern SORT =
            ci("^SORT\\s+(" + IDENT + ")\\s+BY\\s+(" + FIELD + ")(?:\\s+(ASC|DESC))?\\s*$");
    private static final Pattern TAKE = ci("^TAKE\\s+(\\d+)(?:\\s+FROM\\s+(" + IDENT + "))?\\s*$");
    private static final Pattern RUN_AGENT = ci("^RUN\\s+AGENT\\s+\"([^\"]+)\"" + WITH_TAIL + "$");
    private static final Pattern APX_EXEC = ci("^APX_EXEC\\s+\"([^\"]+)\"" + WITH_TAIL + "$");
    private static final Pattern BUILD_VPKG =
            ci("^BUILD_VPKG\\s+(?:\"([^\"]+)\"|([A-Za-z_][A-Za-z0-9_]*))\\s*$");
    private static final Pattern DEPLOY_SERVICE =
            ci("^DEPLOY_SERVICE\\s+(?:\"([^\"]+)\"|([A-Za-z_][A-Za-z0-9_]*))\\s+\"([^\"]+)\"\\s*$");
    private static final Pattern RUN_VASM = ci("^RUN\\s+VASM\\s+\"([^\"]+)\"" + WITH_TAIL + "$");
    private static final Pattern CALL_FLOW = ci("^CALL\\s+FLOW\\s+\"([^\"]+)\"" + WITH_TAIL + "$");
    private static final Pattern OUTPUT = ci("^OUTPUT\\s+(" + IDENT + ")(?:\\s+AS\\s+\"([^\"]+)\")?\\s*$");
    private static final Pattern OUTPUT_TEXT = ci("^OUTPUT_TEXT\\b(.*)$");
    private static final Pattern WITH_LINE = ci("^WITH\\b(.*)$");
    private static final Pattern QUOTED = Pattern.compile("^(?:\"([^\"]*)\"|'([^']*)')$");
    private static final Pattern NUMERIC = Pattern.compile("^-?\\d+(?:\\.\\d+)?$");

    /**
     * @param previousStepName name of the step declared just before this one,
     *                         used by {@code TAKE} without {@code FROM}; null for the first step
     * @throws OperationSyntaxException when the body does not match its operation
     */
    public AnalyzedStep analyze(FlowStep step, String previousStepName) {
        if (step.bodyLines().isEmpty()) {
            throw new OperationSyntaxException(step.name(), "empty step body");
        }
        if (step.keyword() == null) {
            throw new OperationSyntaxException(step.name(), "unsupported operation: " + step.firstLine());
        }
        return switch (step.keyword()) {
            case LOAD_TABLE -> loadTable(step);
            case LOAD_CSV -> single(step, LOAD_CSV, "LOAD CSV FROM <input>", m -> new Operation.LoadCsv(m.group(1)));
            case LOAD_JSON -> single(step, LOAD_JSON, "LOAD JSON FROM <input>", m -> new Operation.LoadJson(m.group(1)));
            case FILTER -> filter(step);
            case GROUP -> group(step);
            case SORT -> sort(step);
            case TAKE -> take(step, previousStepName);
            case RUN_AGENT -> runAgent(step);
            case APX_EXEC -> externalExec(step);
            case BUILD_VPKG -> buildPackage(step);
            case DEPLOY_SERVICE -> deployService(step);
            case RUN_VASM -> runBytecode(step);
            case CALL_FLOW -> callFlow(step);
            case OUTPUT -> output(step);
            case OUTPUT_TEXT -> outputText(step);
        };
    }

    // ------------------------------------------------------------------
    // Data operations
    // ------------------------------------------------------------------

    private AnalyzedStep loadTable(FlowStep step) {
        Matcher m = match(step, LOAD_TABLE, "LOAD TABLE \"<table>\"");
        requireNoContinuation(step);
        String table = m.group(1) != null ? m.group(1) : m.group(2);
        return analyzed(step, new Operation.LoadTable(table), List.of());
    }

    private AnalyzedStep single(FlowStep step, Pattern pattern, String usage,
                                Function<Matcher, Operation> factory) {
        Matcher m = match(step, pattern, usage);
        requireNoContinuation(step);
        return analyzed(step, factory.apply(m), List.of());
    }

    private AnalyzedStep filter(FlowStep step) {
        Matcher m = match(step, FILTER, "FILTER <source> WHERE <field> <op> <value>");
        requireNoContinuation(step);
        Condition condition = new Condition(m.group(2), ComparisonOperator.fromSymbol(m.group(3)),
                conditionValue(m.group(4)));
        return analyzed(step, new Operation.Filter(m.group(1), condition), List.of(m.group(1)));
    }

    private AnalyzedStep group(FlowStep step) {
        Matcher m = match(step, GROUP, "GROUP <source> BY <field>");
        List<Aggregation> aggregations = new ArrayList<>();
        for (String line : step.continuationLines()) {
            Matcher agg = AGG.matcher(line);
            if (!agg.matches()) {
                throw new OperationSyntaxException(step.name(), "expected AGG <count(*)|sum(field)|field> AS <alias>, got: " + line);
            }
            aggregations.add(aggregation(step, agg.group(1).strip(), agg.group(2)));
        }
        if (aggregations.isEmpty()) {
            throw new OperationSyntaxException(step.name(), "GROUP requires at least one AGG line");
        }
        return analyzed(step, new Operation.GroupAggregate(m.group(1), m.group(2), aggregations), List.of(m.group(1)));
    }

    private Aggregation aggregation(FlowStep step, String expression, String alias) {
        if (COUNT_ALL.matcher(expression).matches()) {
            return new Aggregation(Aggregation.Function.COUNT, null, alias);
        }
        Matcher sum = SUM.matcher(expression);
        if (sum.matches()) {
            return new Aggregation(Aggregation.Function.SUM, sum.group(1), alias);
        }
        if (expression.matches(FIELD)) {
            return new Aggregation(Aggregation.Function.SUM, expression, alias);
        }
        throw new OperationSyntaxException(step.name(), "unsupported aggregation: " + expression);
    }

    private AnalyzedStep sort(FlowStep step) {
        Matcher m = match(step, SORT, "SORT <source> BY <field> [ASC|DESC]");
        Integer limit = null;
        for (String line : step.continuationLines()) {
            Matcher take = TAKE.matcher(line);
            if (!take.matches() || take.group(2) != null || limit != null) {
                throw new OperationSyntaxException(step.name(), "SORT accepts a single trailing TAKE <n>, got: " + line);
            }
            limit = parseCount(step, take.group(1));
        }
        SortDirection direction = m.group(3) == null
                ? SortDirection.ASC
                : SortDirection.valueOf(m.group(3).toUpperCase(Locale.ROOT));
        return analyzed(step, new Operation.Sort(m.group(1), m.group(2), direction, limit), List.of(m.group(1)));
    }

    private AnalyzedStep take(FlowStep step, String previousStepName) {
        Matcher m = match(step, TAKE, "TAKE <n> [FROM <source>]");
        requireNoContinuation(step);
        int count = parseCount(step, m.group(1));
        if (m.group(2) != null) {
            return analyzed(step, new Operation.Take(m.group(2), count), List.of(m.group(2)));
        }
        if (previousStepName == null) {
            throw new OperationSyntaxException(step.name(), "TAKE without FROM has no preceding step to read from");
        }
        return new AnalyzedStep(step, new Operation.Take(previousStepName, count), List.of(previousStepName),
                List.of("TAKE without FROM reads from preceding step '" + previousStepName + "'"));
    }

    private AnalyzedStep output(FlowStep step) {
        Matcher m = match(step, OUTPUT, "OUTPUT <source> [AS \"<label>\"]");
        requireNoContinuation(step);
        String label = m.group(2) != null ? m.group(2) : step.name();
        return analyzed(step, new Operation.Output(m.group(1), label), List.of(m.group(1)));
    }

    private AnalyzedStep outputText(FlowStep step) {
        Matcher m = match(step, OUTPUT_TEXT, "OUTPUT_TEXT <literal>");
        String text = joinWithContinuation(m.group(1), step.continuationLines());
        if (text.isBlank()) {
            throw new OperationSyntaxException(step.name(), "OUTPUT_TEXT requires a literal");
        }
        return analyzed(step, new Operation.OutputText(parsePayload(step, text)), List.of());
    }

    // ------------------------------------------------------------------
    // Grid-dispatched operations
    // ------------------------------------------------------------------

    private AnalyzedStep runAgent(FlowStep step) {
        Matcher m = match(step, RUN_AGENT, "RUN AGENT \"<agent>\" [WITH <payload>]");
        String text = payloadText(step, m.group(2));
        ObjectNode payload = text == null ? JsonNodeFactory.instance.objectNode() : objectPayload(step, text);
        return analyzed(step, new Operation.RunAgent(m.group(1), payload), List.of());
    }

    private AnalyzedStep externalExec(FlowStep step) {
        Matcher m = match(step, APX_EXEC, "APX_EXEC \"<target>\" WITH <payload>");
        String text = requiredPayloadText(step, m.group(2));
        return analyzed(step, new Operation.ExternalExec(m.group(1), parsePayload(step, text)), List.of());
    }

    private AnalyzedStep buildPackage(FlowStep step) {
        Matcher m = match(step, BUILD_VPKG, "BUILD_VPKG <ref>");
        requireNoContinuation(step);
        if (m.group(1) != null) {
            return analyzed(step, new Operation.BuildPackage(m.group(1), false), List.of());
        }
        return analyzed(step, new Operation.BuildPackage(m.group(2), true), List.of(m.group(2)));
    }

    private AnalyzedStep deployService(FlowStep step) {
        Matcher m = match(step, DEPLOY_SERVICE, "DEPLOY_SERVICE <ref> \"<serviceName>\"");
        requireNoContinuation(step);
        if (m.group(1) != null) {
            return analyzed(step, new Operation.DeployService(m.group(1), false, m.group(3)), List.of());
        }
        return analyzed(step, new Operation.DeployService(m.group(2), true, m.group(3)), List.of(m.group(2)));
    }

    private AnalyzedStep runBytecode(FlowStep step) {
        Matcher m = match(step, RUN_VASM, "RUN VASM \"<program>\" WITH <payload>");
        ObjectNode input = objectPayload(step, requiredPayloadText(step, m.group(2)));
        return analyzed(step, new Operation.RunBytecode(m.group(1), input), List.of());
    }

    private AnalyzedStep callFlow(FlowStep step) {
        Matcher m = match(step, CALL_FLOW, "CALL FLOW \"<path>\" WITH <payload>");
        ObjectNode input = objectPayload(step, requiredPayloadText(step, m.group(2)));
        return analyzed(step, new Operation.CallSubflow(m.group(1), input), List.of());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * Payload text from an inline {@code WITH} tail plus continuation lines,
     * or from a {@code WITH} on the second line. Null when there is neither.
     */
    private String payloadText(FlowStep step, String inlineTail) {
        List<String> rest = step.continuationLines();
        if (inlineTail != null) {
            return joinWithContinuation(inlineTail, rest);
        }
        if (rest.isEmpty()) {
            return null;
        }
        Matcher with = WITH_LINE.matcher(rest.get(0));
        if (!with.matches()) {
            throw new OperationSyntaxException(step.name(), "expected WITH <payload>, got: " + rest.get(0));
        }
        return joinWithContinuation(with.group(1), rest.subList(1, rest.size()));
    }

    private String requiredPayloadText(FlowStep step, String inlineTail) {
        String text = payloadText(step, inlineTail);
        if (text == null || text.isBlank()) {
            throw new OperationSyntaxException(step.name(), "missing WITH <payload>");
        }
        return text;
    }

    private ObjectNode objectPayload(FlowStep step, String text) {
        JsonNode parsed = parsePayload(step, text);
        if (!parsed.isObject()) {
            throw new OperationSyntaxException(step.name(), "payload must be an object literal or key = value list");
        }
        return (ObjectNode) parsed;
    }

    private JsonNode parsePayload(FlowStep step, String text) {
        try {
            return PayloadParser.parse(text);
        } catch (PayloadParseException e) {
            throw new OperationSyntaxException(step.name(), "invalid payload: " + e.getMessage(), e);
        }
    }

    private static JsonNode conditionValue(String raw) {
        Matcher quoted = QUOTED.matcher(raw);
        if (quoted.matches()) {
            return TextNode.valueOf(quoted.group(1) != null ? quoted.group(1) : quoted.group(2));
        }
        if (NUMERIC.matcher(raw).matches()) {
            return DecimalNode.valueOf(new BigDecimal(raw));
        }
        return TextNode.valueOf(raw);
    }

    private static int parseCount(FlowStep step, String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new OperationSyntaxException(step.name(), "row count out of range: " + digits, e);
        }
    }

    private static Matcher match(FlowStep step, Pattern pattern, String usage) {
        Matcher m = pattern.matcher(step.firstLine());
        if (!m.matches()) {
            throw new OperationSyntaxException(step.name(), "expected " + usage + ", got: " + step.firstLine());
        }
        return m;
    }

    private static void requireNoContinuation(FlowStep step) {
        if (!step.continuationLines().isEmpty()) {
            throw new OperationSyntaxException(step.name(),
                    "unexpected line after " + step.keyword().prefix() + ": " + step.continuationLines().get(0));
        }
    }

    private static String joinWithContinuation(String head, List<String> rest) {
        StringBuilder text = new StringBuilder(head == null ? "" : head.strip());
        for (String line : rest) {
            text.append('\n').append(line);
        }
        return text.toString().strip();
    }

    private static AnalyzedStep analyzed(FlowStep step, Operation operation, List<String> dependencies) {
        return new AnalyzedStep(step, operation, dependencies, List.of());
    }

    private static Pattern ci(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }
}
