package com.flowgrid.orchestrator.flow.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits FLOW source text into a header, an optional INPUTS block and named
 * steps. Body lines are kept trimmed and otherwise verbatim; interpreting
 * them is the {@code OperationAnalyzer}'s job.
 *
 * <pre>
 * FLOW "daily-sales"
 * INPUTS
 *   table sales
 *   text region (optional)
 * END INPUTS
 * STEP load =
 *   LOAD CSV FROM sales
 * STEP paid = FILTER load WHERE amount > 0
 * END FLOW
 * </pre>
 *
 * Problems are reported as strings in the {@link CompileResult}, never
 * thrown. The only strict-mode difference is that a source with no steps is
 * an error instead of a warning.
 */
@Component
public class StepParser {

    private static final Logger log = LoggerFactory.getLogger(StepParser.class);

    private static final Pattern HEADER = Pattern.compile("^FLOW\\s+\"([^\"]+)\"\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern INPUTS_START = Pattern.compile("^INPUTS$", Pattern.CASE_INSENSITIVE);
    private static final Pattern INPUTS_END = Pattern.compile("^END\\s+INPUTS$", Pattern.CASE_INSENSITIVE);
    private static final Pattern STEP_DECL =
            Pattern.compile("^STEP\\s+([A-Za-z_][A-Za-z0-9_]*)\\s*=\\s*(.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern FLOW_END = Pattern.compile("^END\\s+FLOW$", Pattern.CASE_INSENSITIVE);

    public CompileResult parse(String source, boolean strict) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        String[] lines = (source == null ? "" : source).split("\\r?\\n", -1);

        int headerIndex = firstNonBlank(lines);
        Matcher header = headerIndex < 0 ? null : HEADER.matcher(lines[headerIndex].strip());
        if (header == null || !header.matches()) {
            errors.add("Missing FLOW header");
            return new CompileResult(false, null, warnings, errors);
        }
        String flowName = header.group(1).strip();

        int[] inputsBlock = locateInputs(lines, headerIndex + 1, warnings);
        List<FlowInputDecl> inputs = inputsBlock == null
                ? List.of()
                : parseInputs(lines, inputsBlock[0] + 1, inputsBlock[1], warnings);
        List<FlowStep> steps = parseSteps(lines, headerIndex + 1, inputsBlock, warnings);

        if (steps.isEmpty()) {
            if (strict) {
                errors.add("No STEP definitions found");
            } else {
                warnings.add("No STEP definitions found");
            }
        }

        WorkflowAst ast = new WorkflowAst(flowName, inputs, steps);
        log.debug("Parsed FLOW '{}': {} inputs, {} steps, {} errors, {} warnings",
                flowName, inputs.size(), steps.size(), errors.size(), warnings.size());
        return new CompileResult(errors.isEmpty(), ast, warnings, errors);
    }

    // ------------------------------------------------------------------
    // Inputs
    // ------------------------------------------------------------------

    /** Returns {@code [startLine, endLine]} of the INPUTS block, or null when absent or unterminated. */
    private int[] locateInputs(String[] lines, int from, List<String> warnings) {
        for (int i = from; i < lines.length; i++) {
            if (!INPUTS_START.matcher(lines[i].strip()).matches()) {
                continue;
            }
            for (int j = i + 1; j < lines.length; j++) {
                if (INPUTS_END.matcher(lines[j].strip()).matches()) {
                    return new int[] {i, j};
                }
            }
            warnings.add("INPUTS block missing END INPUTS terminator");
            return null;
        }
        return null;
    }

    private List<FlowInputDecl> parseInputs(String[] lines, int from, int to, List<String> warnings) {
        List<FlowInputDecl> inputs = new ArrayList<>();
        for (int i = from; i < to; i++) {
            String line = lines[i].strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            String[] parts = line.split("\\s+");
            if (parts.length < 2) {
                warnings.add("Malformed input declaration: " + line);
                continue;
            }
            FlowInputType type = FlowInputType.fromToken(parts[0]).orElse(null);
            if (type == null) {
                warnings.add("Unknown input type '" + parts[0] + "' for " + parts[1] + ", treating as text");
                type = FlowInputType.TEXT;
            }
            boolean optional = parts.length > 2 && parts[2].equalsIgnoreCase("(optional)");
            inputs.add(new FlowInputDecl(parts[1], type, optional));
        }
        return inputs;
    }

    // ------------------------------------------------------------------
    // Steps
    // ------------------------------------------------------------------

    private List<FlowStep> parseSteps(String[] lines, int from, int[] inputsBlock, List<String> warnings) {
        List<FlowStep> steps = new ArrayList<>();
        String currentName = null;
        int currentLine = 0;
        List<String> currentBody = new ArrayList<>();
        boolean terminated = false;

        for (int i = from; i < lines.length; i++) {
            if (inputsBlock != null && i >= inputsBlock[0] && i <= inputsBlock[1]) {
                continue;
            }
            String line = lines[i].strip();
            if (line.isEmpty() || line.startsWith("//")) {
                continue;
            }
            if (FLOW_END.matcher(line).matches()) {
                terminated = true;
                break;
            }
            Matcher step = STEP_DECL.matcher(line);
            if (step.matches()) {
                if (currentName != null) {
                    steps.add(newStep(currentName, currentBody, currentLine));
                }
                currentName = step.group(1);
                currentLine = i + 1;
                currentBody = new ArrayList<>();
                if (!step.group(2).isBlank()) {
                    currentBody.add(step.group(2).strip());
                }
            } else if (currentName != null) {
                currentBody.add(line);
            } else {
                warnings.add("Line " + (i + 1) + " is outside any STEP and was ignored: " + line);
            }
        }
        if (currentName != null) {
            steps.add(newStep(currentName, currentBody, currentLine));
        }
        if (!terminated) {
            warnings.add("Missing END FLOW terminator");
        }
        return steps;
    }

    private static FlowStep newStep(String name, List<String> body, int line) {
        OperationKeyword keyword = body.isEmpty() ? null : OperationKeyword.infer(body.get(0)).orElse(null);
        return new FlowStep(name, keyword, body, line);
    }

    private static int firstNonBlank(String[] lines) {
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].strip();
            if (!line.isEmpty() && !line.startsWith("//")) {
                return i;
            }
        }
        return -1;
    }
}
