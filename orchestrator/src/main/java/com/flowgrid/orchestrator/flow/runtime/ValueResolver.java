package com.flowgrid.orchestrator.flow.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves names against the outputs of finished steps, then the external
 * inputs. A name may be a path: {@code plan.result.items[0]} walks object
 * fields and array indexes from the value named {@code plan}.
 *
 * <p>A resolver scoped to a node only sees the steps that node depends on,
 * so a payload token naming any other step stays literal text.
 */
class ValueResolver {

    private final Map<String, JsonNode> state;
    private final Map<String, JsonNode> inputs;
    private final Set<String> visibleSteps;

    ValueResolver(Map<String, JsonNode> state, Map<String, JsonNode> inputs) {
        this(state, inputs, null);
    }

    private ValueResolver(Map<String, JsonNode> state, Map<String, JsonNode> inputs, Set<String> visibleSteps) {
        this.state = state;
        this.inputs = inputs;
        this.visibleSteps = visibleSteps;
    }

    /** Resolver limited to the given step outputs plus the workflow inputs. */
    ValueResolver scopedTo(Collection<String> stepNames) {
        return new ValueResolver(state, inputs, Set.copyOf(stepNames));
    }

    Optional<JsonNode> reference(String token) {
        JsonNode whole = lookup(token);
        if (whole != null) {
            return Optional.of(whole);
        }
        List<Object> segments = segments(token);
        if (segments.size() < 2 || !(segments.get(0) instanceof String)) {
            return Optional.empty();
        }
        JsonNode current = lookup((String) segments.get(0));
        for (int i = 1; i < segments.size() && current != null; i++) {
            Object segment = segments.get(i);
            if (segment instanceof Integer) {
                current = current.isArray() ? current.get((Integer) segment) : null;
            } else {
                current = current.isObject() ? current.get((String) segment) : null;
            }
        }
        return Optional.ofNullable(current);
    }

    private JsonNode lookup(String name) {
        if (visibleSteps == null || visibleSteps.contains(name)) {
            JsonNode value = state.get(name);
            if (value != null) {
                return value;
            }
        }
        return inputs.get(name);
    }

    /**
     * Copy of {@code literal} with every string that resolves as a reference
     * replaced by the referenced value. Unresolvable strings stay as text.
     */
    JsonNode resolveLiteral(JsonNode literal) {
        if (literal.isTextual()) {
            return reference(literal.textValue()).<JsonNode>map(JsonNode::deepCopy).orElse(literal);
        }
        if (literal.isArray()) {
            ArrayNode copy = JsonNodeFactory.instance.arrayNode();
            literal.forEach(element -> copy.add(resolveLiteral(element)));
            return copy;
        }
        if (literal.isObject()) {
            ObjectNode copy = JsonNodeFactory.instance.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = literal.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                copy.set(field.getKey(), resolveLiteral(field.getValue()));
            }
            return copy;
        }
        return literal;
    }

    /** Named value as a table, for data operations. */
    ArrayNode dataset(String name) {
        JsonNode value = lookup(name);
        if (value == null) {
            throw new IllegalArgumentException("missing dataset \"" + name + "\"");
        }
        return TableOperations.asTable(value, name);
    }

    static List<Object> segments(String token) {
        List<Object> result = new ArrayList<>();
        StringBuilder buffer = new StringBuilder();
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (c == '.') {
                flush(buffer, result);
            } else if (c == '[') {
                flush(buffer, result);
                int closing = token.indexOf(']', i);
                if (closing < 0) {
                    closing = token.length();
                }
                String inner = token.substring(i + 1, closing);
                if (inner.matches("\\d{1,9}")) {
                    result.add(Integer.parseInt(inner));
                } else if (!inner.isEmpty()) {
                    result.add(inner);
                }
                i = closing;
            } else {
                buffer.append(c);
            }
        }
        flush(buffer, result);
        return result;
    }

    private static void flush(StringBuilder buffer, List<Object> result) {
        if (buffer.length() > 0) {
            result.add(buffer.toString());
            buffer.setLength(0);
        }
    }
}
