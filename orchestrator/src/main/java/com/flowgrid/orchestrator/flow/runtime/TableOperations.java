package com.flowgrid.orchestrator.flow.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BigIntegerNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.flowgrid.orchestrator.flow.ops.Aggregation;
import com.flowgrid.orchestrator.flow.ops.Condition;
import com.flowgrid.orchestrator.flow.ops.SortDirection;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Relational operations over tables, where a table is a JSON array of
 * objects. Every operation returns a new array and leaves its input alone.
 * Numbers are compared and summed as {@link BigDecimal}.
 */
public final class TableOperations {

    private static final JsonNodeFactory NODES = JsonNodeFactory.withExactBigDecimals(true);

    private TableOperations() {}

    // ------------------------------------------------------------------
    // Loading
    // ------------------------------------------------------------------

    /** Deep copy of an array of rows, or the parsed rows of a CSV string. */
    public static ArrayNode asTable(JsonNode value, String label) {
        if (value.isArray()) {
            ArrayNode rows = NODES.arrayNode();
            for (JsonNode row : value) {
                if (!row.isObject()) {
                    throw new IllegalArgumentException("expected rows of objects in " + label + ", found " + row.getNodeType());
                }
                rows.add(row.deepCopy());
            }
            return rows;
        }
        if (value.isTextual()) {
            return parseCsv(value.textValue());
        }
        throw new IllegalArgumentException("expected tabular data for " + label + ", found " + value.getNodeType());
    }

    private static final CSVFormat CSV = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .setTrim(true)
            .build();

    /**
     * RFC 4180 text with a header row. Numeric cells become numbers, empty or
     * missing cells null. Rows with no content are skipped.
     */
    public static ArrayNode parseCsv(String text) {
        ArrayNode rows = NODES.arrayNode();
        if (text.isBlank()) {
            return rows;
        }
        try (CSVParser parser = CSV.parse(new StringReader(text.strip()))) {
            List<String> headers = parser.getHeaderNames();
            for (CSVRecord record : parser) {
                if (isBlank(record)) {
                    continue;
                }
                ObjectNode row = rows.addObject();
                for (int c = 0; c < headers.size(); c++) {
                    row.set(headers.get(c), cell(c < record.size() ? record.get(c) : ""));
                }
            }
        } catch (IOException | UncheckedIOException | IllegalStateException e) {
            throw new IllegalArgumentException("malformed CSV: " + e.getMessage(), e);
        }
        return rows;
    }

    private static boolean isBlank(CSVRecord record) {
        for (String value : record) {
            if (!value.isBlank()) {
                return false;
            }
        }
        return true;
    }

    private static JsonNode cell(String token) {
        if (token.isEmpty()) {
            return NullNode.getInstance();
        }
        Optional<BigDecimal> number = parseNumber(token);
        if (number.isPresent()) {
            return numberNode(number.get());
        }
        return TextNode.valueOf(token);
    }

    // ------------------------------------------------------------------
    // Relational operations
    // ------------------------------------------------------------------

    public static ArrayNode filter(ArrayNode table, Condition condition) {
        ArrayNode result = NODES.arrayNode();
        for (JsonNode row : table) {
            if (matches(field(row, condition.field()), condition)) {
                result.add(row.deepCopy());
            }
        }
        return result;
    }

    static boolean matches(JsonNode left, Condition condition) {
        JsonNode right = condition.value();
        if (condition.operator().isOrdering()) {
            Optional<BigDecimal> l = numeric(left);
            Optional<BigDecimal> r = numeric(right);
            if (l.isEmpty() || r.isEmpty()) {
                return false;
            }
            int cmp = l.get().compareTo(r.get());
            return switch (condition.operator()) {
                case GT -> cmp > 0;
                case GTE -> cmp >= 0;
                case LT -> cmp < 0;
                case LTE -> cmp <= 0;
                default -> false;
            };
        }
        boolean equal = valueEquals(left, right);
        return switch (condition.operator()) {
            case EQ -> equal;
            case NEQ -> !equal;
            default -> false;
        };
    }

    /**
     * One output row per distinct group key, in first-seen order. The key
     * column keeps the first row's value; {@code count} counts rows, {@code sum}
     * adds numeric values and ignores the rest.
     */
    public static ArrayNode groupAggregate(ArrayNode table, String groupBy, List<Aggregation> aggregations) {
        Map<String, List<JsonNode>> buckets = new LinkedHashMap<>();
        for (JsonNode row : table) {
            buckets.computeIfAbsent(groupKey(field(row, groupBy)), k -> new ArrayList<>()).add(row);
        }
        ArrayNode result = NODES.arrayNode();
        for (List<JsonNode> rows : buckets.values()) {
            ObjectNode out = result.addObject();
            JsonNode key = field(rows.get(0), groupBy);
            out.set(groupBy, key.isMissingNode() ? NullNode.getInstance() : key.deepCopy());
            for (Aggregation aggregation : aggregations) {
                switch (aggregation.function()) {
                    case COUNT -> out.put(aggregation.alias(), rows.size());
                    case SUM -> {
                        BigDecimal sum = BigDecimal.ZERO;
                        for (JsonNode row : rows) {
                            sum = sum.add(numeric(field(row, aggregation.field())).orElse(BigDecimal.ZERO));
                        }
                        out.set(aggregation.alias(), numberNode(sum));
                    }
                }
            }
        }
        return result;
    }

    /** Stable sort; numeric when both values are numbers, otherwise by text. Nulls sort as empty text. */
    public static ArrayNode sort(ArrayNode table, String field, SortDirection direction, Integer limit) {
        List<JsonNode> rows = new ArrayList<>();
        table.forEach(rows::add);
        Comparator<JsonNode> order = (a, b) -> compareValues(field(a, field), field(b, field));
        rows.sort(direction == SortDirection.DESC ? order.reversed() : order);
        ArrayNode result = NODES.arrayNode();
        int max = limit == null ? rows.size() : Math.min(limit, rows.size());
        for (int i = 0; i < max; i++) {
            result.add(rows.get(i).deepCopy());
        }
        return result;
    }

    public static ArrayNode take(ArrayNode table, int count) {
        ArrayNode result = NODES.arrayNode();
        for (int i = 0; i < Math.min(count, table.size()); i++) {
            result.add(table.get(i).deepCopy());
        }
        return result;
    }

    // ------------------------------------------------------------------
    // Values
    // ------------------------------------------------------------------

    /** Dotted path lookup; missing segments yield {@link MissingNode}. */
    public static JsonNode field(JsonNode row, String path) {
        JsonNode current = row;
        for (String segment : path.split("\\.")) {
            current = current.path(segment);
        }
        return current;
    }

    static Optional<BigDecimal> numeric(JsonNode value) {
        if (value.isNumber()) {
            return Optional.of(value.decimalValue());
        }
        if (value.isTextual()) {
            return parseNumber(value.textValue().strip());
        }
        return Optional.empty();
    }

    private static Optional<BigDecimal> parseNumber(String text) {
        if (!text.matches("-?\\d+(\\.\\d+)?")) {
            return Optional.empty();
        }
        return Optional.of(new BigDecimal(text));
    }

    private static boolean valueEquals(JsonNode left, JsonNode right) {
        if (left.isNumber() && right.isNumber()) {
            return left.decimalValue().compareTo(right.decimalValue()) == 0;
        }
        if (left.isMissingNode() || left.isNull()) {
            return right.isNull() || (right.isTextual() && right.textValue().equals("null"));
        }
        return left.asText().equals(right.asText());
    }

    private static int compareValues(JsonNode left, JsonNode right) {
        if (left.isNumber() && right.isNumber()) {
            return left.decimalValue().compareTo(right.decimalValue());
        }
        return text(left).compareTo(text(right));
    }

    private static String text(JsonNode value) {
        return value.isMissingNode() || value.isNull() ? "" : value.asText();
    }

    private static String groupKey(JsonNode value) {
        if (value.isMissingNode() || value.isNull()) {
            return "null";
        }
        if (value.isNumber()) {
            return value.decimalValue().stripTrailingZeros().toPlainString();
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }

    /** Integral values become Int/Long/BigInteger nodes, others stay exact decimals. */
    static JsonNode numberNode(BigDecimal value) {
        BigDecimal normalized = value.stripTrailingZeros();
        if (normalized.scale() <= 0) {
            BigInteger integer = normalized.toBigIntegerExact();
            if (integer.bitLength() < 32) return IntNode.valueOf(integer.intValue());
            if (integer.bitLength() < 64) return LongNode.valueOf(integer.longValue());
            return BigIntegerNode.valueOf(integer);
        }
        return DecimalNode.valueOf(normalized);
    }
}
