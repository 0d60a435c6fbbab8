package com.flowgrid.orchestrator.job.fib;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.math.BigInteger;

/**
 * 2x2 integer matrix {@code [[a, b], [c, d]]}. {@code BASE^k} is
 * {@code [[F(k+1), F(k)], [F(k), F(k-1)]]}, so F(n) can be read off the
 * product of segment powers whose exponents sum to n.
 */
public record FibMatrix(BigInteger a, BigInteger b, BigInteger c, BigInteger d) {

    public static final FibMatrix IDENTITY = new FibMatrix(BigInteger.ONE, BigInteger.ZERO, BigInteger.ZERO, BigInteger.ONE);
    public static final FibMatrix BASE = new FibMatrix(BigInteger.ONE, BigInteger.ONE, BigInteger.ONE, BigInteger.ZERO);

    public FibMatrix multiply(FibMatrix o) {
        return new FibMatrix(
                a.multiply(o.a).add(b.multiply(o.c)),
                a.multiply(o.b).add(b.multiply(o.d)),
                c.multiply(o.a).add(d.multiply(o.c)),
                c.multiply(o.b).add(d.multiply(o.d)));
    }

    /** Exponentiation by squaring. */
    public FibMatrix pow(long exponent) {
        if (exponent < 0) {
            throw new IllegalArgumentException("Negative exponent: " + exponent);
        }
        FibMatrix result = IDENTITY;
        FibMatrix square = this;
        long remaining = exponent;
        while (remaining > 0) {
            if ((remaining & 1) == 1) {
                result = result.multiply(square);
            }
            remaining >>= 1;
            if (remaining > 0) {
                square = square.multiply(square);
            }
        }
        return result;
    }

    /** F(k) when this matrix is {@code BASE^k}. */
    public BigInteger fibonacci() {
        return c;
    }

    /** {@code [["a","b"],["c","d"]]} with decimal-string entries. */
    public ArrayNode toJson() {
        ArrayNode rows = JsonNodeFactory.instance.arrayNode();
        rows.addArray().add(a.toString()).add(b.toString());
        rows.addArray().add(c.toString()).add(d.toString());
        return rows;
    }

    public static FibMatrix fromJson(JsonNode rows) {
        if (rows == null || !rows.isArray() || rows.size() != 2
                || rows.get(0).size() != 2 || rows.get(1).size() != 2) {
            throw new IllegalArgumentException("Expected a 2x2 matrix, got: " + rows);
        }
        return new FibMatrix(
                entry(rows.get(0).get(0)), entry(rows.get(0).get(1)),
                entry(rows.get(1).get(0)), entry(rows.get(1).get(1)));
    }

    private static BigInteger entry(JsonNode value) {
        if (value.isIntegralNumber()) {
            return value.bigIntegerValue();
        }
        try {
            return new BigInteger(value.asText());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Matrix entry is not an integer: " + value, e);
        }
    }
}
