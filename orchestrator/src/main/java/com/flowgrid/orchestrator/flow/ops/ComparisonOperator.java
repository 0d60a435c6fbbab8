package com.flowgrid.orchestrator.flow.ops;

public enum ComparisonOperator {
    GT(">"), GTE(">="), LT("<"), LTE("<="), EQ("=="), NEQ("!=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() { return symbol; }

    public boolean isOrdering() {
        return this != EQ && this != NEQ;
    }

    public static ComparisonOperator fromSymbol(String symbol) {
        for (ComparisonOperator op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown comparison operator: " + symbol);
    }
}
