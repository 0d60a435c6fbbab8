package com.flowgrid.orchestrator.flow.parser;

import java.util.Locale;
import java.util.Optional;

public enum FlowInputType {
    FILE, TABLE, TEXT, JSON, NUMBER, BOOL, BLOB;

    public static Optional<FlowInputType> fromToken(String token) {
        for (FlowInputType type : values()) {
            if (type.name().equals(token.toUpperCase(Locale.ROOT))) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
