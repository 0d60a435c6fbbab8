package com.flowgrid.orchestrator.flow.parser;

import java.util.Locale;
import java.util.Optional;

/**
 * Leading keyword of a step body. Inference is a case-insensitive prefix
 * match that requires a word boundary after the keyword, so
 * {@code OUTPUT_TEXT} is never mistaken for {@code OUTPUT}.
 */
public enum OperationKeyword {

    LOAD_CSV("LOAD CSV"),
    LOAD_JSON("LOAD JSON"),
    LOAD_TABLE("LOAD TABLE"),
    FILTER("FILTER"),
    GROUP("GROUP"),
    SORT("SORT"),
    TAKE("TAKE"),
    RUN_AGENT("RUN AGENT"),
    RUN_VASM("RUN VASM"),
    APX_EXEC("APX_EXEC"),
    BUILD_VPKG("BUILD_VPKG"),
    DEPLOY_SERVICE("DEPLOY_SERVICE"),
    CALL_FLOW("CALL FLOW"),
    OUTPUT_TEXT("OUTPUT_TEXT"),
    OUTPUT("OUTPUT");

    private final String prefix;

    OperationKeyword(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() { return prefix; }

    public static Optional<OperationKeyword> infer(String line) {
        if (line == null) {
            return Optional.empty();
        }
        String normalized = line.strip().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
        for (OperationKeyword keyword : values()) {
            if (normalized.startsWith(keyword.prefix) && endsWord(normalized, keyword.prefix.length())) {
                return Optional.of(keyword);
            }
        }
        return Optional.empty();
    }

    private static boolean endsWord(String text, int at) {
        if (at >= text.length()) {
            return true;
        }
        char next = text.charAt(at);
        return !(Character.isLetterOrDigit(next) || next == '_');
    }
}
