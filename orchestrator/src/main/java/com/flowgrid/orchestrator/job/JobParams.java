package com.flowgrid.orchestrator.job;

import com.fasterxml.jackson.databind.JsonNode;

/** Param accessors that fail with {@link JobException.Kind#INVALID_PARAMS}. */
public final class JobParams {

    private JobParams() {}

    public static String requireText(JsonNode params, String field, String jobKind) {
        JsonNode value = params.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            throw new JobException(JobException.Kind.INVALID_PARAMS,
                    field + " parameter required for " + jobKind + " job");
        }
        return value.asText();
    }

    public static long requireNonNegative(JsonNode params, String field, String jobKind) {
        JsonNode value = params.get(field);
        if (value == null || !(isIntegralLong(value) || isIntegerText(value))) {
            throw new JobException(JobException.Kind.INVALID_PARAMS,
                    field + " must be a non-negative integer for " + jobKind + " job, got: " + value);
        }
        long parsed = value.isNumber() ? value.longValue() : Long.parseLong(value.asText().strip());
        if (parsed < 0) {
            throw new JobException(JobException.Kind.INVALID_PARAMS,
                    field + " must be a non-negative integer for " + jobKind + " job, got: " + parsed);
        }
        return parsed;
    }

    private static boolean isIntegralLong(JsonNode value) {
        return value.isIntegralNumber() && value.canConvertToLong();
    }

    private static boolean isIntegerText(JsonNode value) {
        return value.isTextual() && value.asText().strip().matches("-?\\d{1,18}");
    }
}
