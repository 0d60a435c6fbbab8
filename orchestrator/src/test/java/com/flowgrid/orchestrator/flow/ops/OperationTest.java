package com.flowgrid.orchestrator.flow.ops;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class OperationTest {

    @Test
    void variantsAreClosedRecords_onePerKind() {
        Class<?>[] variants = Operation.class.getPermittedSubclasses();

        assertThat(Operation.class.isSealed()).isTrue();
        assertThat(variants).hasSize(OperationKind.values().length);
        assertThat(Arrays.stream(variants).allMatch(Class::isRecord)).isTrue();
    }
}
