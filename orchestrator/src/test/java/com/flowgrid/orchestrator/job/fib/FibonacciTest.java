package com.flowgrid.orchestrator.job.fib;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FibonacciTest {

    @Test
    void fastDoubling_knownValues() {
        assertThat(Fibonacci.fastDoubling(0)).isEqualTo(BigInteger.ZERO);
        assertThat(Fibonacci.fastDoubling(1)).isEqualTo(BigInteger.ONE);
        assertThat(Fibonacci.fastDoubling(2)).isEqualTo(BigInteger.ONE);
        assertThat(Fibonacci.fastDoubling(20)).isEqualTo(BigInteger.valueOf(6765));
        assertThat(Fibonacci.fastDoubling(100)).isEqualTo(new BigInteger("354224848179261915075"));
    }

    @Test
    void chunks_sumToN() {
        assertThat(Fibonacci.chunks(12, 5)).containsExactly(5L, 5L, 2L);
        assertThat(Fibonacci.chunks(10, 5)).containsExactly(5L, 5L);
        assertThat(Fibonacci.chunks(3, 500)).containsExactly(3L);
        assertThat(Fibonacci.chunks(0, 5)).isEmpty();
    }

    @Test
    void chunks_rejectsNonPositiveSize() {
        assertThatThrownBy(() -> Fibonacci.chunks(10, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @CsvSource({
            "0, 1", "0, 5", "0, 500",
            "1, 1", "1, 5", "1, 500",
            "2, 1", "2, 5", "2, 500",
            "20, 1", "20, 5", "20, 500",
            "100, 1", "100, 5", "100, 500"
    })
    void productOfSegmentPowers_matchesFastDoubling(long n, long chunkSize) {
        FibMatrix product = FibMatrix.IDENTITY;
        for (long length : Fibonacci.chunks(n, chunkSize)) {
            product = product.multiply(FibMatrix.BASE.pow(length));
        }

        assertThat(product.fibonacci()).isEqualTo(Fibonacci.fastDoubling(n));
    }

    @Test
    void matrixJson_usesDecimalStrings() {
        FibMatrix m = FibMatrix.BASE.pow(100);

        assertThat(m.toJson().get(1).get(0).textValue()).isEqualTo("354224848179261915075");
        assertThat(FibMatrix.fromJson(m.toJson())).isEqualTo(m);
    }

    @Test
    void fromJson_rejectsWrongShape() {
        assertThatThrownBy(() -> FibMatrix.fromJson(FibMatrix.BASE.toJson().get(0)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
