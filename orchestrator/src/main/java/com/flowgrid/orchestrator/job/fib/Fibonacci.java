package com.flowgrid.orchestrator.job.fib;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

public final class Fibonacci {

    private Fibonacci() {}

    /** F(n) by fast doubling: F(2k) = F(k)(2F(k+1) - F(k)), F(2k+1) = F(k)^2 + F(k+1)^2. */
    public static BigInteger fastDoubling(long n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must be >= 0, got " + n);
        }
        return pair(n)[0];
    }

    private static BigInteger[] pair(long k) {
        if (k == 0) {
            return new BigInteger[] {BigInteger.ZERO, BigInteger.ONE};
        }
        BigInteger[] half = pair(k >> 1);
        BigInteger f = half[0];
        BigInteger g = half[1];
        BigInteger even = f.multiply(g.shiftLeft(1).subtract(f));
        BigInteger odd = f.multiply(f).add(g.multiply(g));
        return (k & 1) == 0 ? new BigInteger[] {even, odd} : new BigInteger[] {odd, even.add(odd)};
    }

    /**
     * Splits n into consecutive segment lengths of at most {@code chunkSize};
     * the lengths sum to n. Empty for n = 0.
     */
    public static List<Long> chunks(long n, long chunkSize) {
        if (n < 0) {
            throw new IllegalArgumentException("n must be >= 0, got " + n);
        }
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be > 0, got " + chunkSize);
        }
        List<Long> chunks = new ArrayList<>();
        for (long remaining = n; remaining > 0; remaining -= chunkSize) {
            chunks.add(Math.min(chunkSize, remaining));
        }
        return chunks;
    }
}
