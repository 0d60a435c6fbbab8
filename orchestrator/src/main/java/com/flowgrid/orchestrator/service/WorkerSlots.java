package com.flowgrid.orchestrator.service;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Running-job capacity of one {@link GridScheduler}.
 *
 * A slot is reserved when a job is claimed and held by the thread that runs
 * it. While that thread waits on other grid jobs it gives the slot back, so
 * the jobs it waits for can be claimed by the same worker.
 */
final class WorkerSlots {

    private static final ThreadLocal<WorkerSlots> HELD = new ThreadLocal<>();

    private final int capacity;
    private final AtomicInteger busy = new AtomicInteger();

    WorkerSlots(int capacity) {
        this.capacity = capacity;
    }

    int free() {
        return capacity - busy.get();
    }

    void reserve() {
        busy.incrementAndGet();
    }

    /** Run a claimed job on the current thread, then free its reserved slot. */
    void runHolding(Runnable job) {
        HELD.set(this);
        try {
            job.run();
        } finally {
            HELD.remove();
            busy.decrementAndGet();
        }
    }

    /**
     * Run {@code wait} with the current thread's slot released. Threads that
     * hold no slot just run it.
     */
    static <T> T releasedWhile(Supplier<T> wait) {
        WorkerSlots slots = HELD.get();
        if (slots == null) {
            return wait.get();
        }
        HELD.remove();
        slots.busy.decrementAndGet();
        try {
            return wait.get();
        } finally {
            slots.busy.incrementAndGet();
            HELD.set(slots);
        }
    }
}
