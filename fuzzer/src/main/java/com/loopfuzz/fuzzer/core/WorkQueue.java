package com.loopfuzz.fuzzer.core;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/** Unbounded FIFO of entries awaiting minimization and mutation. Safe for concurrent producers. */
final class WorkQueue<I, C> {
    private final BlockingQueue<QueueEntry<I, C>> entries = new LinkedBlockingQueue<>();

    void offer(QueueEntry<I, C> entry) {
        entries.add(entry);
    }

    /** Returns the head entry, or {@code null} if the queue is empty. Never blocks. */
    QueueEntry<I, C> poll() {
        return entries.poll();
    }

    int size() {
        return entries.size();
    }
}
