package com.example.namecrawler;

import java.time.Duration;
import java.util.HashSet;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * Prefixes discovered but not yet queried, ordered by {@link QueueItem}.
 * <p>
 * Each popped item stays "in flight" until {@link #complete(QueueItem)} is called. The
 * queue and the in-flight count change under the same lock, so {@link #isDrained()}
 * cannot report quiescence while a worker is still able to push children.
 * A prefix is accepted at most once per run; later pushes of the same prefix are ignored.
 */
public final class Frontier {
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final PriorityQueue<QueueItem> queue = new PriorityQueue<>();
    private final Set<String> accepted = new HashSet<>();
    private long nextSequence;
    private int inFlight;

    /**
     * Queues a prefix. Never blocks.
     *
     * @return {@code false} if the prefix was already queued during this run
     */
    public boolean push(String prefix, int priority) {
        lock.lock();
        try {
            if (!accepted.add(prefix)) {
                return false;
            }
            queue.add(new QueueItem(priority, prefix, nextSequence++));
            changed.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Claims the next item, waiting up to {@code timeout} for one to appear. Returns empty
     * on timeout, or immediately once the frontier is drained.
     */
    public Optional<QueueItem> pop(Duration timeout) throws InterruptedException {
        return pop(timeout, () -> false);
    }

    /**
     * Like {@link #pop(Duration)}, but a waiting caller also gives up as soon as
     * {@code stopRequested} holds. Callers setting the flag follow up with {@link #wakeAll()}.
     */
    public Optional<QueueItem> pop(Duration timeout, BooleanSupplier stopRequested) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (queue.isEmpty()) {
                if (inFlight == 0 || remaining <= 0L || stopRequested.getAsBoolean()) {
                    return Optional.empty();
                }
                remaining = changed.awaitNanos(remaining);
            }
            inFlight++;
            return Optional.of(queue.poll());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ends the cycle started by {@link #pop(Duration)}. Children must be pushed before this call.
     */
    public void complete(QueueItem item) {
        lock.lock();
        try {
            if (inFlight <= 0) {
                throw new IllegalStateException("No claimed item to complete for prefix '" + item.prefix() + "'");
            }
            inFlight--;
            if (inFlight == 0 && queue.isEmpty()) {
                changed.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * True when nothing is queued and no claimed item is outstanding.
     */
    public boolean isDrained() {
        lock.lock();
        try {
            return queue.isEmpty() && inFlight == 0;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wakes every waiting worker so it can observe a stop request.
     */
    public void wakeAll() {
        lock.lock();
        try {
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public int inFlight() {
        lock.lock();
        try {
            return inFlight;
        } finally {
            lock.unlock();
        }
    }
}
