package com.example.namecrawler;

/**
 * A prefix waiting in the {@link Frontier}. Lower priority values dequeue first;
 * {@code sequence} keeps equal priorities in insertion order.
 */
public record QueueItem(
        int priority,
        String prefix,
        long sequence
) implements Comparable<QueueItem> {
    @Override
    public int compareTo(QueueItem other) {
        int byPriority = Integer.compare(priority, other.priority);
        if (byPriority != 0) {
            return byPriority;
        }
        return Long.compare(sequence, other.sequence);
    }
}
