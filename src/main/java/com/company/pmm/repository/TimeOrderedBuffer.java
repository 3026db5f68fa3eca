package com.company.pmm.repository;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Bounded, time-ordered, append-mostly buffer.
 *
 * <p>Append and eviction happen under the write lock, so readers never see a
 * half-appended or half-evicted state; every read returns a copy. Entries are kept
 * in timestamp order: an entry arriving late is slotted in behind the newer ones,
 * which costs O(k) for the k entries it overtakes and O(1) in the common case.</p>
 */
public class TimeOrderedBuffer<T> {

    private final Function<T, Instant> timestampOf;
    private final Duration retention;
    private final int maxSize;

    private final Deque<T> entries = new ArrayDeque<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public TimeOrderedBuffer(Function<T, Instant> timestampOf, Duration retention, int maxSize) {
        if (retention == null || retention.isNegative() || retention.isZero()) {
            throw new IllegalArgumentException("Retention must be positive, got: " + retention);
        }
        if (maxSize <= 0) {
            throw new IllegalArgumentException("Max size must be positive, got: " + maxSize);
        }
        this.timestampOf = timestampOf;
        this.retention = retention;
        this.maxSize = maxSize;
    }

    /**
     * Appends an entry and evicts everything older than {@code now - retention}.
     */
    public void append(T entry, Instant now) {
        lock.writeLock().lock();
        try {
            insertInOrder(entry);
            evict(now);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Entries with timestamp in [from, to], oldest first.
     */
    public List<T> between(Instant from, Instant to) {
        lock.readLock().lock();
        try {
            List<T> result = new ArrayList<>();
            for (T entry : entries) {
                Instant ts = timestampOf.apply(entry);
                if (ts.isAfter(to)) {
                    break;
                }
                if (!ts.isBefore(from)) {
                    result.add(entry);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<T> snapshot() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(entries);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<T> latest() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(entries.peekLast());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Drops expired entries without appending. Used for series that stopped receiving data.
     *
     * @return number of entries removed
     */
    public int evictExpired(Instant now) {
        lock.writeLock().lock();
        try {
            return evict(now);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void insertInOrder(T entry) {
        Instant ts = timestampOf.apply(entry);
        if (entries.isEmpty() || !ts.isBefore(timestampOf.apply(entries.peekLast()))) {
            entries.addLast(entry);
            return;
        }

        Deque<T> newer = new ArrayDeque<>();
        while (!entries.isEmpty() && timestampOf.apply(entries.peekLast()).isAfter(ts)) {
            newer.push(entries.pollLast());
        }
        entries.addLast(entry);
        while (!newer.isEmpty()) {
            entries.addLast(newer.pop());
        }
    }

    private int evict(Instant now) {
        Instant cutoff = now.minus(retention);
        int removed = 0;
        while (!entries.isEmpty() && timestampOf.apply(entries.peekFirst()).isBefore(cutoff)) {
            entries.pollFirst();
            removed++;
        }
        while (entries.size() > maxSize) {
            entries.pollFirst();
            removed++;
        }
        return removed;
    }
}
