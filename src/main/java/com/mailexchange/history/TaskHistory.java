package com.mailexchange.history;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded, newest-first history of forwarded messages.
 *
 * <p>Appends build a new immutable list and publish it through a single volatile write,
 * so a concurrent reader sees either the old or the new list, never a half-done append.
 * <br>Writers are serialized on this instance.
 * <p>History lives in memory only and is lost on restart.
 */
public class TaskHistory {

    /**
     * Default capacity.
     */
    public static final int DEFAULT_CAPACITY = 100;

    private final int capacity;
    private final AtomicLong sequence = new AtomicLong();
    private volatile List<ForwardTask> tasks = Collections.emptyList();

    /**
     * Constructs a new TaskHistory with default capacity.
     */
    public TaskHistory() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * Constructs a new TaskHistory instance.
     *
     * @param capacity Maximum entries kept.
     */
    public TaskHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1");
        }
        this.capacity = capacity;
    }

    /**
     * Gets the next sequence id.
     * <p>Monotonic for the lifetime of this instance.
     *
     * @return Id, starting at 1.
     */
    public long nextId() {
        return sequence.incrementAndGet();
    }

    /**
     * Adds a task at the head, evicting the oldest entry on overflow.
     *
     * @param task ForwardTask instance.
     */
    public synchronized void append(ForwardTask task) {
        List<ForwardTask> current = tasks;
        List<ForwardTask> next = new ArrayList<>(Math.min(current.size() + 1, capacity));
        next.add(task);
        for (int i = 0; i < current.size() && next.size() < capacity; i++) {
            next.add(current.get(i));
        }
        tasks = Collections.unmodifiableList(next);
    }

    /**
     * Gets the current history.
     *
     * @return Immutable snapshot, newest first.
     */
    public List<ForwardTask> snapshot() {
        return tasks;
    }

    public int size() {
        return tasks.size();
    }

    public int getCapacity() {
        return capacity;
    }
}
