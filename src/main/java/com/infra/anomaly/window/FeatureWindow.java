package com.infra.anomaly.window;

import com.infra.anomaly.model.MetricSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded, time-ordered buffer of the most recent metric samples.
 *
 * <p>Timestamps in the buffer never decrease. A sample that arrives late by no more than
 * the out-of-order tolerance is stored with the newest timestamp; anything later is not
 * stored. When full, the oldest sample is evicted.
 *
 * <p>Readers always get a copy taken under the read lock, so a drift check or a training
 * snapshot never observes a half-applied append.
 */
public class FeatureWindow {

    private static final Logger log = LoggerFactory.getLogger(FeatureWindow.class);

    private final int capacity;
    private final long outOfOrderToleranceMs;
    private final ArrayDeque<MetricSample> buffer;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private long lastTimestamp = Long.MIN_VALUE;
    private long appendedCount;
    private long droppedCount;

    public FeatureWindow(int capacity, long outOfOrderToleranceMs) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Window capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.outOfOrderToleranceMs = Math.max(0, outOfOrderToleranceMs);
        this.buffer = new ArrayDeque<>(capacity);
    }

    /**
     * Append a sample, evicting the oldest one if the window is full.
     *
     * @return false if the sample was too far out of order and was not stored
     */
    public boolean append(MetricSample sample) {
        lock.writeLock().lock();
        try {
            MetricSample toStore = sample;
            if (sample.getTimestamp() < lastTimestamp) {
                long lateness = lastTimestamp - sample.getTimestamp();
                if (lateness > outOfOrderToleranceMs) {
                    droppedCount++;
                    log.warn("Dropping sample {}ms out of order (tolerance {}ms, ts={}, newest={})",
                            lateness, outOfOrderToleranceMs, sample.getTimestamp(), lastTimestamp);
                    return false;
                }
                toStore = sample.withTimestamp(lastTimestamp);
            }

            if (buffer.size() == capacity) {
                buffer.pollFirst();
            }
            buffer.addLast(toStore);
            lastTimestamp = toStore.getTimestamp();
            appendedCount++;
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Consistent copy of every sample currently in the window, oldest first.
     */
    public List<MetricSample> snapshot() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(buffer));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Consistent copy of the newest {@code k} samples (fewer if the window holds fewer), oldest first.
     */
    public List<MetricSample> recent(int k) {
        lock.readLock().lock();
        try {
            int count = Math.min(Math.max(k, 0), buffer.size());
            MetricSample[] tail = new MetricSample[count];
            Iterator<MetricSample> it = buffer.descendingIterator();
            for (int i = count - 1; i >= 0; i--) {
                tail[i] = it.next();
            }
            return List.of(tail);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return buffer.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getCapacity() {
        return capacity;
    }

    public long getAppendedCount() {
        lock.readLock().lock();
        try {
            return appendedCount;
        } finally {
            lock.readLock().unlock();
        }
    }

    public long getDroppedCount() {
        lock.readLock().lock();
        try {
            return droppedCount;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Newest stored timestamp, or null when empty.
     */
    public Long getNewestTimestamp() {
        lock.readLock().lock();
        try {
            return buffer.isEmpty() ? null : buffer.peekLast().getTimestamp();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Long getOldestTimestamp() {
        lock.readLock().lock();
        try {
            return buffer.isEmpty() ? null : buffer.peekFirst().getTimestamp();
        } finally {
            lock.readLock().unlock();
        }
    }
}
