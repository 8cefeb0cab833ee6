package com.vidnyan.trustgate.application.service;

import com.vidnyan.trustgate.domain.report.VerificationReport;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Reports keyed by content hash, evicted first-in first-out.
 * Lookups do not refresh an entry's position. One lock covers lookup and
 * insert-with-eviction, so the capacity bound holds under concurrent writers.
 * A capacity of zero disables caching.
 */
@Slf4j
public class ResultCache {

    public static final int DEFAULT_CAPACITY = 512;

    private final int capacity;
    private final Map<String, VerificationReport> entries = new LinkedHashMap<>();
    private final Lock lock = new ReentrantLock();

    public ResultCache() {
        this(DEFAULT_CAPACITY);
    }

    public ResultCache(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Cache capacity must not be negative: " + capacity);
        }
        this.capacity = capacity;
    }

    public Optional<VerificationReport> get(String hash) {
        lock.lock();
        try {
            return Optional.ofNullable(entries.get(hash));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Store a report, evicting the oldest entry when the cache is full.
     * Re-storing an existing hash keeps its original position.
     */
    public void put(String hash, VerificationReport report) {
        if (capacity == 0) {
            return;
        }
        lock.lock();
        try {
            if (!entries.containsKey(hash) && entries.size() >= capacity) {
                String oldest = entries.keySet().iterator().next();
                entries.remove(oldest);
                log.debug("Evicted cached report {}", oldest);
            }
            entries.put(hash, report);
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(String hash) {
        lock.lock();
        try {
            return entries.containsKey(hash);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public boolean isEnabled() {
        return capacity > 0;
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }
}
