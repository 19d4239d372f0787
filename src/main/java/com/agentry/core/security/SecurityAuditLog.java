package com.agentry.core.security;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only record of security decisions, bounded to a fixed capacity.
 * When the capacity is exceeded the older half is dropped.
 */
public class SecurityAuditLog {

    private final int capacity;
    private final ReentrantLock lock = new ReentrantLock();
    private List<SecurityEvent> events = new ArrayList<>();

    public SecurityAuditLog(int capacity) {
        if (capacity < 2) {
            throw new IllegalArgumentException("Audit log capacity must be at least 2");
        }
        this.capacity = capacity;
    }

    public void append(SecurityEvent event) {
        lock.lock();
        try {
            events.add(event);
            if (events.size() > capacity) {
                events = new ArrayList<>(events.subList(events.size() - capacity / 2, events.size()));
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns events in insertion order, optionally filtered by severity and trimmed to the newest {@code limit}.
     */
    public List<SecurityEvent> query(SecurityEvent.Severity severity, int limit) {
        lock.lock();
        try {
            List<SecurityEvent> filtered = severity == null
                    ? new ArrayList<>(events)
                    : events.stream().filter(e -> e.severity() == severity).toList();
            if (limit > 0 && filtered.size() > limit) {
                filtered = filtered.subList(filtered.size() - limit, filtered.size());
            }
            return List.copyOf(filtered);
        } finally {
            lock.unlock();
        }
    }

    public List<SecurityEvent> all() {
        return query(null, 0);
    }

    public int size() {
        lock.lock();
        try {
            return events.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }
}
