package com.phillippitts.scriptmonitor.service.hypothesis;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link HypothesisLog} backed by a list guarded by a lock.
 */
@Component
public class InMemoryHypothesisLog implements HypothesisLog {

    private final List<String> fragments = new ArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();

    @Override
    public void append(String fragment) {
        if (fragment == null || fragment.isBlank()) {
            return;
        }
        String trimmed = fragment.trim();
        lock.lock();
        try {
            fragments.add(trimmed);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String snapshot() {
        lock.lock();
        try {
            return String.join(" ", fragments);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return fragments.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            fragments.clear();
        } finally {
            lock.unlock();
        }
    }
}
