package com.forecastaccuracy.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Latest request generation per series key. Only the newest generation of a key
 * may publish its result; older ones are reported as stale.
 * At most {@code maxTrackedKeys} keys are kept; the least recently registered go first.
 */
@Component
public class RequestGenerationTracker {

    private final ConcurrentHashMap<String, Generation> latest = new ConcurrentHashMap<>();
    private final AtomicLong ticks = new AtomicLong();

    @Value("${dashboard.max-tracked-series:10000}")
    private int maxTrackedKeys = 10_000;

    /**
     * Records a generation for {@code seriesKey}. A null {@code requested} is assigned the
     * next number. Never moves the latest generation backwards.
     */
    public long register(String seriesKey, Long requested) {
        Generation generation = latest.computeIfAbsent(seriesKey, k -> new Generation());
        generation.touched = ticks.incrementAndGet();
        long result;
        if (requested == null) {
            result = generation.value.incrementAndGet();
        } else {
            generation.value.accumulateAndGet(requested, Math::max);
            result = requested;
        }
        if (latest.size() > maxTrackedKeys) {
            evictOldest();
        }
        return result;
    }

    public boolean isCurrent(String seriesKey, long generation) {
        Generation current = latest.get(seriesKey);
        return current != null && current.value.get() == generation;
    }

    public long latest(String seriesKey) {
        Generation current = latest.get(seriesKey);
        return current != null ? current.value.get() : 0L;
    }

    public int trackedKeys() {
        return latest.size();
    }

    private synchronized void evictOldest() {
        int excess = latest.size() - maxTrackedKeys;
        if (excess <= 0) {
            return;
        }
        latest.entrySet().stream()
            .sorted(Comparator.comparingLong(e -> e.getValue().touched))
            .limit(excess)
            .map(Map.Entry::getKey)
            .toList()
            .forEach(latest::remove);
    }

    private static final class Generation {
        private final AtomicLong value = new AtomicLong();
        private volatile long touched;
    }
}
