package com.example.handwritingcomparator.service.history;

import com.example.handwritingcomparator.config.ComparatorProperties;
import com.example.handwritingcomparator.model.api.ComparisonResponse;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Bounded history held in memory. Once {@code comparator.history.capacity} is reached the oldest
 * comparison is evicted. Contents do not survive a restart.
 */
@Component
public class InMemoryComparisonHistoryStore implements ComparisonHistoryStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryComparisonHistoryStore.class);

    private final Deque<ComparisonResponse> entries = new ArrayDeque<>();
    private final int capacity;

    public InMemoryComparisonHistoryStore(ComparatorProperties properties) {
        this.capacity = Math.max(1, properties.getHistory().getCapacity());
    }

    @Override
    public synchronized void save(ComparisonResponse comparison) {
        entries.removeIf(existing -> existing.id().equals(comparison.id()));
        entries.addFirst(comparison);
        while (entries.size() > capacity) {
            ComparisonResponse evicted = entries.removeLast();
            log.debug("History full, evicted comparison {}", evicted.id());
        }
    }

    @Override
    public synchronized List<ComparisonResponse> recent(int limit) {
        return entries.stream().limit(Math.max(0, limit)).collect(Collectors.toList());
    }

    @Override
    public synchronized Optional<ComparisonResponse> findById(String id) {
        return entries.stream().filter(entry -> entry.id().equals(id)).findFirst();
    }

    @Override
    public synchronized boolean delete(String id) {
        return entries.removeIf(entry -> entry.id().equals(id));
    }

    @Override
    public synchronized int clear() {
        int removed = entries.size();
        entries.clear();
        return removed;
    }
}
