package com.example.handwritingcomparator.service.history;

import com.example.handwritingcomparator.model.api.ComparisonResponse;
import java.util.List;
import java.util.Optional;

/**
 * Keeps finished comparisons for later retrieval. Newest entries come first.
 */
public interface ComparisonHistoryStore {

    void save(ComparisonResponse comparison);

    List<ComparisonResponse> recent(int limit);

    Optional<ComparisonResponse> findById(String id);

    boolean delete(String id);

    /**
     * @return number of removed comparisons
     */
    int clear();
}
