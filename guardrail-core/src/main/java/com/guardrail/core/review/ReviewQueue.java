package com.guardrail.core.review;

import com.guardrail.core.model.ScoreResult;

import java.util.List;
import java.util.Map;

/**
 * Append-only ledger of inputs that crossed the review threshold.
 * Implementations: InMemory (default). Long-running deployments should supply
 * their own implementation backed by external storage.
 *
 * <p>
 * Positional {@link #approve(int)} and {@link #reject(int)} are forgiving: an
 * index outside the ledger is a no-op that returns {@code false}. Deciding an
 * item again replaces its earlier status. Callers that append concurrently should prefer the
 * id-based variants, since positions shift as other threads append.
 * </p>
 */
public interface ReviewQueue {

    /**
     * Append a new PENDING item. No deduplication.
     */
    ReviewItem add(String text, ScoreResult result, Map<String, String> metadata);

    /**
     * All PENDING items, in insertion order.
     */
    List<ReviewItem> getPending();

    /**
     * Every item ever added, in insertion order.
     */
    List<ReviewItem> getItems();

    /**
     * Mark the item at {@code index} as a false positive.
     *
     * @return whether an item changed state
     */
    boolean approve(int index);

    /**
     * Confirm the item at {@code index} as malicious.
     *
     * @return whether an item changed state
     */
    boolean reject(int index);

    boolean approveById(long id);

    boolean rejectById(long id);

    ReviewSummary summary();
}
