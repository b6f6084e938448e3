package com.guardrail.core.review;

import com.guardrail.core.model.ScoreResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * In-memory implementation of ReviewQueue for development and single-instance
 * deployments. Grows without bound; every operation is serialized on this
 * instance.
 */
public class InMemoryReviewQueue implements ReviewQueue {

    private static final Logger log = LoggerFactory.getLogger(InMemoryReviewQueue.class);

    private final List<ReviewItem> items = new ArrayList<>();
    private final Clock clock;
    private long nextId = 1;

    public InMemoryReviewQueue() {
        this(Clock.systemUTC());
    }

    public InMemoryReviewQueue(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized ReviewItem add(String text, ScoreResult result, Map<String, String> metadata) {
        ReviewItem item = new ReviewItem(nextId++, text, result, metadata, clock.instant());
        items.add(item);
        log.info("[Guardrail] Queued for review #{} — level={} score={}",
                item.getId(), item.getLevel(), item.getScore());
        return item;
    }

    @Override
    public synchronized List<ReviewItem> getPending() {
        List<ReviewItem> pending = new ArrayList<>();
        for (ReviewItem item : items) {
            if (item.isPending()) {
                pending.add(item);
            }
        }
        return pending;
    }

    @Override
    public synchronized List<ReviewItem> getItems() {
        return List.copyOf(items);
    }

    @Override
    public synchronized boolean approve(int index) {
        return decide(index, ReviewStatus.APPROVED);
    }

    @Override
    public synchronized boolean reject(int index) {
        return decide(index, ReviewStatus.REJECTED);
    }

    @Override
    public synchronized boolean approveById(long id) {
        return decide(indexOf(id), ReviewStatus.APPROVED);
    }

    @Override
    public synchronized boolean rejectById(long id) {
        return decide(indexOf(id), ReviewStatus.REJECTED);
    }

    @Override
    public synchronized ReviewSummary summary() {
        int pending = 0;
        int approved = 0;
        int rejected = 0;
        for (ReviewItem item : items) {
            switch (item.getStatus()) {
                case PENDING -> pending++;
                case APPROVED -> approved++;
                case REJECTED -> rejected++;
            }
        }
        return new ReviewSummary(items.size(), pending, approved, rejected);
    }

    private boolean decide(int index, ReviewStatus status) {
        if (index < 0 || index >= items.size()) {
            log.debug("[Guardrail] Ignoring {} for unknown review index {}", status, index);
            return false;
        }
        ReviewItem item = items.get(index);
        item.setStatus(status);
        log.info("[Guardrail] Review #{} marked {}", item.getId(), status);
        return true;
    }

    private int indexOf(long id) {
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i).getId() == id) {
                return i;
            }
        }
        return -1;
    }
}
