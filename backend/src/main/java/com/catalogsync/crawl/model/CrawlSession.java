package com.catalogsync.crawl.model;

import java.time.Instant;
import java.util.List;

/**
 * Persisted crawl session. {@link #withTransition} keeps the current phase label when
 * {@code nextPhase} is null and the current pending list when {@code nextPendingUrls} is null.
 */
public record CrawlSession(
    String id,
    SessionStatus status,
    String progress,
    List<PendingUrl> pendingUrls,
    String categoryName,
    int productsSaved,
    int productsFailed,
    String message,
    Instant createdAt,
    Instant updatedAt
) {
    public CrawlSession {
        pendingUrls = pendingUrls == null ? List.of() : List.copyOf(pendingUrls);
    }

    public CrawlSession withTransition(
        SessionStatus nextStatus,
        SessionPhase nextPhase,
        List<PendingUrl> nextPendingUrls,
        String nextMessage,
        Instant at
    ) {
        return new CrawlSession(
            id,
            nextStatus,
            nextPhase == null ? progress : nextPhase.label(),
            nextPendingUrls == null ? pendingUrls : nextPendingUrls,
            categoryName,
            productsSaved,
            productsFailed,
            nextMessage,
            createdAt,
            at
        );
    }

    public CrawlSession withCounts(int saved, int failed) {
        return new CrawlSession(
            id,
            status,
            progress,
            pendingUrls,
            categoryName,
            saved,
            failed,
            message,
            createdAt,
            updatedAt
        );
    }
}
