package com.catalogsync.crawl.model;

import java.time.Instant;

public record SessionStatusView(
    String sessionId,
    String status,
    int pendingCount,
    String progress,
    String categoryName,
    int productsSaved,
    int productsFailed,
    String message,
    Instant createdAt,
    Instant updatedAt
) {
    public static SessionStatusView of(CrawlSession session) {
        return new SessionStatusView(
            session.id(),
            session.status().dbValue(),
            session.pendingUrls().size(),
            session.progress(),
            session.categoryName(),
            session.productsSaved(),
            session.productsFailed(),
            session.message(),
            session.createdAt(),
            session.updatedAt()
        );
    }
}
