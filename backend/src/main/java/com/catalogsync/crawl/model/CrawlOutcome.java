package com.catalogsync.crawl.model;

public record CrawlOutcome(
    String sessionId,
    CrawlMode mode,
    SessionStatus status,
    int urlsDiscovered,
    int productsSaved,
    int productsFailed,
    String message
) {
    public boolean success() {
        return status == SessionStatus.COMPLETE && productsFailed == 0;
    }
}
