package com.catalogsync.crawl.service;

/**
 * Thrown at a cancellation checkpoint inside a write transaction so the transaction rolls back.
 */
public class CrawlCanceledException extends RuntimeException {
    public CrawlCanceledException(String sessionId) {
        super("Crawl session " + sessionId + " was canceled");
    }
}
