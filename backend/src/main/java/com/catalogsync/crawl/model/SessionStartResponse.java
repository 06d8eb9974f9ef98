package com.catalogsync.crawl.model;

public record SessionStartResponse(String sessionId, CrawlMode mode, String status) {}
