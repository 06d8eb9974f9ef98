package com.catalogsync.crawl.model;

public record SessionActionResponse(String sessionId, String action, boolean applied, SessionStatusView session) {}
