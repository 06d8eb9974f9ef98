package com.catalogsync.crawl.model;

public enum StoreOutcome {
    SAVED,
    REJECTED,
    CANCELED
}
