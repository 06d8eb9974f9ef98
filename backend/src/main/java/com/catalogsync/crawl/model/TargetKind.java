package com.catalogsync.crawl.model;

public enum TargetKind {
    PRODUCT,
    CATALOG,
    OTHER
}
