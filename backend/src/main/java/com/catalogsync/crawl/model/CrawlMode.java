package com.catalogsync.crawl.model;

public enum CrawlMode {
    SINGLE_ITEM,
    ONE_CATALOG,
    ALL_CATALOGS
}
