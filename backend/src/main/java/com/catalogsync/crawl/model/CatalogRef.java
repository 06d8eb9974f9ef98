package com.catalogsync.crawl.model;

public record CatalogRef(String name, String url) {}
