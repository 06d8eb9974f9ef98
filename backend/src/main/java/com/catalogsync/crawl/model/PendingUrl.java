package com.catalogsync.crawl.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A product URL queued for ingestion. A bare URL takes the session's default category, a
 * categorized one (collected while walking every catalog) keeps the catalog it came from.
 */
public record PendingUrl(String url, String category) {

    @JsonCreator
    public PendingUrl(@JsonProperty("url") String url, @JsonProperty("category") String category) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url is required");
        }
        this.url = url.trim();
        this.category = category == null || category.isBlank() ? null : category.trim();
    }

    public static PendingUrl bare(String url) {
        return new PendingUrl(url, null);
    }

    public static PendingUrl withCategory(String url, String category) {
        return new PendingUrl(url, category);
    }

    public String resolveCategory(String defaultCategory) {
        return category != null ? category : defaultCategory;
    }
}
