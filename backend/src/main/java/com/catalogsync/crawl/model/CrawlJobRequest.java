package com.catalogsync.crawl.model;

public record CrawlJobRequest(
    String productUrl,
    String catalogUrl,
    String categoryName,
    Integer maxPages,
    Integer maxProducts
) {
    public CrawlJobRequest {
        productUrl = blankToNull(productUrl);
        catalogUrl = blankToNull(catalogUrl);
        categoryName = blankToNull(categoryName);
        maxPages = positiveOrNull(maxPages);
        maxProducts = positiveOrNull(maxProducts);
    }

    public CrawlMode mode() {
        if (productUrl != null) {
            return CrawlMode.SINGLE_ITEM;
        }
        if (catalogUrl != null) {
            return CrawlMode.ONE_CATALOG;
        }
        return CrawlMode.ALL_CATALOGS;
    }

    public String categoryOr(String defaultCategory) {
        return categoryName == null ? defaultCategory : categoryName;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static Integer positiveOrNull(Integer value) {
        return value == null || value <= 0 ? null : value;
    }
}
