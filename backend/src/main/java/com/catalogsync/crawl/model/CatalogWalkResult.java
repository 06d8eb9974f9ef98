package com.catalogsync.crawl.model;

import java.util.List;

public record CatalogWalkResult(List<String> productUrls, int pagesVisited, StopReason stopReason) {

    public CatalogWalkResult {
        productUrls = productUrls == null ? List.of() : List.copyOf(productUrls);
    }

    public enum StopReason {
        NO_NEXT_PAGE,
        MAX_PAGES,
        MAX_PRODUCTS,
        CANCELED,
        FETCH_FAILED,
        NO_ROWS
    }
}
