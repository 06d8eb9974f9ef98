package com.catalogsync.crawl.api;

import com.catalogsync.config.CrawlerProperties;
import com.catalogsync.crawl.model.CrawlJobRequest;
import com.catalogsync.crawl.model.TargetKind;
import com.catalogsync.crawl.util.TargetUrlClassifier;

import java.net.URI;

/**
 * Start request. {@code url} is a convenience field classified by path marker; explicit
 * {@code productUrl}/{@code catalogUrl} win over it. No URL at all means every catalog.
 */
public record CrawlSessionApiRequest(
    String url,
    String productUrl,
    String catalogUrl,
    String categoryName,
    Integer maxPages,
    Integer maxProducts
) {
    public CrawlJobRequest toJobRequest(CrawlerProperties.Site site) {
        String product = productUrl;
        String catalog = catalogUrl;
        if (isBlank(product) && isBlank(catalog) && !isBlank(url)) {
            TargetKind kind = TargetUrlClassifier.classify(url.trim(), site);
            switch (kind) {
                case PRODUCT -> product = url;
                case CATALOG -> catalog = url;
                case OTHER -> throw new IllegalArgumentException("url is neither a product nor a catalog page: " + url);
            }
        }
        requireAbsolute(product, "productUrl");
        requireAbsolute(catalog, "catalogUrl");
        return new CrawlJobRequest(product, catalog, categoryName, maxPages, maxProducts);
    }

    private static void requireAbsolute(String value, String field) {
        if (isBlank(value)) {
            return;
        }
        URI uri = TargetUrlClassifier.safeUri(value);
        if (uri == null || uri.getHost() == null) {
            throw new IllegalArgumentException(field + " must be an absolute http(s) URL");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
