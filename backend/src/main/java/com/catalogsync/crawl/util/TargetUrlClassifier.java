package com.catalogsync.crawl.util;

import com.catalogsync.config.CrawlerProperties;
import com.catalogsync.crawl.model.TargetKind;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

public final class TargetUrlClassifier {

    private TargetUrlClassifier() {
    }

    public static TargetKind classify(String url, CrawlerProperties.Site site) {
        URI uri = safeUri(url);
        if (uri == null || uri.getHost() == null) {
            return TargetKind.OTHER;
        }
        String path = (uri.getPath() == null ? "" : uri.getPath()).toLowerCase(Locale.ROOT);
        if (containsMarker(path, site.getProductPathMarker())) {
            return TargetKind.PRODUCT;
        }
        if (containsMarker(path, site.getCatalogPathMarker())) {
            return TargetKind.CATALOG;
        }
        return TargetKind.OTHER;
    }

    public static URI safeUri(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            return new URI(url.trim());
        } catch (URISyntaxException ignored) {
            return null;
        }
    }

    private static boolean containsMarker(String path, String marker) {
        return marker != null && !marker.isBlank() && path.contains(marker.toLowerCase(Locale.ROOT));
    }
}
