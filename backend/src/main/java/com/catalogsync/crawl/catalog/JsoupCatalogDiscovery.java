package com.catalogsync.crawl.catalog;

import com.catalogsync.config.CrawlerProperties;
import com.catalogsync.crawl.http.PageFetcher;
import com.catalogsync.crawl.model.CatalogRef;
import com.catalogsync.crawl.model.HttpFetchResult;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads the catalog menu on the site's front page.
 */
@Service
public class JsoupCatalogDiscovery implements CatalogDiscovery {
    private static final Logger log = LoggerFactory.getLogger(JsoupCatalogDiscovery.class);

    private final PageFetcher fetcher;
    private final CrawlerProperties properties;

    public JsoupCatalogDiscovery(PageFetcher fetcher, CrawlerProperties properties) {
        this.fetcher = fetcher;
        this.properties = properties;
    }

    @Override
    public List<CatalogRef> listCatalogs() {
        String baseUrl = properties.getSite().getBaseUrl();
        HttpFetchResult fetch = fetcher.fetch(baseUrl);
        if (fetch == null || !fetch.isSuccessful() || fetch.body() == null) {
            log.warn("Catalog menu at {} unavailable: {}", baseUrl, fetch == null ? "no result" : fetch.failureSummary());
            return List.of();
        }
        Document doc = Jsoup.parse(fetch.body(), fetch.finalUrlOrRequested());
        List<CatalogRef> catalogs = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (Element link : doc.select(properties.getSelectors().getCatalogMenuLink())) {
            String url = link.absUrl("href");
            String name = link.text().trim();
            if (url.isBlank() || name.isEmpty() || !seen.add(url)) {
                continue;
            }
            catalogs.add(new CatalogRef(name, url));
        }
        log.info("Discovered {} catalogs at {}", catalogs.size(), baseUrl);
        return catalogs;
    }
}
