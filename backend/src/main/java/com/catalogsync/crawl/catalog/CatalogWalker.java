package com.catalogsync.crawl.catalog;

import com.catalogsync.config.CrawlerProperties;
import com.catalogsync.crawl.http.PageFetcher;
import com.catalogsync.crawl.model.CatalogWalkResult;
import com.catalogsync.crawl.model.CatalogWalkResult.StopReason;
import com.catalogsync.crawl.model.HttpFetchResult;
import com.catalogsync.crawl.service.CancellationToken;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Follows a paginated catalog listing and collects product URLs in discovery order. A page that
 * fails to load or has no listing ends the walk with whatever was collected so far.
 */
@Component
public class CatalogWalker {
    private static final Logger log = LoggerFactory.getLogger(CatalogWalker.class);

    private final PageFetcher fetcher;
    private final CrawlerProperties.Selectors selectors;

    public CatalogWalker(PageFetcher fetcher, CrawlerProperties properties) {
        this.fetcher = fetcher;
        this.selectors = properties.getSelectors();
    }

    public CatalogWalkResult walk(String catalogUrl, Integer maxPages, Integer maxProducts, CancellationToken token) {
        Set<String> collected = new LinkedHashSet<>();
        Set<String> visitedPages = new HashSet<>();
        String pageUrl = catalogUrl;
        int pagesVisited = 0;

        while (true) {
            if (token != null && token.isCanceled()) {
                return result(collected, pagesVisited, StopReason.CANCELED);
            }
            if (maxPages != null && pagesVisited >= maxPages) {
                return result(collected, pagesVisited, StopReason.MAX_PAGES);
            }
            visitedPages.add(pageUrl);

            HttpFetchResult fetch = fetcher.fetch(pageUrl);
            if (fetch == null || !fetch.isSuccessful() || fetch.body() == null) {
                log.warn("Catalog page {} could not be fetched: {}", pageUrl, fetch == null ? "no result" : fetch.failureSummary());
                return result(collected, pagesVisited, StopReason.FETCH_FAILED);
            }
            Document doc = Jsoup.parse(fetch.body(), fetch.finalUrlOrRequested());
            Elements rows = listingRows(doc);
            if (rows.isEmpty()) {
                log.info("Catalog page {} has no listing rows", pageUrl);
                return result(collected, pagesVisited, StopReason.NO_ROWS);
            }

            for (Element row : rows) {
                Element link = row.selectFirst(selectors.getListingTitleLink());
                if (link == null) {
                    continue;
                }
                String productUrl = link.absUrl("href");
                if (productUrl.isBlank() || !collected.add(productUrl)) {
                    continue;
                }
                if (maxProducts != null && collected.size() >= maxProducts) {
                    return result(collected, pagesVisited + 1, StopReason.MAX_PRODUCTS);
                }
            }
            pagesVisited++;
            log.debug("Catalog page {} done, {} urls so far", pageUrl, collected.size());

            String nextUrl = nextPageUrl(doc);
            if (nextUrl == null || visitedPages.contains(nextUrl)) {
                return result(collected, pagesVisited, StopReason.NO_NEXT_PAGE);
            }
            pageUrl = nextUrl;
        }
    }

    private Elements listingRows(Document doc) {
        Element table = doc.selectFirst(selectors.getListingTable());
        if (table == null) {
            table = doc.selectFirst("table");
        }
        if (table == null) {
            return new Elements();
        }
        return table.select(selectors.getListingRow());
    }

    private String nextPageUrl(Document doc) {
        Element next = doc.selectFirst(selectors.getNextPageLink());
        if (next == null) {
            return null;
        }
        String href = next.absUrl("href");
        return href.isBlank() ? null : href;
    }

    private static CatalogWalkResult result(Set<String> collected, int pagesVisited, StopReason reason) {
        return new CatalogWalkResult(new ArrayList<>(collected), pagesVisited, reason);
    }
}
