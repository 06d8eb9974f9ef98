package com.catalogsync.crawl.service;

import com.catalogsync.config.CrawlerProperties;
import com.catalogsync.crawl.catalog.CatalogDiscovery;
import com.catalogsync.crawl.catalog.CatalogWalker;
import com.catalogsync.crawl.extract.ProductExtractor;
import com.catalogsync.crawl.http.PageFetcher;
import com.catalogsync.crawl.model.CatalogRef;
import com.catalogsync.crawl.model.CatalogWalkResult;
import com.catalogsync.crawl.model.CrawlJobRequest;
import com.catalogsync.crawl.model.CrawlMode;
import com.catalogsync.crawl.model.CrawlOutcome;
import com.catalogsync.crawl.model.CrawlSession;
import com.catalogsync.crawl.model.HttpFetchResult;
import com.catalogsync.crawl.model.PendingUrl;
import com.catalogsync.crawl.model.ProductRecord;
import com.catalogsync.crawl.model.SessionStatus;
import com.catalogsync.crawl.model.StoreOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one crawl session on the calling thread: collects product URLs, applies the confirmation
 * gate and ingests each product through the {@link StorageGateway}. Never throws; fatal problems
 * end the session as {@code error}.
 */
@Service
public class CrawlJobOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(CrawlJobOrchestrator.class);

    private final SessionStateMachine stateMachine;
    private final StorageGateway gateway;
    private final CatalogWalker walker;
    private final CatalogDiscovery discovery;
    private final PageFetcher fetcher;
    private final ProductExtractor extractor;
    private final CrawlerProperties properties;

    public CrawlJobOrchestrator(
        SessionStateMachine stateMachine,
        StorageGateway gateway,
        CatalogWalker walker,
        CatalogDiscovery discovery,
        PageFetcher fetcher,
        ProductExtractor extractor,
        CrawlerProperties properties
    ) {
        this.stateMachine = stateMachine;
        this.gateway = gateway;
        this.walker = walker;
        this.discovery = discovery;
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.properties = properties;
    }

    /**
     * Drives a session that is in {@code collecting_urls}. Returns once the session is terminal or
     * parked in {@code awaiting_confirmation}.
     */
    public CrawlOutcome run(CrawlJobRequest request, String sessionId, CancellationToken token) {
        CrawlMode mode = request.mode();
        IngestProgress progress = new IngestProgress();
        try {
            CrawlSession session = stateMachine.require(sessionId);
            if (session.status() != SessionStatus.COLLECTING_URLS) {
                throw new IllegalSessionTransitionException(sessionId, session.status(), SessionStatus.COLLECTING_URLS);
            }
            String category = defaultCategory(session, request);
            log.info("Session {} collecting urls mode={}", sessionId, mode);

            List<PendingUrl> pending = switch (mode) {
                case SINGLE_ITEM -> List.of(PendingUrl.bare(request.productUrl()));
                case ONE_CATALOG -> collectCatalog(request, token);
                case ALL_CATALOGS -> collectAllCatalogs(request, token);
            };

            progress.discovered = pending.size();
            if (token.isCanceled()) {
                return finishCanceled(sessionId, mode, pending.size(), 0, 0, "canceled while collecting urls");
            }
            int threshold = properties.getConfirmationThreshold();
            if (mode != CrawlMode.SINGLE_ITEM && pending.size() > threshold) {
                CrawlSession parked = stateMachine.awaitConfirmation(sessionId, pending, token);
                if (parked.status() == SessionStatus.CANCELED) {
                    log.info("Session {} canceled before it could be parked", sessionId);
                    return new CrawlOutcome(sessionId, mode, SessionStatus.CANCELED, pending.size(), 0, 0, parked.message());
                }
                log.info("Session {} parked with {} urls (threshold {})", sessionId, pending.size(), threshold);
                return new CrawlOutcome(
                    sessionId,
                    mode,
                    SessionStatus.AWAITING_CONFIRMATION,
                    pending.size(),
                    0,
                    0,
                    pending.size() + " products await confirmation"
                );
            }

            stateMachine.beginProcessing(sessionId, pending);
            return ingest(sessionId, mode, pending, category, token, progress);
        } catch (RuntimeException e) {
            return finishFailed(sessionId, mode, progress, e);
        }
    }

    /**
     * Processes the persisted pending URLs of a confirmed session, which must already be in
     * {@code parsing_products}.
     */
    public CrawlOutcome resume(String sessionId, CancellationToken token) {
        CrawlMode mode = CrawlMode.ONE_CATALOG;
        IngestProgress progress = new IngestProgress();
        try {
            CrawlSession session = stateMachine.require(sessionId);
            mode = modeOf(session.pendingUrls());
            if (session.status() != SessionStatus.PARSING_PRODUCTS) {
                throw new IllegalSessionTransitionException(sessionId, session.status(), SessionStatus.PARSING_PRODUCTS);
            }
            String category = session.categoryName() == null
                ? properties.getSite().getDefaultCategory()
                : session.categoryName();
            progress.discovered = session.pendingUrls().size();
            log.info("Session {} resumed with {} urls", sessionId, session.pendingUrls().size());
            return ingest(sessionId, mode, session.pendingUrls(), category, token, progress);
        } catch (RuntimeException e) {
            return finishFailed(sessionId, mode, progress, e);
        }
    }

    private List<PendingUrl> collectCatalog(CrawlJobRequest request, CancellationToken token) {
        CatalogWalkResult result = walker.walk(request.catalogUrl(), request.maxPages(), request.maxProducts(), token);
        log.info(
            "Catalog {} walked pages={} urls={} stop={}",
            request.catalogUrl(),
            result.pagesVisited(),
            result.productUrls().size(),
            result.stopReason()
        );
        List<PendingUrl> pending = new ArrayList<>(result.productUrls().size());
        for (String url : result.productUrls()) {
            pending.add(PendingUrl.bare(url));
        }
        return pending;
    }

    private List<PendingUrl> collectAllCatalogs(CrawlJobRequest request, CancellationToken token) {
        List<CatalogRef> catalogs = discovery.listCatalogs();
        Map<String, PendingUrl> byUrl = new LinkedHashMap<>();
        for (CatalogRef catalog : catalogs) {
            if (token.isCanceled()) {
                break;
            }
            Integer remaining = null;
            if (request.maxProducts() != null) {
                remaining = request.maxProducts() - byUrl.size();
                if (remaining <= 0) {
                    break;
                }
            }
            CatalogWalkResult result = walker.walk(catalog.url(), request.maxPages(), remaining, token);
            for (String url : result.productUrls()) {
                byUrl.putIfAbsent(url, PendingUrl.withCategory(url, catalog.name()));
            }
            log.info(
                "Catalog '{}' walked pages={} urls={} stop={} total={}",
                catalog.name(),
                result.pagesVisited(),
                result.productUrls().size(),
                result.stopReason(),
                byUrl.size()
            );
        }
        return new ArrayList<>(byUrl.values());
    }

    private CrawlOutcome ingest(
        String sessionId,
        CrawlMode mode,
        List<PendingUrl> pending,
        String defaultCategory,
        CancellationToken token,
        IngestProgress progress
    ) {
        int consecutiveStorageFailures = 0;
        int maxStorageFailures = properties.getMaxConsecutiveStorageFailures();

        for (PendingUrl item : pending) {
            if (token.isCanceled() || !politenessPause() || token.isCanceled()) {
                return finishCanceled(
                    sessionId,
                    mode,
                    pending.size(),
                    progress.saved,
                    progress.failed,
                    "canceled while parsing products"
                );
            }

            HttpFetchResult fetch = fetcher.fetch(item.url());
            if (fetch == null || !fetch.isSuccessful()) {
                progress.failed++;
                log.warn("Skipping {}: {}", item.url(), fetch == null ? "no result" : fetch.failureSummary());
                continue;
            }
            ProductRecord record = extractor.extract(fetch.body(), item.url(), item.resolveCategory(defaultCategory));
            if (record == null) {
                progress.failed++;
                log.warn("Skipping {}: nothing extracted", item.url());
                continue;
            }

            StoreOutcome outcome;
            try {
                outcome = gateway.saveProduct(record, token);
                consecutiveStorageFailures = 0;
            } catch (DataAccessException e) {
                progress.failed++;
                consecutiveStorageFailures++;
                log.warn("Storage failure for {} ({} in a row)", item.url(), consecutiveStorageFailures, e);
                if (maxStorageFailures > 0 && consecutiveStorageFailures >= maxStorageFailures) {
                    throw new StorageEscalationException(consecutiveStorageFailures, e);
                }
                continue;
            }
            switch (outcome) {
                case SAVED -> progress.saved++;
                case REJECTED -> progress.failed++;
                case CANCELED -> {
                    return finishCanceled(
                        sessionId,
                        mode,
                        pending.size(),
                        progress.saved,
                        progress.failed,
                        "canceled while saving " + item.url()
                    );
                }
            }
        }

        stateMachine.complete(sessionId, progress.saved, progress.failed);
        return new CrawlOutcome(
            sessionId,
            mode,
            SessionStatus.COMPLETE,
            pending.size(),
            progress.saved,
            progress.failed,
            "saved=" + progress.saved + " failed=" + progress.failed
        );
    }

    /**
     * @return false when the pause was interrupted, which counts as a cancel
     */
    private boolean politenessPause() {
        int delayMs = properties.getPolitenessDelayMs();
        if (delayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private CrawlOutcome finishCanceled(
        String sessionId,
        CrawlMode mode,
        int discovered,
        int saved,
        int failed,
        String reason
    ) {
        SessionStatus status = SessionStatus.CANCELED;
        try {
            stateMachine.cancel(sessionId, reason, saved, failed);
        } catch (IllegalSessionTransitionException e) {
            status = e.getFrom();
            log.info("Session {} already {} when cancel took effect", sessionId, status == null ? "gone" : status.dbValue());
        }
        return new CrawlOutcome(sessionId, mode, status, discovered, saved, failed, reason);
    }

    private CrawlOutcome finishFailed(String sessionId, CrawlMode mode, IngestProgress progress, RuntimeException error) {
        log.error("Crawl session {} failed", sessionId, error);
        String message = error.getClass().getSimpleName() + (error.getMessage() == null ? "" : ": " + error.getMessage());
        try {
            stateMachine.fail(sessionId, message, progress.saved, progress.failed);
        } catch (RuntimeException e) {
            log.warn("Could not mark session {} as error", sessionId, e);
        }
        try {
            gateway.cleanupIncomplete(sessionId);
        } catch (RuntimeException e) {
            log.warn("Cleanup after failed session {} did not run", sessionId, e);
        }
        return new CrawlOutcome(
            sessionId,
            mode,
            SessionStatus.ERROR,
            progress.discovered,
            progress.saved,
            progress.failed,
            message
        );
    }

    private String defaultCategory(CrawlSession session, CrawlJobRequest request) {
        if (session.categoryName() != null) {
            return session.categoryName();
        }
        return request.categoryOr(properties.getSite().getDefaultCategory());
    }

    private static CrawlMode modeOf(List<PendingUrl> pending) {
        for (PendingUrl item : pending) {
            if (item.category() != null) {
                return CrawlMode.ALL_CATALOGS;
            }
        }
        return CrawlMode.ONE_CATALOG;
    }

    // Counts survive a fatal failure so the error row still reports committed work.
    private static final class IngestProgress {
        private int discovered;
        private int saved;
        private int failed;
    }
}
