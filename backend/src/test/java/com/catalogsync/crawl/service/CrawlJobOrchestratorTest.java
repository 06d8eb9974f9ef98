package com.catalogsync.crawl.service;

import com.catalogsync.config.CrawlerProperties;
import com.catalogsync.crawl.CatalogFixtures;
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
import com.catalogsync.crawl.model.PendingUrl;
import com.catalogsync.crawl.model.ProductRecord;
import com.catalogsync.crawl.model.SessionStatus;
import com.catalogsync.crawl.model.StoreOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CrawlJobOrchestratorTest {
    private static final String SESSION = "session-1";
    private static final String CATALOG = CatalogFixtures.HOST + "/collection/alize";

    @Mock
    private SessionStateMachine stateMachine;
    @Mock
    private StorageGateway gateway;
    @Mock
    private CatalogWalker walker;
    @Mock
    private CatalogDiscovery discovery;
    @Mock
    private PageFetcher fetcher;
    @Mock
    private ProductExtractor extractor;

    private CrawlerProperties properties;
    private CrawlJobOrchestrator orchestrator;
    private CancellationRegistry registry;
    private CancellationToken token;

    @BeforeEach
    void setUp() {
        properties = new CrawlerProperties();
        properties.setPolitenessDelayMs(0);
        orchestrator = new CrawlJobOrchestrator(stateMachine, gateway, walker, discovery, fetcher, extractor, properties);
        registry = new CancellationRegistry();
        token = registry.register(SESSION);
    }

    @Test
    void sixUrlsParkTheSessionWithoutWrites() {
        givenSession(SessionStatus.COLLECTING_URLS, List.of());
        when(walker.walk(CATALOG, null, null, token)).thenReturn(walk(6));
        when(stateMachine.awaitConfirmation(eq(SESSION), any(), eq(token)))
            .thenReturn(session(SessionStatus.AWAITING_CONFIRMATION, List.of()));

        CrawlOutcome outcome = orchestrator.run(catalogRequest(), SESSION, token);

        assertThat(outcome.status()).isEqualTo(SessionStatus.AWAITING_CONFIRMATION);
        assertThat(outcome.urlsDiscovered()).isEqualTo(6);
        verify(stateMachine).awaitConfirmation(eq(SESSION), pendingOfSize(6), eq(token));
        verify(stateMachine, never()).beginProcessing(anyString(), any());
        verify(fetcher, never()).fetch(anyString());
        verify(gateway, never()).saveProduct(any(), any());
    }

    @Test
    void fiveUrlsAreIngestedWithoutConfirmation() {
        givenSession(SessionStatus.COLLECTING_URLS, List.of());
        when(walker.walk(CATALOG, null, null, token)).thenReturn(walk(5));
        givenEveryPageExtracts();
        when(gateway.saveProduct(any(), eq(token))).thenReturn(StoreOutcome.SAVED);

        CrawlOutcome outcome = orchestrator.run(catalogRequest(), SESSION, token);

        assertThat(outcome.status()).isEqualTo(SessionStatus.COMPLETE);
        assertThat(outcome.productsSaved()).isEqualTo(5);
        assertThat(outcome.success()).isTrue();
        verify(stateMachine).beginProcessing(eq(SESSION), pendingOfSize(5));
        verify(stateMachine, never()).awaitConfirmation(anyString(), any(), any());
        verify(stateMachine).complete(SESSION, 5, 0);
    }

    @Test
    void singleItemWithNothingExtractedStillCompletes() {
        givenSession(SessionStatus.COLLECTING_URLS, List.of());
        String url = CatalogFixtures.HOST + "/products/a";
        when(fetcher.fetch(url)).thenReturn(CatalogFixtures.ok(url, "<html></html>"));
        when(extractor.extract(anyString(), eq(url), eq("Пряжа"))).thenReturn(null);

        CrawlOutcome outcome = orchestrator.run(new CrawlJobRequest(url, null, null, null, null), SESSION, token);

        assertThat(outcome.mode()).isEqualTo(CrawlMode.SINGLE_ITEM);
        assertThat(outcome.status()).isEqualTo(SessionStatus.COMPLETE);
        assertThat(outcome.productsFailed()).isEqualTo(1);
        verify(stateMachine).beginProcessing(eq(SESSION), pendingOfSize(1));
        verify(stateMachine).complete(SESSION, 0, 1);
        verify(gateway, never()).saveProduct(any(), any());
    }

    @Test
    void networkFailuresAndRejectedRecordsAreCountedAndSkipped() {
        givenSession(SessionStatus.COLLECTING_URLS, List.of());
        when(walker.walk(CATALOG, null, null, token)).thenReturn(walk(3));
        String broken = productUrl(0);
        when(fetcher.fetch(anyString())).thenAnswer(invocation -> {
            String url = invocation.getArgument(0);
            return url.equals(broken) ? CatalogFixtures.ioError(url) : CatalogFixtures.ok(url, "<html></html>");
        });
        when(extractor.extract(anyString(), anyString(), anyString()))
            .thenAnswer(invocation -> record(invocation.getArgument(1)));
        when(gateway.saveProduct(any(), eq(token))).thenReturn(StoreOutcome.REJECTED, StoreOutcome.SAVED);

        CrawlOutcome outcome = orchestrator.run(catalogRequest(), SESSION, token);

        assertThat(outcome.status()).isEqualTo(SessionStatus.COMPLETE);
        verify(stateMachine).complete(SESSION, 1, 2);
    }

    @Test
    void consecutiveStorageFailuresEscalateToErrorKeepingCounts() {
        givenSession(SessionStatus.COLLECTING_URLS, List.of());
        when(walker.walk(CATALOG, null, null, token)).thenReturn(walk(5));
        givenEveryPageExtracts();
        when(gateway.saveProduct(any(), eq(token)))
            .thenReturn(StoreOutcome.SAVED)
            .thenThrow(new DataAccessResourceFailureException("db down"));

        CrawlOutcome outcome = orchestrator.run(catalogRequest(), SESSION, token);

        assertThat(outcome.status()).isEqualTo(SessionStatus.ERROR);
        assertThat(outcome.message()).startsWith("StorageEscalationException");
        assertThat(outcome.urlsDiscovered()).isEqualTo(5);
        assertThat(outcome.productsSaved()).isEqualTo(1);
        assertThat(outcome.productsFailed()).isEqualTo(3);
        verify(gateway, times(4)).saveProduct(any(), eq(token));
        verify(stateMachine).fail(eq(SESSION), anyString(), eq(1), eq(3));
        verify(gateway).cleanupIncomplete(SESSION);
        verify(stateMachine, never()).complete(anyString(), anyInt(), anyInt());
    }

    @Test
    void isolatedStorageFailureIsSkipped() {
        givenSession(SessionStatus.COLLECTING_URLS, List.of());
        when(walker.walk(CATALOG, null, null, token)).thenReturn(walk(3));
        givenEveryPageExtracts();
        when(gateway.saveProduct(any(), eq(token)))
            .thenThrow(new DataAccessResourceFailureException("blip"))
            .thenReturn(StoreOutcome.SAVED);

        CrawlOutcome outcome = orchestrator.run(catalogRequest(), SESSION, token);

        assertThat(outcome.status()).isEqualTo(SessionStatus.COMPLETE);
        verify(stateMachine).complete(SESSION, 2, 1);
        verify(gateway, never()).cleanupIncomplete(anyString());
    }

    @Test
    void cancelMidIngestionStopsBeforeTheNextFetch() {
        givenSession(SessionStatus.COLLECTING_URLS, List.of());
        when(walker.walk(CATALOG, null, null, token)).thenReturn(walk(4));
        givenEveryPageExtracts();
        when(gateway.saveProduct(any(), eq(token))).thenAnswer(invocation -> {
            registry.cancel(SESSION);
            return StoreOutcome.SAVED;
        });

        CrawlOutcome outcome = orchestrator.run(catalogRequest(), SESSION, token);

        assertThat(outcome.status()).isEqualTo(SessionStatus.CANCELED);
        assertThat(outcome.productsSaved()).isEqualTo(1);
        verify(fetcher, times(1)).fetch(anyString());
        verify(stateMachine).cancel(eq(SESSION), anyString(), eq(1), eq(0));
        verify(stateMachine, never()).complete(anyString(), anyInt(), anyInt());
    }

    @Test
    void cancelDuringVariantWritesEndsCanceled() {
        givenSession(SessionStatus.COLLECTING_URLS, List.of());
        when(walker.walk(CATALOG, null, null, token)).thenReturn(walk(2));
        givenEveryPageExtracts();
        when(gateway.saveProduct(any(), eq(token))).thenReturn(StoreOutcome.CANCELED);

        CrawlOutcome outcome = orchestrator.run(catalogRequest(), SESSION, token);

        assertThat(outcome.status()).isEqualTo(SessionStatus.CANCELED);
        verify(stateMachine).cancel(eq(SESSION), anyString(), eq(0), eq(0));
    }

    @Test
    void cancelWhileCollectingSkipsTheGate() {
        givenSession(SessionStatus.COLLECTING_URLS, List.of());
        when(walker.walk(CATALOG, null, null, token)).thenAnswer(invocation -> {
            registry.cancel(SESSION);
            return new CatalogWalkResult(List.of(productUrl(0)), 1, CatalogWalkResult.StopReason.CANCELED);
        });

        CrawlOutcome outcome = orchestrator.run(catalogRequest(), SESSION, token);

        assertThat(outcome.status()).isEqualTo(SessionStatus.CANCELED);
        verify(stateMachine).cancel(eq(SESSION), anyString(), eq(0), eq(0));
        verify(stateMachine, never()).beginProcessing(anyString(), any());
        verify(fetcher, never()).fetch(anyString());
    }

    @Test
    void cancelThatLandsWhileParkingEndsCanceled() {
        givenSession(SessionStatus.COLLECTING_URLS, List.of());
        when(walker.walk(CATALOG, null, null, token)).thenReturn(walk(6));
        when(stateMachine.awaitConfirmation(eq(SESSION), any(), eq(token)))
            .thenReturn(session(SessionStatus.CANCELED, List.of()));

        CrawlOutcome outcome = orchestrator.run(catalogRequest(), SESSION, token);

        assertThat(outcome.status()).isEqualTo(SessionStatus.CANCELED);
        assertThat(outcome.urlsDiscovered()).isEqualTo(6);
        verify(stateMachine, never()).beginProcessing(anyString(), any());
        verify(fetcher, never()).fetch(anyString());
    }

    @Test
    void allCatalogsDedupeAcrossCatalogsAndShareTheProductLimit() {
        givenSession(SessionStatus.COLLECTING_URLS, List.of());
        properties.setConfirmationThreshold(100);
        CatalogRef alize = new CatalogRef("Alize", CATALOG);
        CatalogRef yarnArt = new CatalogRef("YarnArt", CatalogFixtures.HOST + "/collection/yarnart");
        CatalogRef extra = new CatalogRef("Extra", CatalogFixtures.HOST + "/collection/extra");
        when(discovery.listCatalogs()).thenReturn(List.of(alize, yarnArt, extra));
        when(walker.walk(alize.url(), null, 3, token))
            .thenReturn(new CatalogWalkResult(List.of(productUrl(0), productUrl(1)), 1, CatalogWalkResult.StopReason.NO_NEXT_PAGE));
        when(walker.walk(yarnArt.url(), null, 1, token))
            .thenReturn(new CatalogWalkResult(List.of(productUrl(1), productUrl(2)), 1, CatalogWalkResult.StopReason.NO_NEXT_PAGE));
        givenEveryPageExtracts();
        when(gateway.saveProduct(any(), eq(token))).thenReturn(StoreOutcome.SAVED);

        CrawlOutcome outcome = orchestrator.run(new CrawlJobRequest(null, null, null, null, 3), SESSION, token);

        assertThat(outcome.mode()).isEqualTo(CrawlMode.ALL_CATALOGS);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<PendingUrl>> pending = ArgumentCaptor.forClass(List.class);
        verify(stateMachine).beginProcessing(eq(SESSION), pending.capture());
        assertThat(pending.getValue()).containsExactly(
            PendingUrl.withCategory(productUrl(0), "Alize"),
            PendingUrl.withCategory(productUrl(1), "Alize"),
            PendingUrl.withCategory(productUrl(2), "YarnArt")
        );
        verify(walker, never()).walk(eq(extra.url()), any(), any(), any());
        verify(extractor).extract(anyString(), eq(productUrl(2)), eq("YarnArt"));
    }

    @Test
    void resumeProcessesPersistedPendingUrls() {
        List<PendingUrl> pending = List.of(PendingUrl.bare(productUrl(0)), PendingUrl.bare(productUrl(1)));
        givenSession(SessionStatus.PARSING_PRODUCTS, pending);
        givenEveryPageExtracts();
        when(gateway.saveProduct(any(), eq(token))).thenReturn(StoreOutcome.SAVED);

        CrawlOutcome outcome = orchestrator.resume(SESSION, token);

        assertThat(outcome.status()).isEqualTo(SessionStatus.COMPLETE);
        verify(extractor).extract(anyString(), eq(productUrl(0)), eq("Пряжа"));
        verify(stateMachine).complete(SESSION, 2, 0);
    }

    @Test
    void sessionInWrongStateFailsTheRun() {
        givenSession(SessionStatus.COMPLETE, List.of());

        CrawlOutcome outcome = orchestrator.resume(SESSION, token);

        assertThat(outcome.status()).isEqualTo(SessionStatus.ERROR);
        assertThat(outcome.message()).startsWith("IllegalSessionTransitionException");
        verify(fetcher, never()).fetch(anyString());
        verify(gateway).cleanupIncomplete(SESSION);
    }

    @Test
    void unexpectedCollectorFailureMarksErrorAndCleansUp() {
        givenSession(SessionStatus.COLLECTING_URLS, List.of());
        when(walker.walk(CATALOG, null, null, token)).thenThrow(new IllegalStateException("selector exploded"));

        CrawlOutcome outcome = orchestrator.run(catalogRequest(), SESSION, token);

        assertThat(outcome.status()).isEqualTo(SessionStatus.ERROR);
        verify(stateMachine).fail(SESSION, "IllegalStateException: selector exploded", 0, 0);
        verify(gateway).cleanupIncomplete(SESSION);
    }

    private void givenSession(SessionStatus status, List<PendingUrl> pending) {
        when(stateMachine.require(SESSION)).thenReturn(session(status, pending));
    }

    private static CrawlSession session(SessionStatus status, List<PendingUrl> pending) {
        Instant now = Instant.now();
        return new CrawlSession(SESSION, status, status.dbValue(), pending, "Пряжа", 0, 0, null, now, now);
    }

    private void givenEveryPageExtracts() {
        when(fetcher.fetch(anyString())).thenAnswer(invocation -> CatalogFixtures.ok(invocation.getArgument(0), "<html></html>"));
        when(extractor.extract(anyString(), anyString(), anyString()))
            .thenAnswer(invocation -> record(invocation.getArgument(1)));
    }

    private static CrawlJobRequest catalogRequest() {
        return new CrawlJobRequest(null, CATALOG, null, null, null);
    }

    private static CatalogWalkResult walk(int count) {
        List<String> urls = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            urls.add(productUrl(i));
        }
        return new CatalogWalkResult(urls, 1, CatalogWalkResult.StopReason.NO_NEXT_PAGE);
    }

    private static String productUrl(int index) {
        return CatalogFixtures.HOST + "/products/item-" + index;
    }

    private static ProductRecord record(String url) {
        return new ProductRecord(url, "Title " + url, "1", null, null, null, null, "Пряжа", null, null, Instant.now(), List.of());
    }

    private static List<PendingUrl> pendingOfSize(int size) {
        return argThat(list -> list != null && list.size() == size);
    }
}
