package com.catalogsync.crawl.service;

import com.catalogsync.config.CrawlerProperties;
import com.catalogsync.crawl.model.CrawlJobRequest;
import com.catalogsync.crawl.model.CrawlOutcome;
import com.catalogsync.crawl.model.CrawlSession;
import com.catalogsync.crawl.model.SessionPhase;
import com.catalogsync.crawl.model.SessionStartResponse;
import com.catalogsync.crawl.model.SessionStatus;
import com.catalogsync.crawl.model.SessionStatusView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Starts crawl sessions on their own worker and carries the operator's confirm, decline, cancel
 * and status requests. Owns the cancellation registry.
 */
@Service
public class CrawlJobLauncher {
    private static final Logger log = LoggerFactory.getLogger(CrawlJobLauncher.class);

    private final CrawlJobOrchestrator orchestrator;
    private final SessionStateMachine stateMachine;
    private final StorageGateway gateway;
    private final Executor sessionExecutor;
    private final CrawlerProperties properties;
    private final CancellationRegistry registry = new CancellationRegistry();

    public CrawlJobLauncher(
        CrawlJobOrchestrator orchestrator,
        SessionStateMachine stateMachine,
        StorageGateway gateway,
        @Qualifier("crawlSessionExecutor") Executor sessionExecutor,
        CrawlerProperties properties
    ) {
        this.orchestrator = orchestrator;
        this.stateMachine = stateMachine;
        this.gateway = gateway;
        this.sessionExecutor = sessionExecutor;
        this.properties = properties;
    }

    public SessionStartResponse start(CrawlJobRequest request) {
        String sessionId = UUID.randomUUID().toString();
        stateMachine.start(sessionId, request.categoryOr(properties.getSite().getDefaultCategory()));
        CancellationToken token = registry.register(sessionId);
        sessionExecutor.execute(() -> runWorker(sessionId, () -> orchestrator.run(request, sessionId, token)));
        String status = stateMachine.find(sessionId)
            .map(session -> session.status().dbValue())
            .orElse(SessionStatus.COLLECTING_URLS.dbValue());
        return new SessionStartResponse(sessionId, request.mode(), status);
    }

    /**
     * Resumes ingestion of a parked session on a new worker with a fresh cancellation token.
     *
     * @return false unless the session was awaiting confirmation
     */
    public boolean confirm(String sessionId) {
        stateMachine.require(sessionId);
        Optional<CancellationToken> resumed = gateway.withWriteTransaction(() -> {
            CrawlSession session = stateMachine.require(sessionId);
            if (session.status() != SessionStatus.AWAITING_CONFIRMATION) {
                return Optional.<CancellationToken>empty();
            }
            if (registry.isCanceled(sessionId)) {
                // a cancel flagged the parked token but has not finalized the row yet
                stateMachine.transitionIfIn(
                    sessionId,
                    SessionStatus.AWAITING_CONFIRMATION,
                    SessionStatus.CANCELED,
                    SessionPhase.DONE,
                    List.of(),
                    "canceled by operator"
                );
                registry.release(sessionId);
                return Optional.<CancellationToken>empty();
            }
            stateMachine.transitionIfIn(
                sessionId,
                SessionStatus.AWAITING_CONFIRMATION,
                SessionStatus.PARSING_PRODUCTS,
                SessionPhase.PARSING_PRODUCTS,
                null,
                "confirmed by operator"
            );
            registry.release(sessionId);
            return Optional.of(registry.register(sessionId));
        });
        if (resumed.isEmpty()) {
            return false;
        }
        CancellationToken token = resumed.get();
        sessionExecutor.execute(() -> runWorker(sessionId, () -> orchestrator.resume(sessionId, token)));
        return true;
    }

    /**
     * @return false unless the session was awaiting confirmation
     */
    public boolean decline(String sessionId) {
        stateMachine.require(sessionId);
        Optional<CrawlSession> moved = stateMachine.transitionIfIn(
            sessionId,
            SessionStatus.AWAITING_CONFIRMATION,
            SessionStatus.CANCELED,
            SessionPhase.DONE,
            List.of(),
            "declined by operator"
        );
        if (moved.isEmpty()) {
            return false;
        }
        registry.release(sessionId);
        gateway.cleanupIncomplete(sessionId);
        return true;
    }

    /**
     * Requests a stop at the worker's next checkpoint. A parked session has no worker and is
     * finalized here. The flag is set before the parked check, so a worker that parks after this
     * call sees it inside its own write transaction.
     *
     * @return false when the session is already terminal or has no live worker
     */
    public boolean cancel(String sessionId) {
        CrawlSession session = stateMachine.require(sessionId);
        if (session.status().isTerminal()) {
            return false;
        }
        boolean flagged = registry.cancel(sessionId);
        Optional<CrawlSession> finalized = stateMachine.transitionIfIn(
            sessionId,
            SessionStatus.AWAITING_CONFIRMATION,
            SessionStatus.CANCELED,
            SessionPhase.DONE,
            List.of(),
            "canceled by operator"
        );
        if (finalized.isPresent()) {
            registry.release(sessionId);
            log.info("Parked session {} canceled", sessionId);
            return true;
        }
        if (flagged) {
            log.info("Cancel requested for session {}", sessionId);
        } else {
            log.warn("Cancel for session {} ignored, no worker is registered", sessionId);
        }
        return flagged;
    }

    public SessionStatusView getStatus(String sessionId) {
        return SessionStatusView.of(stateMachine.require(sessionId));
    }

    boolean isRegistered(String sessionId) {
        return registry.isRegistered(sessionId);
    }

    private void runWorker(String sessionId, Supplier<CrawlOutcome> work) {
        try {
            CrawlOutcome outcome = work.get();
            log.info(
                "Session {} worker finished status={} urls={} saved={} failed={}",
                sessionId,
                outcome.status().dbValue(),
                outcome.urlsDiscovered(),
                outcome.productsSaved(),
                outcome.productsFailed()
            );
            if (outcome.status().isTerminal()) {
                registry.release(sessionId);
            }
        } catch (RuntimeException e) {
            log.error("Session {} worker crashed", sessionId, e);
            registry.release(sessionId);
        }
    }
}
