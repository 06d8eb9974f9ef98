package com.catalogsync.crawl.service;

import com.catalogsync.crawl.model.CrawlSession;
import com.catalogsync.crawl.model.PendingUrl;
import com.catalogsync.crawl.model.SessionPhase;
import com.catalogsync.crawl.model.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Authoritative lifecycle of a crawl session. Each transition reads the row, validates the edge and
 * writes the new row inside one write transaction.
 */
@Service
public class SessionStateMachine {
    private static final Logger log = LoggerFactory.getLogger(SessionStateMachine.class);

    private final StorageGateway gateway;

    public SessionStateMachine(StorageGateway gateway) {
        this.gateway = gateway;
    }

    public CrawlSession start(String sessionId, String categoryName) {
        return gateway.withWriteTransaction(() -> {
            Optional<CrawlSession> existing = gateway.findSession(sessionId);
            if (existing.isPresent()) {
                throw new IllegalSessionTransitionException(
                    sessionId,
                    existing.get().status(),
                    SessionStatus.COLLECTING_URLS
                );
            }
            Instant now = Instant.now();
            CrawlSession session = new CrawlSession(
                sessionId,
                SessionStatus.COLLECTING_URLS,
                SessionPhase.COLLECTING_URLS.label(),
                List.of(),
                categoryName,
                0,
                0,
                null,
                now,
                now
            );
            gateway.saveSessionStatus(session);
            log.info("Session {} started category={}", sessionId, categoryName);
            return session;
        });
    }

    /**
     * Parks the session for operator confirmation. A cancel that arrived before the park is
     * honored here, inside the same write transaction, and the session ends {@code canceled}.
     */
    public CrawlSession awaitConfirmation(String sessionId, List<PendingUrl> pendingUrls, CancellationToken token) {
        return gateway.withWriteTransaction(() -> {
            CrawlSession current = require(sessionId);
            if (token.isCanceled()) {
                return apply(current, SessionStatus.CANCELED, SessionPhase.DONE, List.of(), "canceled while collecting urls");
            }
            return apply(
                current,
                SessionStatus.AWAITING_CONFIRMATION,
                SessionPhase.AWAITING_CONFIRMATION,
                pendingUrls,
                pendingUrls.size() + " products await confirmation"
            );
        });
    }

    public CrawlSession beginProcessing(String sessionId, List<PendingUrl> pendingUrls) {
        return transition(
            sessionId,
            SessionStatus.PARSING_PRODUCTS,
            SessionPhase.PARSING_PRODUCTS,
            pendingUrls,
            null
        );
    }

    public CrawlSession complete(String sessionId, int saved, int failed) {
        String message = "saved=" + saved + " failed=" + failed;
        return gateway.withWriteTransaction(() -> {
            CrawlSession current = require(sessionId);
            checkEdge(current, SessionStatus.COMPLETE);
            CrawlSession next = current
                .withTransition(SessionStatus.COMPLETE, SessionPhase.DONE, List.of(), message, Instant.now())
                .withCounts(saved, failed);
            gateway.saveSessionStatus(next);
            log.info("Session {} complete {}", sessionId, message);
            return next;
        });
    }

    public CrawlSession cancel(String sessionId, String reason, int saved, int failed) {
        return gateway.withWriteTransaction(() -> {
            CrawlSession current = require(sessionId);
            checkEdge(current, SessionStatus.CANCELED);
            CrawlSession next = current
                .withTransition(SessionStatus.CANCELED, SessionPhase.DONE, List.of(), reason, Instant.now())
                .withCounts(saved, failed);
            gateway.saveSessionStatus(next);
            log.info("Session {} canceled: {}", sessionId, reason);
            return next;
        });
    }

    public CrawlSession fail(String sessionId, String message) {
        return transition(sessionId, SessionStatus.ERROR, SessionPhase.DONE, List.of(), message);
    }

    public CrawlSession fail(String sessionId, String message, int saved, int failed) {
        return gateway.withWriteTransaction(() -> {
            CrawlSession current = require(sessionId);
            checkEdge(current, SessionStatus.ERROR);
            CrawlSession next = current
                .withTransition(SessionStatus.ERROR, SessionPhase.DONE, List.of(), message, Instant.now())
                .withCounts(saved, failed);
            gateway.saveSessionStatus(next);
            log.info("Session {} failed: {}", sessionId, message);
            return next;
        });
    }

    /**
     * Applies the transition only when the session currently sits in {@code expected}.
     *
     * @return the new session, or empty when the session is in some other state
     */
    public Optional<CrawlSession> transitionIfIn(
        String sessionId,
        SessionStatus expected,
        SessionStatus next,
        SessionPhase phase,
        List<PendingUrl> pendingUrls,
        String message
    ) {
        return gateway.withWriteTransaction(() -> {
            CrawlSession current = require(sessionId);
            if (current.status() != expected) {
                return Optional.<CrawlSession>empty();
            }
            return Optional.of(apply(current, next, phase, pendingUrls, message));
        });
    }

    public Optional<CrawlSession> find(String sessionId) {
        return gateway.findSession(sessionId);
    }

    public CrawlSession require(String sessionId) {
        return gateway.findSession(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    private CrawlSession transition(
        String sessionId,
        SessionStatus next,
        SessionPhase phase,
        List<PendingUrl> pendingUrls,
        String message
    ) {
        return gateway.withWriteTransaction(() -> apply(require(sessionId), next, phase, pendingUrls, message));
    }

    private CrawlSession apply(
        CrawlSession current,
        SessionStatus next,
        SessionPhase phase,
        List<PendingUrl> pendingUrls,
        String message
    ) {
        checkEdge(current, next);
        CrawlSession updated = current.withTransition(next, phase, pendingUrls, message, Instant.now());
        gateway.saveSessionStatus(updated);
        log.info("Session {} {} -> {}", current.id(), current.status().dbValue(), next.dbValue());
        return updated;
    }

    private void checkEdge(CrawlSession current, SessionStatus next) {
        if (!current.status().canTransitionTo(next)) {
            throw new IllegalSessionTransitionException(current.id(), current.status(), next);
        }
    }
}
