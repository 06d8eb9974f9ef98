package com.catalogsync.crawl.service;

import com.catalogsync.config.CrawlerProperties;
import com.catalogsync.crawl.model.CrawlSession;
import com.catalogsync.crawl.model.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;

/**
 * Sessions that were collecting or parsing when the previous process died have no worker left.
 * They are marked as errors on startup. Parked sessions stay parked.
 */
@Component
public class SessionRecoveryRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(SessionRecoveryRunner.class);

    private final StorageGateway gateway;
    private final SessionStateMachine stateMachine;
    private final CrawlerProperties properties;

    public SessionRecoveryRunner(StorageGateway gateway, SessionStateMachine stateMachine, CrawlerProperties properties) {
        this.gateway = gateway;
        this.stateMachine = stateMachine;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isRecoverOrphanedSessions()) {
            return;
        }
        recoverOrphanedSessions();
    }

    public int recoverOrphanedSessions() {
        boolean dbConnected;
        try {
            dbConnected = gateway.isDbReachable();
        } catch (Exception e) {
            dbConnected = false;
        }
        if (!dbConnected) {
            log.warn("Skipping session recovery because database is unreachable");
            return 0;
        }

        List<CrawlSession> orphaned = gateway.findSessions(
            EnumSet.of(SessionStatus.COLLECTING_URLS, SessionStatus.PARSING_PRODUCTS)
        );
        int recovered = 0;
        for (CrawlSession session : orphaned) {
            try {
                stateMachine.fail(session.id(), "orphaned_on_restart");
                recovered++;
                log.info("Marked orphaned session {} ({}) as error", session.id(), session.status().dbValue());
            } catch (IllegalSessionTransitionException | SessionNotFoundException e) {
                log.info("Session {} changed during recovery: {}", session.id(), e.getMessage());
            }
        }
        if (recovered > 0) {
            gateway.cleanupIncomplete("startup-recovery");
        }
        return recovered;
    }
}
