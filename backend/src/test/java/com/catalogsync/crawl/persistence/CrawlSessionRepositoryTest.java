package com.catalogsync.crawl.persistence;

import com.catalogsync.crawl.model.CrawlSession;
import com.catalogsync.crawl.model.PendingUrl;
import com.catalogsync.crawl.model.SessionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
class CrawlSessionRepositoryTest {

    @Autowired
    private CrawlSessionRepository repository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanSessions() {
        jdbcTemplate.update("DELETE FROM crawl_sessions");
    }

    @Test
    void pendingUrlsSurviveTheJsonColumn() {
        List<PendingUrl> pending = List.of(
            PendingUrl.bare("https://shop.test/products/a"),
            PendingUrl.withCategory("https://shop.test/products/b", "Пехорка")
        );
        repository.upsert(session("s-1", SessionStatus.AWAITING_CONFIRMATION, pending, null));

        CrawlSession stored = repository.findById("s-1").orElseThrow();

        assertThat(stored.pendingUrls()).containsExactlyElementsOf(pending);
        assertThat(stored.status()).isEqualTo(SessionStatus.AWAITING_CONFIRMATION);
    }

    @Test
    void longMessagesAreTruncated() {
        repository.upsert(session("s-2", SessionStatus.ERROR, List.of(), "e".repeat(1500)));

        assertThat(repository.findById("s-2").orElseThrow().message()).hasSize(1000);
    }

    @Test
    void updateKeepsCreatedAt() {
        CrawlSession first = session("s-3", SessionStatus.COLLECTING_URLS, List.of(), null);
        repository.upsert(first);
        Instant createdAt = repository.findById("s-3").orElseThrow().createdAt();

        Instant later = Instant.now().plus(1, ChronoUnit.HOURS);
        repository.upsert(new CrawlSession(
            "s-3", SessionStatus.PARSING_PRODUCTS, "parsing_products", List.of(), null, 0, 0, null, later, later
        ));

        CrawlSession stored = repository.findById("s-3").orElseThrow();
        assertThat(stored.createdAt()).isEqualTo(createdAt);
        assertThat(stored.status()).isEqualTo(SessionStatus.PARSING_PRODUCTS);
    }

    @Test
    void findByStatusesFiltersRows() {
        repository.upsert(session("a", SessionStatus.COLLECTING_URLS, List.of(), null));
        repository.upsert(session("b", SessionStatus.COMPLETE, List.of(), null));
        repository.upsert(session("c", SessionStatus.PARSING_PRODUCTS, List.of(), null));

        assertThat(repository.findByStatuses(EnumSet.of(SessionStatus.COLLECTING_URLS, SessionStatus.PARSING_PRODUCTS)))
            .extracting(CrawlSession::id)
            .containsExactlyInAnyOrder("a", "c");
        assertThat(repository.findByStatuses(List.of())).isEmpty();
        assertThat(repository.findById("missing")).isEmpty();
    }

    @Test
    void unreadablePendingPayloadFailsLoudly() {
        repository.upsert(session("s-4", SessionStatus.AWAITING_CONFIRMATION, List.of(), null));
        jdbcTemplate.update("UPDATE crawl_sessions SET pending_urls = 'not json' WHERE id = 's-4'");

        assertThatThrownBy(() -> repository.findById("s-4")).isInstanceOf(IllegalStateException.class);
    }

    private static CrawlSession session(String id, SessionStatus status, List<PendingUrl> pending, String message) {
        Instant now = Instant.now();
        return new CrawlSession(id, status, status.dbValue(), pending, "Alize", 0, 0, message, now, now);
    }
}
