package com.catalogsync.crawl.persistence;

import com.catalogsync.crawl.model.CrawlSession;
import com.catalogsync.crawl.model.PendingUrl;
import com.catalogsync.crawl.model.SessionStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static com.catalogsync.crawl.persistence.CatalogJdbcRepository.toInstant;
import static com.catalogsync.crawl.persistence.CatalogJdbcRepository.toTimestamp;

@Repository
public class CrawlSessionRepository {
    private static final TypeReference<List<PendingUrl>> PENDING_LIST = new TypeReference<>() {};

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public CrawlSessionRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public Optional<CrawlSession> findById(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        List<CrawlSession> rows = jdbc.query(
            """
                SELECT id, status, progress, pending_urls, category_name, products_saved, products_failed,
                       message, created_at, updated_at
                FROM crawl_sessions
                WHERE id = :id
                """,
            new MapSqlParameterSource().addValue("id", id),
            sessionRowMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<CrawlSession> findByStatuses(Collection<SessionStatus> statuses) {
        if (statuses == null || statuses.isEmpty()) {
            return List.of();
        }
        List<String> values = statuses.stream().map(SessionStatus::dbValue).toList();
        return jdbc.query(
            """
                SELECT id, status, progress, pending_urls, category_name, products_saved, products_failed,
                       message, created_at, updated_at
                FROM crawl_sessions
                WHERE status IN (:statuses)
                ORDER BY created_at
                """,
            new MapSqlParameterSource().addValue("statuses", values),
            sessionRowMapper()
        );
    }

    /**
     * Insert-or-update by id. {@code created_at} is only written by the insert.
     */
    public void upsert(CrawlSession session) {
        Instant now = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", session.id())
            .addValue("status", session.status().dbValue())
            .addValue("progress", session.progress())
            .addValue("pendingUrls", writePending(session.pendingUrls()))
            .addValue("categoryName", session.categoryName())
            .addValue("productsSaved", session.productsSaved())
            .addValue("productsFailed", session.productsFailed())
            .addValue("message", truncate(session.message(), 1000))
            .addValue("createdAt", toTimestamp(session.createdAt() == null ? now : session.createdAt()))
            .addValue("updatedAt", toTimestamp(session.updatedAt() == null ? now : session.updatedAt()));

        int updated = jdbc.update(
            """
                UPDATE crawl_sessions
                SET status = :status,
                    progress = :progress,
                    pending_urls = :pendingUrls,
                    category_name = :categoryName,
                    products_saved = :productsSaved,
                    products_failed = :productsFailed,
                    message = :message,
                    updated_at = :updatedAt
                WHERE id = :id
                """,
            params
        );
        if (updated == 0) {
            jdbc.update(
                """
                    INSERT INTO crawl_sessions (
                        id, status, progress, pending_urls, category_name, products_saved, products_failed,
                        message, created_at, updated_at
                    )
                    VALUES (
                        :id, :status, :progress, :pendingUrls, :categoryName, :productsSaved, :productsFailed,
                        :message, :createdAt, :updatedAt
                    )
                    """,
                params
            );
        }
    }

    private RowMapper<CrawlSession> sessionRowMapper() {
        return (rs, rowNum) -> new CrawlSession(
            rs.getString("id"),
            SessionStatus.fromDbValue(rs.getString("status")),
            rs.getString("progress"),
            readPending(rs.getString("pending_urls")),
            rs.getString("category_name"),
            rs.getInt("products_saved"),
            rs.getInt("products_failed"),
            rs.getString("message"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    private String writePending(List<PendingUrl> pendingUrls) {
        try {
            return objectMapper.writeValueAsString(pendingUrls == null ? List.of() : pendingUrls);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize pending urls", e);
        }
    }

    private List<PendingUrl> readPending(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, PENDING_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable pending_urls payload", e);
        }
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
