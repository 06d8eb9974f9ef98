package com.catalogsync.crawl.service;

import com.catalogsync.crawl.model.CrawlSession;
import com.catalogsync.crawl.model.ProductRecord;
import com.catalogsync.crawl.model.ProductView;
import com.catalogsync.crawl.model.SessionStatus;
import com.catalogsync.crawl.model.StoreOutcome;
import com.catalogsync.crawl.model.VariantRecord;
import com.catalogsync.crawl.persistence.CatalogJdbcRepository;
import com.catalogsync.crawl.persistence.CrawlSessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Single entry point for writes. Every write runs in one transaction while holding a process-wide
 * lock; reads go straight to the repositories.
 */
@Service
public class StorageGateway {
    private static final Logger log = LoggerFactory.getLogger(StorageGateway.class);

    private final CatalogJdbcRepository catalogRepository;
    private final CrawlSessionRepository sessionRepository;
    private final TransactionTemplate transactionTemplate;
    private final ReentrantLock writeLock = new ReentrantLock();

    public StorageGateway(
        CatalogJdbcRepository catalogRepository,
        CrawlSessionRepository sessionRepository,
        PlatformTransactionManager transactionManager
    ) {
        this.catalogRepository = catalogRepository;
        this.sessionRepository = sessionRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public <T> T withWriteTransaction(Supplier<T> work) {
        writeLock.lock();
        try {
            return transactionTemplate.execute(status -> work.get());
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * @return the product id, or null when the record has no usable title and nothing was written
     */
    public Long upsertProduct(ProductRecord record) {
        if (record == null || !record.hasUsableTitle()) {
            log.warn("Rejected product without usable title url={}", record == null ? null : record.url());
            return null;
        }
        return withWriteTransaction(() -> catalogRepository.upsertProduct(record));
    }

    /**
     * Writes the whole batch or nothing. Returns false when the token was canceled part way and
     * the batch was rolled back.
     */
    public boolean upsertVariants(long productId, List<VariantRecord> variants, CancellationToken token) {
        try {
            withWriteTransaction(() -> {
                writeVariants(productId, variants, token);
                return null;
            });
            return true;
        } catch (CrawlCanceledException e) {
            log.info("Variant batch for product {} rolled back on cancel", productId);
            return false;
        }
    }

    public StoreOutcome saveProduct(ProductRecord record, CancellationToken token) {
        if (record == null || !record.hasUsableTitle()) {
            log.warn("Rejected product without usable title url={}", record == null ? null : record.url());
            return StoreOutcome.REJECTED;
        }
        try {
            withWriteTransaction(() -> {
                long productId = catalogRepository.upsertProduct(record);
                writeVariants(productId, record.variants(), token);
                return productId;
            });
            return StoreOutcome.SAVED;
        } catch (CrawlCanceledException e) {
            log.info("Product {} rolled back on cancel", record.url());
            return StoreOutcome.CANCELED;
        }
    }

    public int cleanupIncomplete(String sessionId) {
        Integer deleted = withWriteTransaction(catalogRepository::deleteIncompleteProducts);
        int count = deleted == null ? 0 : deleted;
        log.info("Cleanup after session {} removed {} incomplete products", sessionId, count);
        return count;
    }

    public void saveSessionStatus(CrawlSession session) {
        withWriteTransaction(() -> {
            sessionRepository.upsert(session);
            return null;
        });
    }

    public Optional<CrawlSession> findSession(String sessionId) {
        return sessionRepository.findById(sessionId);
    }

    public List<CrawlSession> findSessions(Collection<SessionStatus> statuses) {
        return sessionRepository.findByStatuses(statuses);
    }

    public boolean isDbReachable() {
        return sessionRepository.isDbReachable();
    }

    public List<ProductView> findProducts(String category) {
        return catalogRepository.findProducts(category);
    }

    public List<String> findCategories() {
        return catalogRepository.findCategories();
    }

    private void writeVariants(long productId, List<VariantRecord> variants, CancellationToken token) {
        if (variants == null) {
            return;
        }
        for (VariantRecord variant : variants) {
            if (token != null && token.isCanceled()) {
                throw new CrawlCanceledException(token.sessionId());
            }
            catalogRepository.upsertVariant(productId, variant);
        }
    }
}
