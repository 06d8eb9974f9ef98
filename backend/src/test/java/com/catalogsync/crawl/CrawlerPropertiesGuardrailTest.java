package com.catalogsync.crawl;

import com.catalogsync.config.CrawlerProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CrawlerPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToSafeDefault() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("catalog-sync/0.1"));
    }

    @Test
    void delaysAndThresholdsAreClamped() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setPerHostDelayMs(-10);
        properties.setPolitenessDelayMs(-1);
        properties.setConfirmationThreshold(-3);
        properties.setMaxConsecutiveStorageFailures(-2);
        properties.setRequestTimeoutSeconds(0);
        assertEquals(1, properties.getPerHostDelayMs());
        assertEquals(0, properties.getPolitenessDelayMs());
        assertEquals(0, properties.getConfirmationThreshold());
        assertEquals(0, properties.getMaxConsecutiveStorageFailures());
        assertEquals(1, properties.getRequestTimeoutSeconds());
    }

    @Test
    void defaultsMatchTheCatalogSite() {
        CrawlerProperties properties = new CrawlerProperties();
        assertEquals(5, properties.getConfirmationThreshold());
        assertEquals(1000, properties.getPolitenessDelayMs());
        assertEquals(10, properties.getRequestTimeoutSeconds());
        assertEquals("Unknown", properties.getSite().getDefaultCategory());
        assertEquals("(нет)", properties.getSelectors().getUnavailableText());
    }
}
