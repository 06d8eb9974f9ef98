package com.catalogsync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {
    private static final String DEFAULT_USER_AGENT = "catalog-sync/0.1 (+contact)";

    private String userAgent;
    private int perHostDelayMs = 1;
    private int requestTimeoutSeconds = 10;
    private int requestMaxRetries = 0;
    private int requestRetryBaseDelayMs = 500;
    private int requestRetryMaxDelayMs = 4000;
    private int politenessDelayMs = 1000;
    private int confirmationThreshold = 5;
    private int maxConsecutiveStorageFailures = 3;
    private boolean recoverOrphanedSessions = true;
    private Site site = new Site();
    private Selectors selectors = new Selectors();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getPerHostDelayMs() {
        return Math.max(1, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(1, perHostDelayMs);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = requestMaxRetries;
    }

    public int getRequestRetryBaseDelayMs() {
        return requestRetryBaseDelayMs;
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = requestRetryBaseDelayMs;
    }

    public int getRequestRetryMaxDelayMs() {
        return requestRetryMaxDelayMs;
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = requestRetryMaxDelayMs;
    }

    public int getPolitenessDelayMs() {
        return Math.max(0, politenessDelayMs);
    }

    public void setPolitenessDelayMs(int politenessDelayMs) {
        this.politenessDelayMs = Math.max(0, politenessDelayMs);
    }

    public int getConfirmationThreshold() {
        return Math.max(0, confirmationThreshold);
    }

    public void setConfirmationThreshold(int confirmationThreshold) {
        this.confirmationThreshold = Math.max(0, confirmationThreshold);
    }

    public int getMaxConsecutiveStorageFailures() {
        return Math.max(0, maxConsecutiveStorageFailures);
    }

    public void setMaxConsecutiveStorageFailures(int maxConsecutiveStorageFailures) {
        this.maxConsecutiveStorageFailures = Math.max(0, maxConsecutiveStorageFailures);
    }

    public boolean isRecoverOrphanedSessions() {
        return recoverOrphanedSessions;
    }

    public void setRecoverOrphanedSessions(boolean recoverOrphanedSessions) {
        this.recoverOrphanedSessions = recoverOrphanedSessions;
    }

    public Site getSite() {
        return site;
    }

    public void setSite(Site site) {
        this.site = site;
    }

    public Selectors getSelectors() {
        return selectors;
    }

    public void setSelectors(Selectors selectors) {
        this.selectors = selectors;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Site {
        private String baseUrl = "https://nsk-mahaon.ru/";
        private String productPathMarker = "/products/";
        private String catalogPathMarker = "/collection/";
        private String defaultCategory = "Unknown";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getProductPathMarker() {
            return productPathMarker;
        }

        public void setProductPathMarker(String productPathMarker) {
            this.productPathMarker = productPathMarker;
        }

        public String getCatalogPathMarker() {
            return catalogPathMarker;
        }

        public void setCatalogPathMarker(String catalogPathMarker) {
            this.catalogPathMarker = catalogPathMarker;
        }

        public String getDefaultCategory() {
            return defaultCategory == null || defaultCategory.isBlank() ? "Unknown" : defaultCategory;
        }

        public void setDefaultCategory(String defaultCategory) {
            this.defaultCategory = defaultCategory;
        }
    }

    /**
     * CSS selectors and field labels for the catalog site. Defaults match the Drupal views markup
     * of the yarn shop the service was written for.
     */
    public static class Selectors {
        private String listingTable = "table.views-table";
        private String listingRow = "tbody > tr";
        private String listingTitleLink = "td.views-field-title a[href]";
        private String nextPageLink = "li.pager-next a";
        private String catalogMenuLink = "#block-block-4 ul.catalog-menu > li:not(.hide) > a[href]";
        private String productTitle = "h1.page-title";
        private String productPrice = "span.price";
        private String productField = "div.field";
        private String productFieldLabel = "div.field-label, div.field-label-inline-first";
        private String productFieldValue = "div.field-item";
        private String mainImageLink = "div.field-field-yarn-foto a[href]";
        private String variant = "#samples div.sample";
        private String variantArticleNumber = "span.sample-number";
        private String variantName = "span.sample-name";
        private String variantImageLink = "div.sample-img a[href]";
        private String variantCartLink = "div.add-cart-link";
        private String variantMissingMarker = "div.no-exist";
        private String unavailableText = "(нет)";
        private String compositionLabel = "Состав";
        private String skeinWeightLabel = "Вес мотка";
        private String skeinLengthLabel = "Длина мотка";
        private String packageWeightLabel = "Вес упаковки";

        public String getListingTable() {
            return listingTable;
        }

        public void setListingTable(String listingTable) {
            this.listingTable = listingTable;
        }

        public String getListingRow() {
            return listingRow;
        }

        public void setListingRow(String listingRow) {
            this.listingRow = listingRow;
        }

        public String getListingTitleLink() {
            return listingTitleLink;
        }

        public void setListingTitleLink(String listingTitleLink) {
            this.listingTitleLink = listingTitleLink;
        }

        public String getNextPageLink() {
            return nextPageLink;
        }

        public void setNextPageLink(String nextPageLink) {
            this.nextPageLink = nextPageLink;
        }

        public String getCatalogMenuLink() {
            return catalogMenuLink;
        }

        public void setCatalogMenuLink(String catalogMenuLink) {
            this.catalogMenuLink = catalogMenuLink;
        }

        public String getProductTitle() {
            return productTitle;
        }

        public void setProductTitle(String productTitle) {
            this.productTitle = productTitle;
        }

        public String getProductPrice() {
            return productPrice;
        }

        public void setProductPrice(String productPrice) {
            this.productPrice = productPrice;
        }

        public String getProductField() {
            return productField;
        }

        public void setProductField(String productField) {
            this.productField = productField;
        }

        public String getProductFieldLabel() {
            return productFieldLabel;
        }

        public void setProductFieldLabel(String productFieldLabel) {
            this.productFieldLabel = productFieldLabel;
        }

        public String getProductFieldValue() {
            return productFieldValue;
        }

        public void setProductFieldValue(String productFieldValue) {
            this.productFieldValue = productFieldValue;
        }

        public String getMainImageLink() {
            return mainImageLink;
        }

        public void setMainImageLink(String mainImageLink) {
            this.mainImageLink = mainImageLink;
        }

        public String getVariant() {
            return variant;
        }

        public void setVariant(String variant) {
            this.variant = variant;
        }

        public String getVariantArticleNumber() {
            return variantArticleNumber;
        }

        public void setVariantArticleNumber(String variantArticleNumber) {
            this.variantArticleNumber = variantArticleNumber;
        }

        public String getVariantName() {
            return variantName;
        }

        public void setVariantName(String variantName) {
            this.variantName = variantName;
        }

        public String getVariantImageLink() {
            return variantImageLink;
        }

        public void setVariantImageLink(String variantImageLink) {
            this.variantImageLink = variantImageLink;
        }

        public String getVariantCartLink() {
            return variantCartLink;
        }

        public void setVariantCartLink(String variantCartLink) {
            this.variantCartLink = variantCartLink;
        }

        public String getVariantMissingMarker() {
            return variantMissingMarker;
        }

        public void setVariantMissingMarker(String variantMissingMarker) {
            this.variantMissingMarker = variantMissingMarker;
        }

        public String getUnavailableText() {
            return unavailableText;
        }

        public void setUnavailableText(String unavailableText) {
            this.unavailableText = unavailableText;
        }

        public String getCompositionLabel() {
            return compositionLabel;
        }

        public void setCompositionLabel(String compositionLabel) {
            this.compositionLabel = compositionLabel;
        }

        public String getSkeinWeightLabel() {
            return skeinWeightLabel;
        }

        public void setSkeinWeightLabel(String skeinWeightLabel) {
            this.skeinWeightLabel = skeinWeightLabel;
        }

        public String getSkeinLengthLabel() {
            return skeinLengthLabel;
        }

        public void setSkeinLengthLabel(String skeinLengthLabel) {
            this.skeinLengthLabel = skeinLengthLabel;
        }

        public String getPackageWeightLabel() {
            return packageWeightLabel;
        }

        public void setPackageWeightLabel(String packageWeightLabel) {
            this.packageWeightLabel = packageWeightLabel;
        }
    }
}
