package com.catalogsync.crawl.model;

import java.time.Instant;

public record VariantRecord(
    String articleNumber,
    String variantName,
    boolean available,
    String imageUrl,
    String imagePath,
    Instant lastUpdated
) {}
