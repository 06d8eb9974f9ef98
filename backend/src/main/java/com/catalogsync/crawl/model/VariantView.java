package com.catalogsync.crawl.model;

import java.time.Instant;

public record VariantView(
    long id,
    long productId,
    String articleNumber,
    String variantName,
    boolean available,
    String imageUrl,
    String imagePath,
    Instant lastUpdated,
    boolean complete
) {}
