package com.catalogsync.crawl.model;

import java.time.Instant;
import java.util.List;

public record ProductView(
    long id,
    String url,
    String title,
    String price,
    String composition,
    String skeinWeight,
    String skeinLength,
    String packageWeight,
    String category,
    String imageUrl,
    String imagePath,
    Instant lastUpdated,
    boolean complete,
    List<VariantView> variants
) {}
