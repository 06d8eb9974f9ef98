package com.catalogsync.crawl.model;

import java.time.Instant;
import java.util.List;

public record ProductRecord(
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
    List<VariantRecord> variants
) {
    /**
     * Placeholder the catalog site's extractor writes for a field it could not find.
     */
    public static final String NOT_FOUND = "Не найдено";

    public ProductRecord {
        variants = variants == null ? List.of() : List.copyOf(variants);
    }

    public boolean hasUsableTitle() {
        return title != null && !title.isBlank() && !NOT_FOUND.equals(title.trim());
    }
}
