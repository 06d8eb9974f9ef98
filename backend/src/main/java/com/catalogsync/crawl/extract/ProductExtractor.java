package com.catalogsync.crawl.extract;

import com.catalogsync.crawl.model.ProductRecord;
import com.catalogsync.crawl.model.VariantRecord;

import java.util.List;

/**
 * Turns a fetched product page into a record. Implementations return null (or an empty list)
 * for input they cannot read; they do not throw.
 */
public interface ProductExtractor {
  ProductRecord extract(String body, String pageUrl, String category);

  List<VariantRecord> extractVariants(String body, String pageUrl);
}
