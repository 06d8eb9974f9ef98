package com.catalogsync.crawl.catalog;

import com.catalogsync.crawl.model.CatalogRef;

import java.util.List;

public interface CatalogDiscovery {
  List<CatalogRef> listCatalogs();
}
