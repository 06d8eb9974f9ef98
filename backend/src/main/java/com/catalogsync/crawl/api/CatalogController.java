package com.catalogsync.crawl.api;

import com.catalogsync.crawl.catalog.CatalogDiscovery;
import com.catalogsync.crawl.model.CatalogRef;
import com.catalogsync.crawl.model.ProductView;
import com.catalogsync.crawl.service.StorageGateway;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class CatalogController {
    private final CatalogDiscovery catalogDiscovery;
    private final StorageGateway storageGateway;

    public CatalogController(CatalogDiscovery catalogDiscovery, StorageGateway storageGateway) {
        this.catalogDiscovery = catalogDiscovery;
        this.storageGateway = storageGateway;
    }

    @GetMapping("/catalogs")
    public List<CatalogRef> catalogs() {
        return catalogDiscovery.listCatalogs();
    }

    @GetMapping("/products")
    public List<ProductView> products(@RequestParam(name = "category", required = false) String category) {
        String filter = category == null || category.isBlank() ? null : category.trim();
        return storageGateway.findProducts(filter);
    }

    @GetMapping("/categories")
    public List<String> categories() {
        return storageGateway.findCategories();
    }
}
