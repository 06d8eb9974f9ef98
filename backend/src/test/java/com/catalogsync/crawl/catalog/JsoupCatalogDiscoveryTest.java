package com.catalogsync.crawl.catalog;

import com.catalogsync.config.CrawlerProperties;
import com.catalogsync.crawl.FakePageFetcher;
import com.catalogsync.crawl.model.CatalogRef;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.catalogsync.crawl.CatalogFixtures.HOST;
import static org.assertj.core.api.Assertions.assertThat;

class JsoupCatalogDiscoveryTest {

    @Test
    void listsVisibleCatalogMenuEntries() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.getSite().setBaseUrl(HOST + "/");
        FakePageFetcher fetcher = new FakePageFetcher().page(HOST + "/", """
            <html><body>
              <div id="block-block-4" class="block">
                <ul class="menu catalog-menu level-0">
                  <li><a href="/collection/alize">Alize</a></li>
                  <li class="hide"><a href="/collection/archive">Архив</a></li>
                  <li><a href="/collection/yarnart">YarnArt</a>
                    <ul class="menu level-1"><li><a href="/collection/yarnart/jeans">Jeans</a></li></ul>
                  </li>
                  <li><a href="/collection/alize">Alize again</a></li>
                </ul>
              </div>
              <ul class="catalog-menu"><li><a href="/collection/elsewhere">Elsewhere</a></li></ul>
            </body></html>
            """);

        List<CatalogRef> catalogs = new JsoupCatalogDiscovery(fetcher, properties).listCatalogs();

        assertThat(catalogs).containsExactly(
            new CatalogRef("Alize", HOST + "/collection/alize"),
            new CatalogRef("YarnArt", HOST + "/collection/yarnart")
        );
    }

    @Test
    void unavailableFrontPageYieldsNoCatalogs() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.getSite().setBaseUrl(HOST + "/");

        assertThat(new JsoupCatalogDiscovery(new FakePageFetcher(), properties).listCatalogs()).isEmpty();
    }
}
