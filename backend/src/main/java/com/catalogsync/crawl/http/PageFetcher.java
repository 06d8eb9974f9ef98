package com.catalogsync.crawl.http;

import com.catalogsync.crawl.model.HttpFetchResult;

/**
 * Fetches one page. Network problems are reported in the result, never thrown.
 */
public interface PageFetcher {
  HttpFetchResult fetch(String url);
}
