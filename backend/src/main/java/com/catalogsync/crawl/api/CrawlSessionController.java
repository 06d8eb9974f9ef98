package com.catalogsync.crawl.api;

import com.catalogsync.config.CrawlerProperties;
import com.catalogsync.crawl.model.SessionActionResponse;
import com.catalogsync.crawl.model.SessionStartResponse;
import com.catalogsync.crawl.model.SessionStatusView;
import com.catalogsync.crawl.service.CrawlJobLauncher;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/sessions")
public class CrawlSessionController {
    private final CrawlJobLauncher launcher;
    private final CrawlerProperties crawlerProperties;

    public CrawlSessionController(CrawlJobLauncher launcher, CrawlerProperties crawlerProperties) {
        this.launcher = launcher;
        this.crawlerProperties = crawlerProperties;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public SessionStartResponse start(@RequestBody(required = false) CrawlSessionApiRequest request) {
        CrawlSessionApiRequest body = request == null
            ? new CrawlSessionApiRequest(null, null, null, null, null, null)
            : request;
        return launcher.start(body.toJobRequest(crawlerProperties.getSite()));
    }

    @GetMapping("/{id}")
    public SessionStatusView status(@PathVariable("id") String id) {
        return launcher.getStatus(id);
    }

    @PostMapping("/{id}/confirm")
    public SessionActionResponse confirm(@PathVariable("id") String id) {
        boolean applied = launcher.confirm(id);
        return new SessionActionResponse(id, "confirm", applied, launcher.getStatus(id));
    }

    @PostMapping("/{id}/decline")
    public SessionActionResponse decline(@PathVariable("id") String id) {
        boolean applied = launcher.decline(id);
        return new SessionActionResponse(id, "decline", applied, launcher.getStatus(id));
    }

    @PostMapping("/{id}/cancel")
    public SessionActionResponse cancel(@PathVariable("id") String id) {
        boolean applied = launcher.cancel(id);
        return new SessionActionResponse(id, "cancel", applied, launcher.getStatus(id));
    }
}
