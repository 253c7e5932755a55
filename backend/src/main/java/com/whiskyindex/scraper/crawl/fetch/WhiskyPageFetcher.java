package com.whiskyindex.scraper.crawl.fetch;

import com.whiskyindex.scraper.config.ScraperProperties;
import com.whiskyindex.scraper.crawl.http.PoliteHttpClient;
import com.whiskyindex.scraper.crawl.model.HttpFetchResult;
import com.whiskyindex.scraper.crawl.model.PageFetchResult;
import com.whiskyindex.scraper.crawl.util.NotFoundPageClassifier;
import org.springframework.stereotype.Component;

@Component
public class WhiskyPageFetcher implements PageFetcher {
    static final String ACCEPT_HTML = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

    private final PoliteHttpClient httpClient;
    private final RawPageStore rawPageStore;
    private final ScraperProperties properties;

    public WhiskyPageFetcher(PoliteHttpClient httpClient, RawPageStore rawPageStore, ScraperProperties properties) {
        this.httpClient = httpClient;
        this.rawPageStore = rawPageStore;
        this.properties = properties;
    }

    @Override
    public PageFetchResult fetch(long id) {
        String cached = rawPageStore.read(id);
        if (cached != null) {
            if (NotFoundPageClassifier.isNotFoundPage(cached)) {
                return PageFetchResult.notFound(id, true);
            }
            return PageFetchResult.ok(id, cached, true);
        }

        HttpFetchResult result = httpClient.get(urlFor(id), ACCEPT_HTML);
        if (result.hasTransportError()) {
            return PageFetchResult.transientError(id, result.errorCode());
        }
        if (result.isNotFound()) {
            rawPageStore.write(id, result.body() == null ? "" : result.body());
            return PageFetchResult.notFound(id, false);
        }
        if (!result.isSuccessful()) {
            return PageFetchResult.transientError(id, "http_" + result.statusCode());
        }
        String body = result.body() == null ? "" : result.body();
        rawPageStore.write(id, body);
        if (NotFoundPageClassifier.isNotFoundPage(body)) {
            return PageFetchResult.notFound(id, false);
        }
        return PageFetchResult.ok(id, body, false);
    }

    String urlFor(long id) {
        String base = properties.getHttp().getBaseUrl();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/whisky/" + id;
    }
}
