package com.gpu.tracker.microcenter.batch;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.SocketTimeoutException;

@Slf4j
@Component
public class JsoupPageFetcher implements PageFetcher {

    @Value("${app.crawl.user-agent:Mozilla/5.0}")
    private String userAgent;

    @Value("${app.crawl.request-timeout-ms:20000}")
    private int requestTimeoutMs;

    @Value("${app.crawl.product-marker:a.productClickItemV2}")
    private String productMarker;

    @Override
    public String fetch(String url) throws PageFetchException {
        int timeout = Math.max(1000, requestTimeoutMs);
        Document doc;
        try {
            doc = Jsoup.connect(url)
                    .userAgent(userAgent)
                    .timeout(timeout)
                    .get();
        } catch (SocketTimeoutException ex) {
            throw new PageFetchException("Page timed out after " + timeout + "ms: " + url, ex);
        } catch (HttpStatusException ex) {
            throw new PageFetchException("Page returned HTTP " + ex.getStatusCode() + ": " + url, ex);
        } catch (IOException ex) {
            throw new PageFetchException("Could not load page " + url + ": " + ex.getMessage(), ex);
        }

        if (doc.selectFirst(productMarker) == null) {
            throw new PageFetchException("No products found at " + url);
        }
        log.debug("Fetched {} ({} chars)", url, doc.html().length());
        return doc.outerHtml();
    }
}
