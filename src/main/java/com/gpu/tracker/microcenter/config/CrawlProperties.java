package com.gpu.tracker.microcenter.config;

import com.gpu.tracker.microcenter.model.StoreDescriptor;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Component
@ConfigurationProperties(prefix = "app.crawl")
@Data
public class CrawlProperties {

    private String searchUrl =
            "https://www.microcenter.com/search/search_results.aspx?N=4294966937&NTK=all&sortby=match"
                    + "&storeid={storeId}&rpp={pageSize}&page={page}";
    private String siteBaseUrl = "https://www.microcenter.com";
    private int pageSize = 96;
    private int maxPages = 10;
    private long pageDelayMs = 5000;
    private long storeDelayMs = 10000;
    private List<StoreDescriptor> stores = new ArrayList<>();

    public Optional<StoreDescriptor> findStore(String storeId) {
        if (storeId == null) {
            return Optional.empty();
        }
        return stores.stream()
                .filter(store -> store.id().equals(storeId))
                .findFirst();
    }

    public String pageUrl(String storeId, int page) {
        return searchUrl
                .replace("{storeId}", storeId)
                .replace("{pageSize}", String.valueOf(pageSize))
                .replace("{page}", String.valueOf(page));
    }
}
