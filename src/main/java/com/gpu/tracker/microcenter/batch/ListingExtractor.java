package com.gpu.tracker.microcenter.batch;

import com.gpu.tracker.microcenter.model.GpuIdentity;
import com.gpu.tracker.microcenter.model.RawListing;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns a search results page into raw listings. A container that cannot be
 * parsed is logged and dropped; its siblings are still returned.
 */
@Slf4j
@Component
public class ListingExtractor {
    static final String NOT_AVAILABLE = "N/A";
    static final String SOLD_OUT = "SOLD OUT";
    static final String UNKNOWN_STOCK = "UNKNOWN";

    public List<RawListing> extract(String html, String baseUri) {
        Document doc = Jsoup.parse(html == null ? "" : html, baseUri == null ? "" : baseUri);
        Elements containers = doc.select("li.product_wrapper");
        List<RawListing> listings = new ArrayList<>();
        int skipped = 0;
        for (Element container : containers) {
            try {
                RawListing listing = parseContainer(container);
                if (listing == null) {
                    skipped++;
                    continue;
                }
                listings.add(listing);
            } catch (RuntimeException ex) {
                skipped++;
                log.warn("Error parsing product container: {}", ex.getMessage());
            }
        }
        log.info("Found {} products ({} extracted, {} skipped)", containers.size(), listings.size(), skipped);
        return listings;
    }

    RawListing parseContainer(Element container) {
        Element anchor = container.selectFirst("a.productClickItemV2");
        if (anchor == null) {
            return null;
        }
        String fullName = attrOrDefault(anchor, "data-name", NOT_AVAILABLE).trim();
        String brand = attrOrDefault(anchor, "data-brand", GpuIdentity.UNKNOWN).trim();
        String productUrl = absoluteOrRaw(anchor, "href");
        BigDecimal price = parsePrice(attrOrDefault(anchor, "data-price", "0.00"));

        Element skuElement = container.selectFirst("p.sku");
        String sku = skuElement == null ? NOT_AVAILABLE : skuElement.text().replace("SKU:", "").trim();
        if (fullName.isEmpty() || NOT_AVAILABLE.equals(fullName) || sku.isEmpty() || NOT_AVAILABLE.equals(sku)) {
            return null;
        }

        return new RawListing(
                fullName,
                brand.isEmpty() ? GpuIdentity.UNKNOWN : brand,
                price,
                sku,
                stockStatus(container),
                imageUrl(container),
                productUrl
        );
    }

    String stockStatus(Element container) {
        Element inventory = container.selectFirst("span.inventoryCnt");
        if (inventory != null && !inventory.text().isBlank()) {
            return inventory.text().trim();
        }
        for (Element child : container.children()) {
            if ("div".equals(child.tagName()) && child.hasClass("stock")) {
                return child.text().trim().toUpperCase(Locale.ROOT);
            }
        }
        if (container.text().toUpperCase(Locale.ROOT).contains(SOLD_OUT)) {
            return SOLD_OUT;
        }
        return UNKNOWN_STOCK;
    }

    private String imageUrl(Element container) {
        Element image = container.selectFirst("img.SearchResultProductImage");
        if (image == null) {
            return NOT_AVAILABLE;
        }
        String attribute = image.hasAttr("data-src") && !image.attr("data-src").isBlank() ? "data-src" : "src";
        String url = absoluteOrRaw(image, attribute);
        return url.isBlank() ? NOT_AVAILABLE : url;
    }

    private BigDecimal parsePrice(String raw) {
        String clean = raw.replace("$", "").replace(",", "").trim();
        if (clean.isEmpty()) {
            return new BigDecimal("0.00");
        }
        return new BigDecimal(clean).setScale(2, RoundingMode.HALF_UP);
    }

    private String attrOrDefault(Element element, String attribute, String fallback) {
        return element.hasAttr(attribute) ? element.attr(attribute) : fallback;
    }

    private String absoluteOrRaw(Element element, String attribute) {
        if (!element.hasAttr(attribute)) {
            return NOT_AVAILABLE;
        }
        String absolute = element.absUrl(attribute);
        return absolute.isBlank() ? element.attr(attribute).trim() : absolute;
    }
}
