package com.pricetracker.engine;

import com.microsoft.playwright.Page;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable page content handed over by the fetch collaborator.
 * <p>
 * The engine never fetches or renders anything itself: pages arrive either as raw HTML or as an
 * already-loaded Playwright {@link Page}, whose current DOM is captured once.
 *
 * @author Price Tracker Team
 * @since 1.0
 */
public final class PageSnapshot {
    private static final Logger logger = LoggerFactory.getLogger(PageSnapshot.class);

    private final String html;
    private final String url;

    public PageSnapshot(String html, String url) {
        this.html = html == null ? "" : html;
        this.url = url == null ? "" : url;
    }

    public static PageSnapshot ofHtml(String html, String url) {
        return new PageSnapshot(html, url);
    }

    /**
     * Captures the current DOM of a page the fetch collaborator has already loaded.
     * @param page Playwright page (may be null)
     * @return snapshot; empty when the page is null or its content cannot be read
     */
    public static PageSnapshot fromPlaywright(Page page) {
        if (page == null) {
            logger.warn("fromPlaywright called with null Page. Returning empty snapshot.");
            return new PageSnapshot("", "");
        }
        String url = "";
        try {
            url = page.url();
        } catch (Exception e) {
            logger.debug("Failed to read page URL: {}", e.getMessage());
        }
        try {
            return new PageSnapshot(page.content(), url);
        } catch (Exception e) {
            logger.warn("Failed to read page content for {}: {}", url, e.getMessage());
            return new PageSnapshot("", url);
        }
    }

    public String html() {
        return html;
    }

    public String url() {
        return url;
    }

    /**
     * Store domain of the page URL, normalized the way patterns are keyed.
     */
    public String domain() {
        return Utils.domainOf(url);
    }

    /**
     * Parses the HTML into a fresh document. jsoup repairs malformed markup instead of failing.
     */
    public Document parse() {
        return Jsoup.parse(html, url);
    }
}
