package com.pricetracker.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.playwright.Page;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.lang.reflect.Proxy;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

public class MainTest {

    private static final String PATTERN_JSON = "{\"domain\":\"elkjop.no\",\"fields\":{"
        + "\"price\":{\"primary\":{\"type\":\"css\",\"expression\":\".price-now\",\"confidence\":0.95},"
        + "\"fallbacks\":[{\"type\":\"meta\",\"expression\":\"product:price:amount\",\"confidence\":0.7}]}}}";

    @TempDir
    Path tempDir;

    private int run(ByteArrayOutputStream out, String... args) {
        return Main.run(args, new PrintStream(out, true, StandardCharsets.UTF_8));
    }

    @Test
    void testPatternTestCommandPrintsReport() throws Exception {
        Path pattern = Files.writeString(tempDir.resolve("pattern.json"), PATTERN_JSON);
        Path page = Files.writeString(tempDir.resolve("page.html"),
            "<html><head><meta property=\"product:price:amount\" content=\"1 990,-\"></head><body></body></html>");
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        assertEquals(Main.EXIT_OK, run(out, "test", pattern.toString(), page.toString()));

        JsonNode report = new ObjectMapper().readTree(out.toString(StandardCharsets.UTF_8));
        assertEquals("elkjop.no", report.path("domain").asText());
        JsonNode price = report.path("extraction").path("fields").path("price");
        assertEquals("1990.00", price.path("value").asText());
        assertEquals("meta-lookup", price.path("method").asText());
        assertEquals(1, price.path("selector_index").asInt());
        assertTrue(report.path("validation").path("valid").asBoolean());
        assertEquals(0.7, report.path("validation").path("confidence").asDouble(), 1e-9);
    }

    @Test
    void testPatternTestCommandReportsInvalidExtraction() throws Exception {
        Path pattern = Files.writeString(tempDir.resolve("pattern.json"), PATTERN_JSON);
        Path page = Files.writeString(tempDir.resolve("page.html"), "<html><body><p>Ring for pris</p></body></html>");
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        assertEquals(Main.EXIT_INVALID, run(out, "test", pattern.toString(), page.toString(), "https://www.elkjop.no/p/1"));
        JsonNode report = new ObjectMapper().readTree(out.toString(StandardCharsets.UTF_8));
        assertEquals("Price not found", report.path("validation").path("errors").get(0).asText());
    }

    @Test
    void testUsageAndInputErrors() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        assertEquals(Main.EXIT_USAGE, run(out));
        assertEquals(Main.EXIT_USAGE, run(out, "regenerate"));
        assertEquals(Main.EXIT_USAGE, run(out, "test", "pattern.json"));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("Usage:"));

        Path badPattern = Files.writeString(tempDir.resolve("bad.json"), "{\"fields\":{}}");
        Path page = Files.writeString(tempDir.resolve("page.html"), "<html></html>");
        assertEquals(Main.EXIT_ERROR, run(out, "test", badPattern.toString(), page.toString()));
        assertEquals(Main.EXIT_ERROR, run(out, "test", tempDir.resolve("missing.json").toString(), page.toString()));
    }

    @Test
    void testHealthReportNeedsDatabase() {
        assumeTrue(Utils.envOrProp("DB_URL", "").isBlank(), "DB_URL is configured");
        assertEquals(Main.EXIT_USAGE, run(new ByteArrayOutputStream(), "health-report", tempDir.resolve("h.csv").toString()));
    }

    @Test
    void testNormalizeDomain() {
        assertEquals("elkjop.no", Utils.normalizeDomain(" WWW.Elkjop.NO "));
        assertEquals("shop.elkjop.no", Utils.normalizeDomain("shop.elkjop.no"));
        assertEquals("", Utils.normalizeDomain(null));
    }

    @Test
    void testDomainOf() {
        assertEquals("elkjop.no", Utils.domainOf("https://www.elkjop.no/product/123?ref=x"));
        assertEquals("komplett.no", Utils.domainOf("http://KOMPLETT.no:8080/p"));
        assertEquals("", Utils.domainOf("not a url"));
        assertEquals("", Utils.domainOf(null));
    }

    @Test
    void testEnvOrPropFallbacks() {
        String key = "PRICE_ENGINE_TEST_SETTING";
        System.setProperty(key, "12");
        try {
            assertEquals("12", Utils.envOrProp(key, "x"));
            assertEquals(12, Utils.envOrPropInt(key, 3));
            assertEquals(12.0, Utils.envOrPropDouble(key, 0.5));
            System.setProperty(key, "twelve");
            assertEquals(3, Utils.envOrPropInt(key, 3));
            assertEquals(0.5, Utils.envOrPropDouble(key, 0.5));
        } finally {
            System.clearProperty(key);
        }
        assertEquals("x", Utils.envOrProp(key, "x"));
    }

    @Test
    void testRetryStorageAction() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        String result = Utils.retryStorageAction(() -> {
            if (calls.incrementAndGet() < 3) throw new StorageException("busy");
            return "ok";
        }, 3, 1L, "test action");
        assertEquals("ok", result);
        assertEquals(3, calls.get());

        AtomicInteger failing = new AtomicInteger();
        StorageException e = assertThrows(StorageException.class, () -> Utils.retryStorageAction(() -> {
            throw new StorageException("down " + failing.incrementAndGet());
        }, 2, 1L, "failing action"));
        assertEquals("down 2", e.getMessage());

        AtomicInteger missing = new AtomicInteger();
        StorageException notFound = assertThrows(StorageException.class, () -> Utils.retryStorageAction(() -> {
            missing.incrementAndGet();
            throw StorageException.patternNotFound("power.no");
        }, 5, 1L, "missing pattern"));
        assertFalse(notFound.isRetryable());
        assertEquals(1, missing.get());
    }

    @Test
    void testPageSnapshotFromPlaywright() {
        Page page = (Page) Proxy.newProxyInstance(Page.class.getClassLoader(), new Class<?>[]{Page.class},
            (proxy, method, args) -> switch (method.getName()) {
                case "url" -> "https://www.elkjop.no/p/1";
                case "content" -> "<html><body><span class=\"price\">1 990,-</span></body></html>";
                default -> null;
            });
        PageSnapshot snapshot = PageSnapshot.fromPlaywright(page);
        assertEquals("elkjop.no", snapshot.domain());
        assertEquals("1 990,-", snapshot.parse().selectFirst("span.price").text());

        Page broken = (Page) Proxy.newProxyInstance(Page.class.getClassLoader(), new Class<?>[]{Page.class},
            (proxy, method, args) -> {
                if (method.getName().equals("url")) return "https://www.elkjop.no/p/1";
                throw new IllegalStateException("page closed");
            });
        PageSnapshot empty = PageSnapshot.fromPlaywright(broken);
        assertEquals("", empty.html());
        assertEquals("https://www.elkjop.no/p/1", empty.url());
        assertEquals("", PageSnapshot.fromPlaywright(null).html());
    }
}
