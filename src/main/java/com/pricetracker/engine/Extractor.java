package com.pricetracker.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Applies a {@link Pattern}'s selector chains to a page.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Parses the page once with jsoup.</li>
 *   <li>For every field of the pattern, applies the primary selector and then each fallback in declared order.</li>
 *   <li>The first selector that yields a non-blank value wins and the rest of the chain is skipped. The value is
 *       normalized inline through {@link ProductField#normalize(String)}; one that does not normalize is kept as
 *       cleaned text so the {@link Validator} can reject it.</li>
 *   <li>Records the winning selector's type, declared confidence and chain position in an {@link ExtractedField}.</li>
 * </ul>
 * <p>
 * Error handling: every selector is applied through {@link #applySelector(Document, Selector)}, which returns an
 * {@link Optional} and converts any exception (bad query syntax, malformed JSON, bad index) into a miss. A broken
 * selector never aborts its field or the extraction. The extractor performs no I/O and never mutates the pattern,
 * so one instance can be shared across threads.
 *
 * @author Price Tracker Team
 * @since 1.0
 */
public class Extractor {
    private static final Logger logger = LoggerFactory.getLogger(Extractor.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String JSON_LD_BLOCKS = "script[type=application/ld+json]";
    private static final java.util.regex.Pattern XPATH_ATTRIBUTE_STEP = java.util.regex.Pattern.compile("^(.*)/@([\\w:.-]+)$");
    private static final String XPATH_TEXT_STEP = "/text()";

    /**
     * Extracts every field the pattern declares.
     * @param page page content from the fetch collaborator
     * @param pattern pattern for the page's domain
     * @return field results plus extraction errors and warnings
     */
    public ExtractionResult extract(PageSnapshot page, Pattern pattern) {
        if (page == null) {
            logger.warn("extract called with null page. Returning empty result.");
            return ExtractionResult.empty("No page content");
        }
        if (pattern == null) {
            logger.warn("extract called with null pattern for {}. Returning empty result.", page.url());
            return ExtractionResult.empty("No pattern");
        }
        if (pattern.fields().isEmpty()) {
            logger.warn("Pattern for {} defines no fields.", pattern.domain());
            return ExtractionResult.empty("Pattern defines no fields");
        }

        Document document;
        try {
            document = page.parse();
        } catch (Exception e) {
            logger.error("Failed to parse page {}: {}", page.url(), e.getMessage());
            return ExtractionResult.empty("Page could not be parsed: " + e.getMessage());
        }

        Map<String, ExtractedField> fields = new LinkedHashMap<>();
        List<String> warnings = new ArrayList<>();
        for (Map.Entry<String, FieldPattern> entry : pattern.fields().entrySet()) {
            String name = entry.getKey();
            ExtractedField field = extractField(document, ProductFieldRegistry.getField(name), entry.getValue());
            fields.put(name, field);
            if (!field.isPresent()) {
                warnings.add("No selector matched for field '" + name + "'");
            }
        }

        long resolved = fields.values().stream().filter(ExtractedField::isPresent).count();
        ExtractedField price = fields.getOrDefault(ProductFieldRegistry.PRICE, ExtractedField.absent());
        logger.info("Extraction for {} resolved {}/{} fields (price={}, method={}, fallback={})",
            pattern.domain(), resolved, fields.size(), price.value(), price.method(), price.isFallback());
        return new ExtractionResult(fields, List.of(), warnings);
    }

    /**
     * Walks one field's chain; stops at the first selector that yields a non-blank value.
     * A value that does not normalize is kept as cleaned text.
     */
    ExtractedField extractField(Document document, ProductField field, FieldPattern fieldPattern) {
        List<Selector> chain = fieldPattern.chain();
        for (int i = 0; i < chain.size(); i++) {
            Selector selector = chain.get(i);
            Optional<String> raw = applySelector(document, selector);
            if (raw.isEmpty()) {
                continue;
            }
            String value = field.normalize(raw.get());
            if (value == null) {
                value = FieldValueNormalizer.cleanText(raw.get()).orElse(raw.get().trim());
                logger.debug("Value '{}' from {} for field '{}' did not normalize; keeping it as text.",
                    raw.get(), selector.describe(), field.fieldName);
            }
            if (i > 0) {
                logger.debug("Field '{}' resolved by fallback #{} ({})", field.fieldName, i, selector.describe());
            }
            return new ExtractedField(value, selector.type(), selector.confidence(), i);
        }
        return ExtractedField.absent();
    }

    /**
     * Applies one selector to the document.
     * @param document parsed page
     * @param selector selector to apply
     * @return raw non-blank value, or empty on a miss; never throws
     */
    protected Optional<String> applySelector(Document document, Selector selector) {
        try {
            Optional<String> value = switch (selector.type()) {
                case STRUCTURED_QUERY -> applyStructuredQuery(document, selector);
                case PATH_QUERY -> applyPathQuery(document, selector);
                case STRUCTURED_DATA_PATH -> applyStructuredDataPath(document, selector);
                case META_LOOKUP -> applyMetaLookup(document, selector);
            };
            return value.filter(v -> !v.isBlank());
        } catch (Exception e) {
            logger.debug("Selector {} failed: {}", selector.describe(), e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<String> applyStructuredQuery(Document document, Selector selector) {
        Element element = document.selectFirst(selector.expression());
        return element == null ? Optional.empty() : readElement(element, selector.attribute());
    }

    private Optional<String> applyPathQuery(Document document, Selector selector) {
        String xpath = selector.expression().trim();
        String attribute = selector.attribute();
        Matcher attributeStep = XPATH_ATTRIBUTE_STEP.matcher(xpath);
        if (attributeStep.matches()) {
            xpath = attributeStep.group(1);
            attribute = attributeStep.group(2);
        } else if (xpath.endsWith(XPATH_TEXT_STEP)) {
            xpath = xpath.substring(0, xpath.length() - XPATH_TEXT_STEP.length());
        }
        Elements elements = document.selectXpath(xpath);
        return elements.isEmpty() ? Optional.empty() : readElement(elements.first(), attribute);
    }

    private Optional<String> applyStructuredDataPath(Document document, Selector selector) throws Exception {
        if (selector.source() != null) {
            Element holder = document.selectFirst(selector.source());
            if (holder == null) return Optional.empty();
            String payload = selector.attribute() != null ? holder.attr(selector.attribute()) : holder.data();
            if (payload.isBlank()) payload = holder.text();
            JsonNode root = MAPPER.readTree(payload);
            return FieldValueNormalizer.resolvePath(root, selector.expression()).flatMap(FieldValueNormalizer::scalarText);
        }
        for (Element block : document.select(JSON_LD_BLOCKS)) {
            JsonNode root;
            try {
                root = MAPPER.readTree(block.data());
            } catch (Exception e) {
                logger.debug("Skipping malformed JSON-LD block: {}", e.getMessage());
                continue;
            }
            Optional<String> value = FieldValueNormalizer.resolvePath(root, selector.expression())
                .flatMap(FieldValueNormalizer::scalarText);
            if (value.isPresent()) return value;
        }
        return Optional.empty();
    }

    private Optional<String> applyMetaLookup(Document document, Selector selector) {
        String name = selector.expression().trim();
        String attribute = selector.attribute() == null ? "content" : selector.attribute();
        if (name.regionMatches(true, 0, "meta", 0, 4)) {
            // Legacy patterns store a full query such as meta[property='og:title']
            Element element = document.selectFirst(name);
            return element == null ? Optional.empty() : readElement(element, attribute);
        }
        for (Element meta : document.select("meta")) {
            if (name.equalsIgnoreCase(meta.attr("property"))
                || name.equalsIgnoreCase(meta.attr("name"))
                || name.equalsIgnoreCase(meta.attr("itemprop"))) {
                Optional<String> value = readElement(meta, attribute);
                if (value.isPresent() && !value.get().isBlank()) return value;
            }
        }
        return Optional.empty();
    }

    private static Optional<String> readElement(Element element, String attribute) {
        if (attribute == null) {
            return Optional.of(element.text());
        }
        // jsoup resolves "abs:" prefixed names against the page URL
        if (!element.hasAttr(attribute)) {
            return Optional.empty();
        }
        return Optional.of(element.attr(attribute));
    }
}
