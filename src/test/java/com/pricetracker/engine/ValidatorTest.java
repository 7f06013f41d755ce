package com.pricetracker.engine;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ValidatorTest {

    private static final double EPS = 1e-9;

    private static ExtractionResult extraction(String price, double priceConfidence, String title, String availability) {
        Map<String, ExtractedField> fields = new LinkedHashMap<>();
        fields.put("price", price == null ? ExtractedField.absent()
            : new ExtractedField(price, SelectorType.STRUCTURED_QUERY, priceConfidence));
        if (title != null) fields.put("title", new ExtractedField(title, SelectorType.META_LOOKUP, 0.9));
        if (availability != null) fields.put("availability", new ExtractedField(availability, SelectorType.STRUCTURED_QUERY, 0.9));
        return new ExtractionResult(fields);
    }

    @Test
    void testMissingPriceIsInvalid() {
        ValidationResult result = new Validator().validate(extraction(null, 0.0, "Sony WH-1000XM5", null));
        assertFalse(result.valid());
        assertEquals(0.0, result.confidence());
        assertEquals(List.of("Price not found", "Confidence 0.00 below threshold 0.60"), result.errors());
    }

    @Test
    void testNullExtractionIsInvalid() {
        ValidationResult result = new Validator().validate(null);
        assertFalse(result.valid());
        assertEquals(0.0, result.confidence());
        assertTrue(result.errors().contains("Price not found"));
    }

    @Test
    void testInvalidPriceFormat() {
        ValidationResult result = new Validator().validate(extraction("call for price", 0.9, null, null));
        assertFalse(result.valid());
        assertEquals("Invalid price format: 'call for price'", result.errors().get(0));
        assertEquals(0.0, result.confidence());
    }

    @Test
    void testNonPositivePrice() {
        ValidationResult result = new Validator().validate(extraction("0.00", 0.9, null, null));
        assertFalse(result.valid());
        assertEquals("Price is zero or negative: 0.00", result.errors().get(0));

        ValidationResult negative = new Validator().validate(extraction("-5", 0.9, null, null));
        assertEquals("Price is zero or negative: -5", negative.errors().get(0));
    }

    @Test
    void testFallbackPriceAloneKeepsItsConfidence() {
        Map<String, ExtractedField> fields = Map.of("price", new ExtractedField("1990.00", SelectorType.META_LOOKUP, 0.7, 1));
        ValidationResult result = new Validator().validate(new ExtractionResult(fields));
        assertTrue(result.valid());
        assertEquals(0.7, result.confidence(), EPS);
        assertTrue(result.warnings().isEmpty());
        assertTrue(result.errors().isEmpty());
    }

    @Test
    void testLargePriceDropWarnsButStaysValid() {
        ExtractionResult previous = extraction("1000.00", 0.9, "Sony WH-1000XM5", null);
        ExtractionResult current = extraction("400.00", 0.9, "Sony WH-1000XM5", null);
        ValidationResult result = new Validator().validate(current, previous);
        assertTrue(result.valid());
        assertEquals(List.of("Price changed by 60.0% (1000.00 -> 400.00)"), result.warnings());
        assertEquals(0.85, result.confidence(), EPS);
    }

    @Test
    void testSmallPriceChangeIsQuiet() {
        ExtractionResult previous = extraction("1000.00", 0.9, "Sony WH-1000XM5", null);
        ExtractionResult current = extraction("1490.00", 0.9, "Sony WH-1000XM5", null);
        ValidationResult result = new Validator().validate(current, previous);
        assertTrue(result.warnings().isEmpty());
        assertEquals(0.9, result.confidence(), EPS);
    }

    @Test
    void testPriceChangeThresholdIsConfigurable() {
        Validator strict = new Validator(new ValidationSettings(0.6, 10.0, 0.05));
        ValidationResult result = strict.validate(
            extraction("1200.00", 0.9, null, null), extraction("1000.00", 0.9, null, null));
        assertEquals(List.of("Price changed by 20.0% (1000.00 -> 1200.00)"), result.warnings());
    }

    @Test
    void testTitleAndAvailabilityChanges() {
        ExtractionResult previous = extraction("1990.00", 0.9, "Sony WH-1000XM5", "På lager");
        ExtractionResult current = extraction("1990.00", 0.9, "Sony WH-1000XM5 (2024)", "Utsolgt");
        ValidationResult result = new Validator().validate(current, previous);
        assertTrue(result.valid());
        assertEquals(List.of("Product title changed", "Availability changed: out of stock"), result.warnings());
        assertEquals(0.8, result.confidence(), EPS);

        ValidationResult restocked = new Validator().validate(previous, current);
        assertTrue(restocked.warnings().contains("Availability changed: back in stock"));
    }

    @Test
    void testAvailabilityComparedOnlyWhenBothPresent() {
        ExtractionResult previous = extraction("1990.00", 0.9, null, null);
        ExtractionResult current = extraction("1990.00", 0.9, null, "Out of stock");
        assertTrue(new Validator().validate(current, previous).warnings().isEmpty());
    }

    @Test
    void testImplausiblePriceMagnitudes() {
        ValidationResult high = new Validator().validate(extraction("250000.00", 0.9, null, null));
        assertTrue(high.valid());
        assertEquals(List.of("Price unusually high (>100000): 250000.00"), high.warnings());
        assertEquals(0.85, high.confidence(), EPS);

        ValidationResult low = new Validator().validate(extraction("0.001", 0.9, null, null));
        assertEquals(List.of("Price unusually low (<0.01): 0.001"), low.warnings());
    }

    @Test
    void testTitleLength() {
        ValidationResult shortTitle = new Validator().validate(extraction("1990.00", 0.9, "TV", null));
        assertEquals(List.of("Title too short (2 chars)"), shortTitle.warnings());

        ValidationResult longTitle = new Validator().validate(extraction("1990.00", 0.9, "x".repeat(501), null));
        assertEquals(List.of("Title too long (501 chars)"), longTitle.warnings());
    }

    @Test
    void testConfidenceBelowThreshold() {
        ValidationResult result = new Validator().validate(extraction("1990.00", 0.5, null, null));
        assertFalse(result.valid());
        assertEquals(0.5, result.confidence(), EPS);
        assertEquals(List.of("Confidence 0.50 below threshold 0.60"), result.errors());
    }

    @Test
    void testWarningPenaltyIsFlooredAtZero() {
        Validator harsh = new Validator(new ValidationSettings(0.0, 50.0, 1.0));
        ValidationResult result = harsh.validate(extraction("1990.00", 0.9, "TV", null));
        assertEquals(0.0, result.confidence());
        assertTrue(result.valid());
    }

    @Test
    void testAbsentFieldsDoNotLowerConfidence() {
        Map<String, ExtractedField> fields = new LinkedHashMap<>();
        fields.put("price", new ExtractedField("1990.00", SelectorType.STRUCTURED_QUERY, 0.9));
        fields.put("model_number", ExtractedField.absent());
        ValidationResult result = new Validator().validate(new ExtractionResult(fields));
        assertEquals(0.9, result.confidence(), EPS);
    }

    @Test
    void testIsAvailable() {
        assertTrue(Validator.isAvailable("På lager"));
        assertTrue(Validator.isAvailable("https://schema.org/InStock"));
        assertTrue(Validator.isAvailable("In stock - ships today"));
        assertFalse(Validator.isAvailable("Ikke på lager"));
        assertFalse(Validator.isAvailable("Currently unavailable"));
        assertFalse(Validator.isAvailable("Sold out"));
        assertFalse(Validator.isAvailable("Not available"));
        assertFalse(Validator.isAvailable("Ikke tilgjengelig"));
        assertFalse(Validator.isAvailable("Not available online"));
        assertFalse(Validator.isAvailable(null));
        assertFalse(Validator.isAvailable("Ring for info"));
    }

    @Test
    void testSettingsRejectOutOfRangeValues() {
        assertThrows(IllegalArgumentException.class, () -> new ValidationSettings(1.5, 50.0, 0.05));
        assertThrows(IllegalArgumentException.class, () -> new ValidationSettings(0.6, 0.0, 0.05));
        assertThrows(IllegalArgumentException.class, () -> new ValidationSettings(0.6, 50.0, -0.1));
    }
}
