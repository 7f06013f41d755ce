package com.pricetracker.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Judges whether an {@link ExtractionResult} can be trusted.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Hard errors invalidate the result: missing price, non-numeric or non-positive price,
 *       aggregate confidence below {@link ValidationSettings#minConfidence()}.</li>
 *   <li>Warnings never invalidate on their own: implausible price magnitude, odd title length,
 *       and suspicious changes against the previous known-good extraction.</li>
 *   <li>Aggregate confidence is the flat mean of the declared confidence of every resolved field,
 *       minus a penalty per warning, floored at 0 and rounded to two decimals. Any hard error
 *       found before the threshold check forces it to 0.</li>
 * </ul>
 * <p>
 * The validator never throws; malformed input is reported as errors in the returned result.
 *
 * @author Price Tracker Team
 * @since 1.0
 */
public class Validator {
    private static final Logger logger = LoggerFactory.getLogger(Validator.class);

    static final BigDecimal HIGH_PRICE = new BigDecimal("100000");
    static final BigDecimal LOW_PRICE = new BigDecimal("0.01");
    static final int MIN_TITLE_LENGTH = 3;
    static final int MAX_TITLE_LENGTH = 500;

    private static final List<String> OUT_OF_STOCK_MARKERS = List.of(
        "out of stock", "out-of-stock", "outofstock", "unavailable", "not available", "sold out",
        "utsolgt", "ikke på lager", "ikke tilgjengelig"
    );
    private static final List<String> IN_STOCK_MARKERS = List.of(
        "in stock", "in-stock", "instock", "available", "på lager"
    );

    private final ValidationSettings settings;

    public Validator(ValidationSettings settings) {
        this.settings = settings == null ? ValidationSettings.defaults() : settings;
        logger.info("Validator initialized: minConfidence={}, maxPriceChangePct={}, warningPenalty={}",
            this.settings.minConfidence(), this.settings.maxPriceChangePct(), this.settings.warningPenalty());
    }

    public Validator() {
        this(ValidationSettings.defaults());
    }

    public ValidationSettings settings() {
        return settings;
    }

    /**
     * Validates an extraction, optionally against the previous successful one.
     * @param extraction current extraction (may be null)
     * @param previous last known-good extraction for the same listing (may be null)
     * @return verdict with errors, warnings and aggregate confidence
     */
    public ValidationResult validate(ExtractionResult extraction, ExtractionResult previous) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        if (extraction == null) {
            errors.add("Price not found");
            return finish(errors, warnings, 0.0);
        }

        validatePrice(extraction.price(), errors, warnings);
        validateTitle(extraction.title(), warnings);
        if (previous != null) {
            warnings.addAll(checkSuspiciousChanges(extraction, previous));
        }

        double confidence = errors.isEmpty() ? calculateConfidence(extraction, warnings.size()) : 0.0;
        if (confidence < settings.minConfidence()) {
            errors.add(String.format(Locale.ROOT, "Confidence %.2f below threshold %.2f", confidence, settings.minConfidence()));
        }
        return finish(errors, warnings, confidence);
    }

    public ValidationResult validate(ExtractionResult extraction) {
        return validate(extraction, null);
    }

    private ValidationResult finish(List<String> errors, List<String> warnings, double confidence) {
        boolean valid = errors.isEmpty();
        logger.info("Validation completed: valid={}, confidence={}, errors={}, warnings={}",
            valid, confidence, errors.size(), warnings.size());
        if (!valid) {
            logger.debug("Validation errors: {}", errors);
        }
        return new ValidationResult(valid, errors, warnings, confidence);
    }

    private void validatePrice(ExtractedField price, List<String> errors, List<String> warnings) {
        if (price == null || !price.isPresent() || price.value().isBlank()) {
            errors.add("Price not found");
            return;
        }
        Optional<BigDecimal> amount = parsePrice(price.value());
        if (amount.isEmpty()) {
            errors.add("Invalid price format: '" + price.value() + "'");
            return;
        }
        BigDecimal value = amount.get();
        if (value.signum() <= 0) {
            errors.add("Price is zero or negative: " + value.toPlainString());
        } else if (value.compareTo(HIGH_PRICE) > 0) {
            warnings.add("Price unusually high (>" + HIGH_PRICE.toPlainString() + "): " + value.toPlainString());
        } else if (value.compareTo(LOW_PRICE) < 0) {
            warnings.add("Price unusually low (<" + LOW_PRICE.toPlainString() + "): " + value.toPlainString());
        }
    }

    private void validateTitle(ExtractedField title, List<String> warnings) {
        if (title == null || !title.isPresent()) {
            return;
        }
        int length = title.value().length();
        if (length < MIN_TITLE_LENGTH) {
            warnings.add("Title too short (" + length + " chars)");
        } else if (length > MAX_TITLE_LENGTH) {
            warnings.add("Title too long (" + length + " chars)");
        }
    }

    private List<String> checkSuspiciousChanges(ExtractionResult current, ExtractionResult previous) {
        List<String> warnings = new ArrayList<>();

        Optional<BigDecimal> currentPrice = current.price().isPresent() ? parsePrice(current.price().value()) : Optional.empty();
        Optional<BigDecimal> previousPrice = previous.price().isPresent() ? parsePrice(previous.price().value()) : Optional.empty();
        if (currentPrice.isPresent() && previousPrice.isPresent() && previousPrice.get().signum() > 0) {
            BigDecimal prev = previousPrice.get();
            BigDecimal curr = currentPrice.get();
            double changePct = curr.subtract(prev).abs()
                .divide(prev, MathContext.DECIMAL64)
                .multiply(BigDecimal.valueOf(100))
                .doubleValue();
            if (changePct > settings.maxPriceChangePct()) {
                warnings.add(String.format(Locale.ROOT, "Price changed by %.1f%% (%s -> %s)",
                    changePct, prev.toPlainString(), curr.toPlainString()));
            }
        }

        String currentTitle = current.title().value();
        String previousTitle = previous.title().value();
        if (currentTitle != null && previousTitle != null && !currentTitle.equals(previousTitle)) {
            warnings.add("Product title changed");
        }

        if (current.availability().isPresent() && previous.availability().isPresent()) {
            boolean nowAvailable = isAvailable(current.availability().value());
            boolean wasAvailable = isAvailable(previous.availability().value());
            if (nowAvailable != wasAvailable) {
                warnings.add("Availability changed: " + (nowAvailable ? "back in stock" : "out of stock"));
            }
        }
        return warnings;
    }

    private double calculateConfidence(ExtractionResult extraction, int warningCount) {
        double sum = 0.0;
        int resolved = 0;
        for (ExtractedField field : extraction.fields().values()) {
            if (field.isResolved()) {
                sum += field.confidence();
                resolved++;
            }
        }
        if (resolved == 0) {
            return 0.0;
        }
        double penalized = Math.max(0.0, sum / resolved - warningCount * settings.warningPenalty());
        return BigDecimal.valueOf(penalized).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * Parses a price value. Canonical values parse directly; anything else goes through price cleaning.
     * @param value extracted price text
     * @return numeric amount, or empty when no amount can be read
     */
    static Optional<BigDecimal> parsePrice(String value) {
        if (value == null) return Optional.empty();
        try {
            return Optional.of(new BigDecimal(value.trim()));
        } catch (NumberFormatException e) {
            return FieldValueNormalizer.cleanPrice(value);
        }
    }

    /**
     * Reads an availability text as in stock or not.
     * Out-of-stock markers win, so "unavailable" is not mistaken for "available".
     * @param availability extracted availability text (may be null)
     * @return true when the text signals the product can be bought
     */
    public static boolean isAvailable(String availability) {
        if (availability == null) return false;
        String text = availability.toLowerCase(Locale.ROOT);
        for (String marker : OUT_OF_STOCK_MARKERS) {
            if (text.contains(marker)) return false;
        }
        for (String marker : IN_STOCK_MARKERS) {
            if (text.contains(marker)) return true;
        }
        return false;
    }
}
