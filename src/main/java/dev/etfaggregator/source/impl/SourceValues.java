package dev.etfaggregator.source.impl;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Set;

/**
 * Lenient value decoding for upstream payloads. Unparseable values become null.
 */
final class SourceValues {

    private static final Set<String> PLACEHOLDERS = Set.of("", "-", "--", "N/A", "n/a", "NA");
    private static final DateTimeFormatter DISPLAY_DATE = DateTimeFormatter.ofPattern("MMM d, uuuu", Locale.US);

    private SourceValues() {
    }

    /**
     * Text of a field, or null when absent, null or blank.
     */
    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    static BigDecimal decimal(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        if (value.isTextual()) {
            return decimal(value.asText());
        }
        return null;
    }

    static BigDecimal decimal(String text) {
        if (text == null) {
            return null;
        }
        String cleaned = text.trim().replace(",", "").replace("%", "").replace("$", "");
        if (PLACEHOLDERS.contains(cleaned)) {
            return null;
        }
        try {
            return new BigDecimal(cleaned);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * ISO date, optionally followed by a time part ("2022-02-15T00:00:00").
     */
    static LocalDate isoDate(String text) {
        if (text == null || text.length() < 10) {
            return null;
        }
        try {
            return LocalDate.parse(text.substring(0, 10));
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Display date such as "Sep 4, 2015".
     */
    static LocalDate displayDate(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(text.trim(), DISPLAY_DATE);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * First non-null value.
     */
    static BigDecimal firstOf(BigDecimal preferred, BigDecimal fallback) {
        return preferred != null ? preferred : fallback;
    }
}
