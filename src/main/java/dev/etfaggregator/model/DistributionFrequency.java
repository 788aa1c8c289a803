package dev.etfaggregator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How often a fund pays distributions.
 */
public enum DistributionFrequency {

    WEEKLY("Weekly"),
    MONTHLY("Monthly"),
    QUARTERLY("Quarterly"),
    SEMI_ANNUAL("Semi-Annual"),
    ANNUAL("Annual"),
    VARIABLE("Variable"),
    NONE("None"),
    UNKNOWN("Unknown");

    private final String label;

    DistributionFrequency(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static DistributionFrequency fromLabel(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        for (DistributionFrequency frequency : values()) {
            if (frequency.label.equalsIgnoreCase(value) || frequency.name().equalsIgnoreCase(value)) {
                return frequency;
            }
        }
        return UNKNOWN;
    }

    /**
     * Map free-form upstream text ("Paid Monthly", "QUARTERLY", "semi-annually") to a frequency.
     * Order matters: "Semi-Annual" must win over "Annual".
     */
    public static DistributionFrequency fromText(String text) {
        if (text == null || text.isBlank()) {
            return UNKNOWN;
        }
        String upper = text.toUpperCase(Locale.ROOT);
        if (upper.contains("MONTH")) {
            return MONTHLY;
        }
        if (upper.contains("QUARTER")) {
            return QUARTERLY;
        }
        if (upper.contains("SEMI") || upper.contains("HALF")) {
            return SEMI_ANNUAL;
        }
        if (upper.contains("ANNUAL") || upper.contains("YEAR")) {
            return ANNUAL;
        }
        if (upper.contains("WEEK")) {
            return WEEKLY;
        }
        if (upper.contains("VAR")) {
            return VARIABLE;
        }
        if (upper.contains("NONE") || upper.equals("NO")) {
            return NONE;
        }
        return UNKNOWN;
    }
}
