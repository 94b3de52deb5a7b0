package com.audico.pricelist.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Which of the three prices a supplier sheet quotes; the other two are derived.
 */
public enum PriceType {
    COST_EXCL_VAT("cost_excl_vat"),
    COST_INCL_VAT("cost_incl_vat"),
    RETAIL_INCL_VAT("retail_incl_vat");

    private final String label;

    PriceType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Accepts the snake-case labels used in supplier settings as well as enum names.
     *
     * @throws InvalidPricingConfigException for unknown labels
     */
    @JsonCreator
    public static PriceType fromLabel(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidPricingConfigException("price type is required");
        }
        String v = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (PriceType t : values()) {
            if (t.label.equals(v) || t.name().toLowerCase(Locale.ROOT).equals(v)) return t;
        }
        throw new InvalidPricingConfigException("unknown price type '" + value + "'");
    }
}
