package com.audico.pricelist.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Pricing settings for one ingestion batch, usually entered per supplier by an admin.
 *
 * <p>{@code vatRate} and {@code markup} are fractions: 0.15 means 15% VAT, 0.40 means a
 * 40% markup on the VAT-inclusive cost.
 */
public final class PricingConfig {
    public static final String DEFAULT_CURRENCY = "ZAR";

    private final PriceType priceType;
    private final double vatRate;
    private final double markup;
    private final String currency;

    /**
     * @throws InvalidPricingConfigException if the price type is missing, VAT is outside [0,1]
     *                                       or the markup is negative or not finite
     */
    @JsonCreator
    public PricingConfig(@JsonProperty("price_type") PriceType priceType,
                         @JsonProperty("vat_rate") double vatRate,
                         @JsonProperty("markup_pct") double markup,
                         @JsonProperty("currency") String currency) {
        if (priceType == null) {
            throw new InvalidPricingConfigException("price type is required");
        }
        if (Double.isNaN(vatRate) || vatRate < 0.0 || vatRate > 1.0) {
            throw new InvalidPricingConfigException("vat rate must be within [0,1], got " + vatRate);
        }
        if (Double.isNaN(markup) || Double.isInfinite(markup) || markup < 0.0) {
            throw new InvalidPricingConfigException("markup must be a non-negative number, got " + markup);
        }
        this.priceType = priceType;
        this.vatRate = vatRate;
        this.markup = markup;
        this.currency = (currency == null || currency.isBlank()) ? DEFAULT_CURRENCY : currency.trim();
    }

    public static PricingConfig of(PriceType priceType, double vatRate, double markup) {
        return new PricingConfig(priceType, vatRate, markup, DEFAULT_CURRENCY);
    }

    @JsonProperty("price_type")
    public PriceType getPriceType() { return priceType; }

    @JsonProperty("vat_rate")
    public double getVatRate() { return vatRate; }

    @JsonProperty("markup_pct")
    public double getMarkup() { return markup; }

    public String getCurrency() { return currency; }

    @Override
    public String toString() {
        return "PricingConfig{" + priceType.getLabel() + ", vat=" + vatRate + ", markup=" + markup + ", " + currency + "}";
    }
}
