package com.audico.pricelist.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Cost and retail prices of one product, all derived from a single quoted number.
 * Values are unrounded; presentation rounding is the consumer's job.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PriceTriple {
    private final double costExclVat;
    private final double costInclVat;
    private final double retailInclVat;
    /** Null when the retail price is not positive. */
    private final Double marginPct;

    public PriceTriple(double costExclVat, double costInclVat, double retailInclVat, Double marginPct) {
        this.costExclVat = costExclVat;
        this.costInclVat = costInclVat;
        this.retailInclVat = retailInclVat;
        this.marginPct = marginPct;
    }

    public double getCostExclVat() { return costExclVat; }
    public double getCostInclVat() { return costInclVat; }
    public double getRetailInclVat() { return retailInclVat; }
    public Double getMarginPct() { return marginPct; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PriceTriple t)) return false;
        return Double.compare(costExclVat, t.costExclVat) == 0
                && Double.compare(costInclVat, t.costInclVat) == 0
                && Double.compare(retailInclVat, t.retailInclVat) == 0
                && Objects.equals(marginPct, t.marginPct);
    }

    @Override
    public int hashCode() {
        return Objects.hash(costExclVat, costInclVat, retailInclVat, marginPct);
    }

    @Override
    public String toString() {
        return String.format(java.util.Locale.ROOT, "PriceTriple{excl=%.2f, incl=%.2f, retail=%.2f, margin=%s}",
                costExclVat, costInclVat, retailInclVat, marginPct == null ? "-" : String.format(java.util.Locale.ROOT, "%.2f", marginPct));
    }
}
