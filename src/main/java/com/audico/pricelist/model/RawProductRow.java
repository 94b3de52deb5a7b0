package com.audico.pricelist.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One product line as read from a supplier sheet or catalog query, before reconciliation.
 *
 * <p>{@code specialPrice} is a plain number in the batch's quoted price type; whether a
 * special applies to a customer group is decided upstream and arrives as
 * {@code hasActiveSpecial}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class RawProductRow {
    private final String brand;
    private final String code;
    private final String name;
    private final String rawPriceText;
    private final String categoryLabel;
    private final int stockQty;
    private final boolean hasActiveSpecial;
    private final Double specialPrice;

    public RawProductRow(String brand, String code, String name, String rawPriceText, String categoryLabel,
                         int stockQty, boolean hasActiveSpecial, Double specialPrice) {
        this.brand = brand == null ? "" : brand.trim();
        this.code = code == null ? "" : code.trim();
        this.name = name == null ? "" : name.trim();
        this.rawPriceText = rawPriceText == null ? "" : rawPriceText;
        this.categoryLabel = categoryLabel == null ? "" : categoryLabel.trim();
        this.stockQty = stockQty;
        this.hasActiveSpecial = hasActiveSpecial;
        this.specialPrice = specialPrice;
    }

    public static RawProductRow regular(String brand, String code, String rawPriceText, String categoryLabel, int stockQty) {
        return new RawProductRow(brand, code, null, rawPriceText, categoryLabel, stockQty, false, null);
    }

    public static RawProductRow special(String brand, String code, String rawPriceText, String categoryLabel,
                                        int stockQty, double specialPrice) {
        return new RawProductRow(brand, code, null, rawPriceText, categoryLabel, stockQty, true, specialPrice);
    }

    public String getBrand() { return brand; }
    public String getCode() { return code; }
    public String getName() { return name; }
    public String getRawPriceText() { return rawPriceText; }
    public String getCategoryLabel() { return categoryLabel; }
    public int getStockQty() { return stockQty; }
    public boolean isHasActiveSpecial() { return hasActiveSpecial; }
    public Double getSpecialPrice() { return specialPrice; }

    /** Code when present, otherwise the product name. */
    public String codeOrName() {
        return code.isEmpty() ? name : code;
    }

    @Override
    public String toString() {
        return "RawProductRow{" + brand + " " + codeOrName() + ", price='" + rawPriceText + "', category=" + categoryLabel
                + ", stock=" + stockQty + (hasActiveSpecial ? ", special=" + specialPrice : "") + "}";
    }
}
