package com.audico.pricelist.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Reconciled catalog entry standing for every row that shares one fingerprint.
 *
 * <p>Instances are immutable; merging two records produces a new one
 * (see {@link com.audico.pricelist.service.reconcile.RecordMerger}).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ProductRecord {
    private static final int DISPLAY_CATEGORIES = 3;

    private final String fingerprint;
    private final String brand;
    private final String code;
    private final String name;
    /** Effective price: the special price when one is active, otherwise the regular price. */
    private final PriceOutcome price;
    private final PriceOutcome regularPrice;
    private final int stockQty;
    private final boolean hasActiveSpecial;
    private final Set<String> categories;

    public ProductRecord(String fingerprint, String brand, String code, String name,
                         PriceOutcome price, PriceOutcome regularPrice, int stockQty,
                         boolean hasActiveSpecial, Set<String> categories) {
        this.fingerprint = Objects.requireNonNull(fingerprint, "fingerprint");
        this.brand = brand == null ? "" : brand;
        this.code = code == null ? "" : code;
        this.name = name == null ? "" : name;
        this.price = Objects.requireNonNull(price, "price");
        this.regularPrice = regularPrice == null ? price : regularPrice;
        this.stockQty = stockQty;
        this.hasActiveSpecial = hasActiveSpecial;
        this.categories = Collections.unmodifiableSet(new LinkedHashSet<>(categories == null ? Set.of() : categories));
    }

    /** Same product fields, different category set. */
    public ProductRecord withCategories(Set<String> newCategories) {
        return new ProductRecord(fingerprint, brand, code, name, price, regularPrice, stockQty, hasActiveSpecial, newCategories);
    }

    public String getFingerprint() { return fingerprint; }
    public String getBrand() { return brand; }
    public String getCode() { return code; }
    public String getName() { return name; }
    public PriceOutcome getPrice() { return price; }
    public PriceOutcome getRegularPrice() { return regularPrice; }
    public int getStockQty() { return stockQty; }
    public boolean isHasActiveSpecial() { return hasActiveSpecial; }

    /** Categories in first-seen order. */
    public Set<String> getCategories() { return categories; }

    @JsonIgnore
    public boolean isInStock() { return stockQty > 0; }

    public String getDisplayName() {
        if (!name.isEmpty()) return name;
        return (brand + " " + code).trim();
    }

    public int getCategoryCount() { return categories.size(); }

    /** First three categories joined by ", " with a "+N more" suffix. */
    public String getCategoriesDisplay() {
        List<String> all = new ArrayList<>(categories);
        String shown = String.join(", ", all.subList(0, Math.min(DISPLAY_CATEGORIES, all.size())));
        if (all.size() > DISPLAY_CATEGORIES) {
            shown += " +" + (all.size() - DISPLAY_CATEGORIES) + " more";
        }
        return shown;
    }

    /** Retail saving of the active special over the regular price, or null. */
    public Double getSavings() {
        if (!hasActiveSpecial || !price.isPriced() || !regularPrice.isPriced()) return null;
        double s = regularPrice.getTriple().getRetailInclVat() - price.getTriple().getRetailInclVat();
        return s > 0 ? s : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProductRecord r)) return false;
        return stockQty == r.stockQty && hasActiveSpecial == r.hasActiveSpecial
                && fingerprint.equals(r.fingerprint) && brand.equals(r.brand) && code.equals(r.code)
                && name.equals(r.name) && price.equals(r.price) && regularPrice.equals(r.regularPrice)
                && new ArrayList<>(categories).equals(new ArrayList<>(r.categories));
    }

    @Override
    public int hashCode() {
        return Objects.hash(fingerprint, brand, code, name, price, regularPrice, stockQty, hasActiveSpecial, new ArrayList<>(categories));
    }

    @Override
    public String toString() {
        return "ProductRecord{" + fingerprint + " " + getDisplayName() + ", " + price + ", stock=" + stockQty
                + (hasActiveSpecial ? ", special" : "") + ", categories=" + categories + "}";
    }
}
