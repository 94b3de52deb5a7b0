package com.audico.pricelist.service.reconcile;

import com.audico.pricelist.model.PriceOutcome;
import com.audico.pricelist.model.ProductRecord;

import java.util.Comparator;

/**
 * Orders candidate records for the same fingerprint, best first.
 *
 * <ol>
 *   <li>an active special beats none</li>
 *   <li>between two specials, the lower special price</li>
 *   <li>in stock beats out of stock</li>
 *   <li>the lower regular price (unpriced sorts last)</li>
 *   <li>higher stock, then brand, code, name and raw price text</li>
 * </ol>
 *
 * <p>The trailing keys cover every remaining field, so two records compare equal only when
 * their price and stock fields are identical. Picking the minimum is therefore independent
 * of the order in which rows arrive.
 */
public final class RecordPreference {
    private RecordPreference() {}

    public static final Comparator<ProductRecord> BEST_FIRST = Comparator
            .comparing((ProductRecord r) -> !r.isHasActiveSpecial())
            .thenComparingDouble(r -> r.isHasActiveSpecial() ? priceKey(r.getPrice()) : 0.0)
            .thenComparing(r -> !r.isInStock())
            .thenComparingDouble(r -> priceKey(r.getRegularPrice()))
            .thenComparing(Comparator.comparingInt(ProductRecord::getStockQty).reversed())
            .thenComparing(ProductRecord::getBrand)
            .thenComparing(ProductRecord::getCode)
            .thenComparing(ProductRecord::getName)
            .thenComparing(r -> String.valueOf(r.getRegularPrice().getRawText()))
            .thenComparing(r -> String.valueOf(r.getPrice().getRawText()));

    /** Cost excl VAT of a priced outcome; unpriced sorts after every real price. */
    public static double priceKey(PriceOutcome outcome) {
        if (outcome == null || !outcome.isPriced()) return Double.POSITIVE_INFINITY;
        return outcome.getTriple().getCostExclVat();
    }
}
