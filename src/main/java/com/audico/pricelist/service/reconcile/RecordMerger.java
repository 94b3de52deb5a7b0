package com.audico.pricelist.service.reconcile;

import com.audico.pricelist.model.ProductRecord;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Pure, order-independent merge of two records sharing a fingerprint.
 *
 * <p>Price and stock fields come from the record {@link RecordPreference#BEST_FIRST}
 * prefers; categories are always the union, left operand's first.
 */
public final class RecordMerger {
    private RecordMerger() {}

    public static ProductRecord merge(ProductRecord current, ProductRecord incoming) {
        if (!current.getFingerprint().equals(incoming.getFingerprint())) {
            throw new IllegalArgumentException("Cannot merge records with different fingerprints: "
                    + current.getFingerprint() + " vs " + incoming.getFingerprint());
        }
        ProductRecord winner = RecordPreference.BEST_FIRST.compare(incoming, current) < 0 ? incoming : current;
        Set<String> categories = new LinkedHashSet<>(current.getCategories());
        categories.addAll(incoming.getCategories());
        return winner.withCategories(categories);
    }
}
