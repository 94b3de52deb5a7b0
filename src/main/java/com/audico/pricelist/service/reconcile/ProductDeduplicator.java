package com.audico.pricelist.service.reconcile;

import com.audico.pricelist.model.PriceOutcome;
import com.audico.pricelist.model.PricingConfig;
import com.audico.pricelist.model.ProductRecord;
import com.audico.pricelist.model.RawProductRow;
import com.audico.pricelist.service.pricing.PriceNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Set;

/**
 * Reconciles raw rows into one {@link ProductRecord} per physical product.
 *
 * <p>Each row is first turned into a single-row record (fingerprint, normalized regular and
 * effective price, one category), then folded into a {@link ProductCatalog}. The fold is a
 * pure reduction, so {@link #reconcileParallel} returns the same catalog contents as
 * {@link #reconcile} up to category order.
 */
public class ProductDeduplicator {
    private static final Logger log = LoggerFactory.getLogger(ProductDeduplicator.class);

    private final ProductFingerprinter fingerprinter;
    private final PriceNormalizer priceNormalizer;
    private final String defaultCategory;

    public ProductDeduplicator(ProductFingerprinter fingerprinter, PriceNormalizer priceNormalizer, String defaultCategory) {
        this.fingerprinter = fingerprinter;
        this.priceNormalizer = priceNormalizer;
        this.defaultCategory = defaultCategory == null || defaultCategory.isBlank() ? "Uncategorized" : defaultCategory;
    }

    public ProductCatalog reconcile(Collection<RawProductRow> rows, PricingConfig config) {
        return reconcileInto(new ProductCatalog(), rows, config);
    }

    /** Folds {@code rows} into an existing catalog and returns it. */
    public ProductCatalog reconcileInto(ProductCatalog catalog, Collection<RawProductRow> rows, PricingConfig config) {
        int before = catalog.size();
        for (RawProductRow row : rows) {
            catalog.add(toRecord(row, config));
        }
        log.info("Reconciled {} rows into {} records ({} new)", rows.size(), catalog.size(), catalog.size() - before);
        return catalog;
    }

    public ProductCatalog reconcileParallel(Collection<RawProductRow> rows, PricingConfig config) {
        return rows.parallelStream()
                .map(r -> toRecord(r, config))
                .collect(ProductCatalog.collector());
    }

    /**
     * Single-row record. A special counts only when flagged active and its price is
     * positive and below the regular quoted price; the effective price is then the
     * special price, otherwise the regular one.
     */
    public ProductRecord toRecord(RawProductRow row, PricingConfig config) {
        String brand = fingerprinter.resolveBrand(row);
        String fingerprint = fingerprinter.fingerprint(brand, row.codeOrName());
        PriceOutcome regular = priceNormalizer.normalize(row.getRawPriceText(), config);
        PriceOutcome effective = regular;
        boolean special = false;
        if (hasUsableSpecial(row, regular)) {
            effective = priceNormalizer.normalize(row.getSpecialPrice(), config);
            special = true;
        } else if (row.isHasActiveSpecial()) {
            log.debug("Special {} ignored for {} (regular {})", row.getSpecialPrice(), row.codeOrName(), regular);
        }
        String category = row.getCategoryLabel().isEmpty() ? defaultCategory : row.getCategoryLabel();
        return new ProductRecord(fingerprint, brand, row.getCode(), row.getName(), effective, regular,
                row.getStockQty(), special, Set.of(category));
    }

    /** Flagged active with a finite, positive special price. */
    public static boolean hasSpecialPrice(RawProductRow row) {
        Double sp = row.getSpecialPrice();
        return row.isHasActiveSpecial() && sp != null && Double.isFinite(sp) && sp > 0;
    }

    /**
     * A special applies when it has a price strictly below the regular quoted value.
     * An unpriced regular price puts no upper bound on the special.
     */
    public static boolean hasUsableSpecial(RawProductRow row, PriceOutcome regular) {
        if (!hasSpecialPrice(row)) return false;
        return !regular.isPriced() || row.getSpecialPrice() < regular.getSourceValue();
    }
}
