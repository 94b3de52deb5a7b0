package com.audico.pricelist.service.reconcile;

import com.audico.pricelist.model.ProductRecord;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collector;

/**
 * Caller-owned reconciled catalog: one {@link ProductRecord} per fingerprint, in first-seen
 * order.
 *
 * <p>This is the accumulator of the reconciliation fold. {@link #add} and {@link #combine}
 * both delegate to {@link RecordMerger#merge}, which is associative and commutative on
 * everything but category order, so partial catalogs built from separate chunks can be
 * combined in any order. Not thread-safe; parallel use goes through {@link #collector()}.
 */
public class ProductCatalog {
    private final Map<String, ProductRecord> records = new LinkedHashMap<>();

    public ProductCatalog() {}

    public ProductCatalog(Collection<ProductRecord> initial) {
        initial.forEach(this::add);
    }

    /** Folds one record in, merging with the record already holding its fingerprint. */
    public ProductCatalog add(ProductRecord record) {
        records.merge(record.getFingerprint(), record, RecordMerger::merge);
        return this;
    }

    /** Folds every record of {@code other} into this catalog and returns this. */
    public ProductCatalog combine(ProductCatalog other) {
        other.records.values().forEach(this::add);
        return this;
    }

    public Optional<ProductRecord> get(String fingerprint) {
        return Optional.ofNullable(records.get(fingerprint));
    }

    public List<ProductRecord> getRecords() {
        return List.copyOf(records.values());
    }

    public Map<String, ProductRecord> asMap() {
        return Collections.unmodifiableMap(records);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /** Collects records into a new catalog; safe for parallel streams. */
    public static Collector<ProductRecord, ProductCatalog, ProductCatalog> collector() {
        return Collector.of(ProductCatalog::new, ProductCatalog::add, ProductCatalog::combine);
    }

    @Override
    public String toString() {
        return "ProductCatalog{" + records.size() + " records}";
    }
}
