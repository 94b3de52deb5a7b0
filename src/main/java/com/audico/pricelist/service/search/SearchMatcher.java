package com.audico.pricelist.service.search;

import com.audico.pricelist.model.ProductRecord;
import com.audico.pricelist.model.SearchVariantSet;
import com.audico.pricelist.service.reconcile.ProductCatalog;
import com.audico.pricelist.service.reconcile.RecordPreference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Finds catalog records for a free-text query.
 *
 * <p>A record matches when any query variant is a substring of its display name, name,
 * code or brand (case-insensitive).
 *
 * <p>Matches are ranked in stock first, then active specials, then by ascending effective
 * price with unpriced records last. The sort is stable, so ties keep catalog order.
 */
public class SearchMatcher {
    private static final Logger log = LoggerFactory.getLogger(SearchMatcher.class);

    public static final Comparator<ProductRecord> RANKING = Comparator
            .comparing((ProductRecord r) -> !r.isInStock())
            .thenComparing(r -> !r.isHasActiveSpecial())
            .thenComparingDouble(r -> RecordPreference.priceKey(r.getPrice()));

    private final SearchVariantExpander expander;

    public SearchMatcher(SearchVariantExpander expander) {
        this.expander = expander;
    }

    public SearchVariantSet expand(String query) {
        return expander.expand(query);
    }

    public List<ProductRecord> match(String query, ProductCatalog catalog) {
        return match(query, catalog.getRecords(), Integer.MAX_VALUE);
    }

    public List<ProductRecord> match(String query, Collection<ProductRecord> catalog) {
        return match(query, catalog, Integer.MAX_VALUE);
    }

    public List<ProductRecord> match(String query, Collection<ProductRecord> catalog, int limit) {
        SearchVariantSet variants = expander.expand(query);
        List<String> needles = new ArrayList<>();
        for (String v : variants) {
            if (!v.isBlank()) needles.add(v.toLowerCase(Locale.ROOT));
        }
        List<ProductRecord> hits = new ArrayList<>();
        for (ProductRecord r : catalog) {
            if (matches(r, needles)) hits.add(r);
        }
        hits.sort(RANKING);
        List<ProductRecord> out = hits.size() > limit ? hits.subList(0, Math.max(0, limit)) : hits;
        log.debug("Search '{}' with {} variants matched {} of {} records", query, needles.size(), hits.size(), catalog.size());
        return List.copyOf(out);
    }

    static boolean matches(ProductRecord record, List<String> needles) {
        String[] fields = {
                record.getDisplayName(), record.getName(), record.getCode(), record.getBrand()
        };
        for (String field : fields) {
            if (field == null || field.isEmpty()) continue;
            String haystack = field.toLowerCase(Locale.ROOT);
            for (String n : needles) {
                if (haystack.contains(n)) return true;
            }
        }
        return false;
    }
}
