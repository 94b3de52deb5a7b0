package com.audico.pricelist.model;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Ordered, duplicate-free rewrites of one search query. Built per query, never stored.
 * The query itself always comes first, even when blank; blank rewrites are dropped.
 */
public final class SearchVariantSet implements Iterable<String> {
    private final String query;
    private final List<String> variants;

    public SearchVariantSet(String query, List<String> candidates) {
        LinkedHashSet<String> unique = new LinkedHashSet<>();
        if (query != null && !query.isEmpty()) unique.add(query);
        for (String c : candidates) {
            if (c != null && !c.isBlank()) unique.add(c);
        }
        this.query = query;
        this.variants = Collections.unmodifiableList(List.copyOf(unique));
    }

    public String getQuery() { return query; }

    public List<String> getVariants() { return variants; }

    public boolean contains(String variant) { return variants.contains(variant); }

    public int size() { return variants.size(); }

    public boolean isEmpty() { return variants.isEmpty(); }

    @Override
    public Iterator<String> iterator() { return variants.iterator(); }

    @Override
    public String toString() { return variants.toString(); }
}
