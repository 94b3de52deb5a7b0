package com.audico.pricelist.model;

/**
 * Semantic role of one column inside a {@link BrandSegment}.
 */
public enum ColumnRole {
    PRODUCT_CODE,
    PRICE,
    RETAIL_PRICE,
    /** Product name or description text. */
    DESCRIPTION,
    UNKNOWN
}
