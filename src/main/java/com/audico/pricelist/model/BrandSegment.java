package com.audico.pricelist.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Contiguous column range of a sheet belonging to one brand, together with the
 * roles resolved for the columns inside it.
 *
 * <p>{@code endColumn} may point past the last physical column (the default span of a
 * trailing segment); readers clamp against the grid width.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BrandSegment {
    private final String brandName;
    private final int startColumn;
    private final int endColumn;
    private final int headerRow;
    private final Map<Integer, ColumnRole> roles;

    public BrandSegment(String brandName, int startColumn, int endColumn, int headerRow,
                        Map<Integer, ColumnRole> roles) {
        if (startColumn > endColumn) {
            throw new IllegalArgumentException("startColumn " + startColumn + " > endColumn " + endColumn);
        }
        this.brandName = brandName == null ? "" : brandName;
        this.startColumn = startColumn;
        this.endColumn = endColumn;
        this.headerRow = headerRow;
        this.roles = Collections.unmodifiableMap(new LinkedHashMap<>(roles == null ? Map.of() : roles));
    }

    public String getBrandName() { return brandName; }
    public int getStartColumn() { return startColumn; }
    public int getEndColumn() { return endColumn; }
    public int getHeaderRow() { return headerRow; }
    public Map<Integer, ColumnRole> getRoles() { return roles; }

    public ColumnRole roleOf(int column) {
        return roles.getOrDefault(column, ColumnRole.UNKNOWN);
    }

    /** Lowest column index carrying the role, if any. */
    public OptionalInt columnFor(ColumnRole role) {
        return roles.entrySet().stream()
                .filter(e -> e.getValue() == role)
                .mapToInt(Map.Entry::getKey)
                .min();
    }

    public boolean hasRole(ColumnRole role) {
        return columnFor(role).isPresent();
    }

    /** Rows can only be extracted from segments that know both code and price columns. */
    @JsonIgnore
    public boolean isExtractable() {
        return hasRole(ColumnRole.PRODUCT_CODE) && hasRole(ColumnRole.PRICE);
    }

    @Override
    public String toString() {
        return "BrandSegment{" + brandName + " [" + startColumn + ".." + endColumn + "] header=" + headerRow + " roles=" + roles + "}";
    }
}
