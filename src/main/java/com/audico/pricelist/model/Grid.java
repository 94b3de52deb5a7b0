package com.audico.pricelist.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable rows x columns view of an extracted spreadsheet or document page.
 *
 * <p>Cells are optional text values exactly as the upstream extractor produced them
 * (original spacing and punctuation intact). Rows may be ragged; reading outside a
 * row returns {@code null} rather than failing.
 */
public final class Grid {
    private final List<List<String>> rows;
    private final int width;

    private Grid(List<List<String>> rows) {
        List<List<String>> copy = new ArrayList<>(rows.size());
        int w = 0;
        for (List<String> row : rows) {
            List<String> r = row == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(row));
            copy.add(r);
            w = Math.max(w, r.size());
        }
        this.rows = Collections.unmodifiableList(copy);
        this.width = w;
    }

    public static Grid of(List<? extends List<String>> rows) {
        if (rows == null) return new Grid(List.of());
        return new Grid(new ArrayList<>(rows));
    }

    /** Convenience factory for tests and small inline grids. */
    @SafeVarargs
    public static Grid ofRows(List<String>... rows) {
        return of(List.of(rows));
    }

    public int rowCount() { return rows.size(); }

    /** Width of the widest row. */
    public int width() { return width; }

    public List<String> row(int rowIndex) {
        if (rowIndex < 0 || rowIndex >= rows.size()) return List.of();
        return rows.get(rowIndex);
    }

    /** Raw cell text, or {@code null} when the cell is absent. */
    public String cell(int rowIndex, int colIndex) {
        List<String> row = row(rowIndex);
        if (colIndex < 0 || colIndex >= row.size()) return null;
        return row.get(colIndex);
    }

    /** Trimmed cell text; empty string for absent or blank cells. */
    public String text(int rowIndex, int colIndex) {
        String c = cell(rowIndex, colIndex);
        return c == null ? "" : c.replace('\u00A0', ' ').trim();
    }

    public boolean isBlank(int rowIndex, int colIndex) {
        return text(rowIndex, colIndex).isEmpty();
    }

    public int nonEmptyCount(int rowIndex) {
        int n = 0;
        List<String> row = row(rowIndex);
        for (int c = 0; c < row.size(); c++) {
            if (!isBlank(rowIndex, c)) n++;
        }
        return n;
    }
}
