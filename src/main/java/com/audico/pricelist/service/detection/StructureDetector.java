package com.audico.pricelist.service.detection;

import com.audico.pricelist.config.DetectionRules;
import com.audico.pricelist.model.BrandSegment;
import com.audico.pricelist.model.ColumnRole;
import com.audico.pricelist.model.Grid;
import com.audico.pricelist.model.Layout;
import com.audico.pricelist.model.Structure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Infers the layout of an unlabeled pricelist grid and maps its columns to roles.
 *
 * <h3>Horizontal (multi-brand) sheets</h3>
 * <ol>
 *   <li>The first of rows 0-4 holding at least two brand tokens is the brand row, unless a
 *       row resolving two or more column roles comes first</li>
 *   <li>Each brand owns the columns up to the next brand, or {@value #DEFAULT_SEGMENT_SPAN}
 *       more columns for the last one</li>
 *   <li>Column headers are read from the two rows under the brand row</li>
 *   <li>Data starts two rows below the brand row</li>
 * </ol>
 *
 * <h3>Vertical (single-brand) sheets</h3>
 * <p>Without a brand row the whole width is one implicit segment. Its header row is the one
 * among the first three that resolves the most roles; data starts at the first later row
 * with two or more filled cells.
 *
 * <p>Detection never throws for odd input. A structure without a usable code + price
 * segment comes back with {@code valid == false} so the caller can offer manual mapping.
 */
public class StructureDetector {
    private static final Logger log = LoggerFactory.getLogger(StructureDetector.class);

    static final int BRAND_SCAN_ROWS = 5;
    static final int MIN_BRANDS_IN_ROW = 2;
    static final int MIN_HEADER_ROLES = 2;
    static final int DEFAULT_SEGMENT_SPAN = 3;
    static final int HEADER_DEPTH = 2;
    static final int VERTICAL_HEADER_ROWS = 3;
    static final int VERTICAL_DATA_SCAN_ROWS = 10;

    private final HeaderRoleMatcher roleMatcher;
    private final BrandTokenPredicate brandToken;

    public StructureDetector(DetectionRules rules) {
        this.roleMatcher = new HeaderRoleMatcher(rules);
        this.brandToken = new BrandTokenPredicate(rules, roleMatcher);
    }

    public HeaderRoleMatcher getRoleMatcher() {
        return roleMatcher;
    }

    public Structure detect(Grid grid) {
        OptionalInt brandRow = findBrandRow(grid);
        Structure structure = brandRow.isPresent()
                ? detectHorizontal(grid, brandRow.getAsInt())
                : detectVertical(grid);
        log.info("Detected {} layout: {} segment(s), dataStartRow={}, valid={}",
                structure.getLayout(), structure.getSegments().size(), structure.getDataStartRow(), structure.isValid());
        if (log.isDebugEnabled()) {
            for (BrandSegment s : structure.getSegments()) {
                log.debug("  {}", s);
            }
        }
        return structure;
    }

    /**
     * Index of the first early row with enough brand tokens. Scanning stops at a row that
     * already reads as a column header, since rows below it are data.
     */
    OptionalInt findBrandRow(Grid grid) {
        int limit = Math.min(BRAND_SCAN_ROWS, grid.rowCount());
        int lastCol = Math.max(0, grid.width() - 1);
        for (int r = 0; r < limit; r++) {
            if (distinctRoles(resolveRoles(grid, 0, lastCol, r, r)) >= MIN_HEADER_ROLES) {
                return OptionalInt.empty();
            }
            if (brandColumns(grid, r).size() >= MIN_BRANDS_IN_ROW) {
                return OptionalInt.of(r);
            }
        }
        return OptionalInt.empty();
    }

    private Map<Integer, String> brandColumns(Grid grid, int row) {
        Map<Integer, String> found = new LinkedHashMap<>();
        List<String> cells = grid.row(row);
        for (int c = 0; c < cells.size(); c++) {
            String text = grid.text(row, c);
            if (brandToken.test(text)) {
                found.put(c, text.replaceAll("\\s+", " "));
            }
        }
        return found;
    }

    private Structure detectHorizontal(Grid grid, int brandRow) {
        Map<Integer, String> brands = brandColumns(grid, brandRow);
        List<Integer> starts = new ArrayList<>(brands.keySet());
        List<BrandSegment> segments = new ArrayList<>();
        for (int i = 0; i < starts.size(); i++) {
            int start = starts.get(i);
            int end = (i < starts.size() - 1) ? starts.get(i + 1) - 1 : start + DEFAULT_SEGMENT_SPAN;
            Map<Integer, ColumnRole> roles = resolveRoles(grid, start, end, brandRow + 1, brandRow + HEADER_DEPTH);
            segments.add(new BrandSegment(brands.get(start), start, end, brandRow, roles));
        }
        return new Structure(Layout.HORIZONTAL, segments, brandRow + 2);
    }

    private Structure detectVertical(Grid grid) {
        int lastCol = Math.max(0, grid.width() - 1);
        int headerRow = -1;
        int bestCount = 0;
        Map<Integer, ColumnRole> bestRoles = new LinkedHashMap<>();
        int limit = Math.min(VERTICAL_HEADER_ROWS, grid.rowCount());
        for (int r = 0; r < limit; r++) {
            Map<Integer, ColumnRole> roles = resolveRoles(grid, 0, lastCol, r, r);
            int distinct = distinctRoles(roles);
            if (distinct > bestCount) {
                bestCount = distinct;
                bestRoles = roles;
                headerRow = r;
            }
        }
        int dataStart = verticalDataStart(grid, headerRow);
        BrandSegment implicit = new BrandSegment("", 0, lastCol, headerRow, bestRoles);
        return new Structure(Layout.VERTICAL, List.of(implicit), dataStart);
    }

    /** First row after the header (or from the top when none) with at least two filled cells. */
    int verticalDataStart(Grid grid, int headerRow) {
        int limit = Math.min(VERTICAL_DATA_SCAN_ROWS, grid.rowCount());
        for (int r = headerRow + 1; r < limit; r++) {
            if (grid.nonEmptyCount(r) >= 2) return r;
        }
        return headerRow + 1;
    }

    /**
     * Resolves a role for every column in {@code [fromCol, toCol]} that exists in the grid,
     * reading header text from {@code [fromRow, toRow]}. The first row that yields a role
     * decides the column.
     */
    Map<Integer, ColumnRole> resolveRoles(Grid grid, int fromCol, int toCol, int fromRow, int toRow) {
        Map<Integer, ColumnRole> roles = new LinkedHashMap<>();
        Map<Integer, String> headers = new LinkedHashMap<>();
        int lastCol = Math.min(toCol, grid.width() - 1);
        int lastRow = Math.min(toRow, grid.rowCount() - 1);
        for (int c = fromCol; c <= lastCol; c++) {
            ColumnRole role = ColumnRole.UNKNOWN;
            for (int r = fromRow; r <= lastRow; r++) {
                String header = grid.text(r, c);
                if (header.isEmpty()) continue;
                ColumnRole m = roleMatcher.match(header);
                if (m != ColumnRole.UNKNOWN) {
                    role = m;
                    headers.put(c, header);
                    break;
                }
            }
            roles.put(c, role);
        }
        preferExclusivePrice(roles, headers);
        preferSpecificCode(roles, headers);
        return roles;
    }

    /** With several code columns, keep the ones whose header names the code most specifically. */
    private void preferSpecificCode(Map<Integer, ColumnRole> roles, Map<Integer, String> headers) {
        List<Integer> codeCols = roles.entrySet().stream()
                .filter(e -> e.getValue() == ColumnRole.PRODUCT_CODE)
                .map(Map.Entry::getKey)
                .toList();
        if (codeCols.size() < 2) return;
        int best = codeCols.stream()
                .mapToInt(c -> roleMatcher.keywordRank(headers.get(c), ColumnRole.PRODUCT_CODE))
                .min()
                .getAsInt();
        for (Integer c : codeCols) {
            if (roleMatcher.keywordRank(headers.get(c), ColumnRole.PRODUCT_CODE) > best) {
                log.debug("Column {} ('{}') demoted: a more specific code column exists", c, headers.get(c));
                roles.put(c, ColumnRole.UNKNOWN);
            }
        }
    }

    /** With several price columns, keep the ones qualified as excluding VAT. */
    private void preferExclusivePrice(Map<Integer, ColumnRole> roles, Map<Integer, String> headers) {
        List<Integer> priceCols = roles.entrySet().stream()
                .filter(e -> e.getValue() == ColumnRole.PRICE)
                .map(Map.Entry::getKey)
                .toList();
        if (priceCols.size() < 2) return;
        List<Integer> exclusive = priceCols.stream()
                .filter(c -> roleMatcher.isExclusiveOfVat(headers.get(c)))
                .toList();
        if (exclusive.isEmpty()) return;
        for (Integer c : priceCols) {
            if (!exclusive.contains(c)) {
                log.debug("Column {} ('{}') demoted: an excl-VAT price column exists", c, headers.get(c));
                roles.put(c, ColumnRole.UNKNOWN);
            }
        }
    }

    private static int distinctRoles(Map<Integer, ColumnRole> roles) {
        Set<ColumnRole> seen = EnumSet.noneOf(ColumnRole.class);
        for (ColumnRole r : roles.values()) {
            if (r != ColumnRole.UNKNOWN) seen.add(r);
        }
        return seen.size();
    }
}
