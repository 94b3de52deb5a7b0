package com.audico.pricelist.service.detection;

import com.audico.pricelist.model.BrandSegment;
import com.audico.pricelist.model.ColumnRole;
import com.audico.pricelist.model.Grid;
import com.audico.pricelist.model.Layout;
import com.audico.pricelist.model.RawProductRow;
import com.audico.pricelist.model.Structure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reads {@link RawProductRow}s out of a grid using a detected {@link Structure}.
 *
 * <p>One row is produced per (extractable segment, data row) pair whose product code cell
 * is filled. Segments lacking a code or price column are skipped. In vertical sheets a
 * row holding a single upper-case title without digits (e.g. "AV RECEIVERS") is taken as
 * a category heading for the rows below it.
 */
public class SegmentRowExtractor {
    private static final Logger log = LoggerFactory.getLogger(SegmentRowExtractor.class);

    private static final Set<String> EMPTY_MARKERS = Set.of("nan", "none", "null");
    private static final Pattern CATEGORY_HEADING = Pattern.compile("^[A-Z][A-Z &/\\-']{3,}$");

    private final HeaderRoleMatcher roleMatcher;

    public SegmentRowExtractor(HeaderRoleMatcher roleMatcher) {
        this.roleMatcher = roleMatcher;
    }

    /**
     * @param defaultBrand    brand for vertical sheets, usually the supplier name
     * @param defaultCategory category used until a heading is seen, or for sheets without any
     */
    public List<RawProductRow> extract(Grid grid, Structure structure, String defaultBrand, String defaultCategory) {
        List<RawProductRow> rows = new ArrayList<>();
        if (!structure.isValid()) {
            log.warn("Invalid structure, nothing extracted: {}", structure);
            return rows;
        }
        for (BrandSegment segment : structure.extractableSegments()) {
            String brand = structure.getLayout() == Layout.HORIZONTAL ? segment.getBrandName() : defaultBrand;
            int before = rows.size();
            extractSegment(grid, structure, segment, brand, defaultCategory, rows);
            log.debug("Segment '{}' yielded {} rows", segment.getBrandName(), rows.size() - before);
        }
        log.info("Extracted {} rows from {} segment(s)", rows.size(), structure.extractableSegments().size());
        return rows;
    }

    private void extractSegment(Grid grid, Structure structure, BrandSegment segment, String brand,
                                String defaultCategory, List<RawProductRow> out) {
        int codeCol = segment.columnFor(ColumnRole.PRODUCT_CODE).getAsInt();
        int priceCol = segment.columnFor(ColumnRole.PRICE).getAsInt();
        int descCol = segment.columnFor(ColumnRole.DESCRIPTION).orElse(-1);
        boolean vertical = structure.getLayout() == Layout.VERTICAL;
        String category = defaultCategory;

        for (int r = structure.getDataStartRow(); r < grid.rowCount(); r++) {
            if (vertical) {
                String heading = categoryHeading(grid, r, segment);
                if (heading != null) {
                    category = heading;
                    continue;
                }
            }
            String code = grid.text(r, codeCol);
            if (code.isEmpty() || EMPTY_MARKERS.contains(code.toLowerCase(Locale.ROOT))) continue;
            // repeated header lines inside long sheets
            if (roleMatcher.isHeaderLabel(code, ColumnRole.PRODUCT_CODE)) continue;

            String rawPrice = grid.cell(r, priceCol);
            String name = descCol >= 0 ? grid.text(r, descCol) : null;
            out.add(new RawProductRow(brand, code, name, rawPrice == null ? "" : rawPrice, category, 0, false, null));
        }
    }

    /** The heading text when the row is a lone upper-case title inside the segment. */
    String categoryHeading(Grid grid, int row, BrandSegment segment) {
        String only = null;
        int last = Math.min(segment.getEndColumn(), grid.width() - 1);
        for (int c = segment.getStartColumn(); c <= last; c++) {
            String t = grid.text(row, c);
            if (t.isEmpty()) continue;
            if (only != null) return null;
            only = t;
        }
        if (only == null || !CATEGORY_HEADING.matcher(only).matches()) return null;
        return only;
    }
}
