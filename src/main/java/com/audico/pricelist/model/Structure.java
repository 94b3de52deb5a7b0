package com.audico.pricelist.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.List;

/**
 * Layout of one pricelist grid as inferred by
 * {@link com.audico.pricelist.service.detection.StructureDetector}.
 *
 * <p>An invalid structure is still returned (never thrown) so callers can show what was
 * detected and fall back to manual column mapping.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Structure {
    private final Layout layout;
    private final List<BrandSegment> segments;
    private final int dataStartRow;
    private final boolean valid;

    public Structure(Layout layout, List<BrandSegment> segments, int dataStartRow) {
        this.layout = layout;
        this.segments = Collections.unmodifiableList(List.copyOf(segments));
        this.dataStartRow = dataStartRow;
        this.valid = this.segments.stream().anyMatch(BrandSegment::isExtractable);
    }

    public Layout getLayout() { return layout; }

    /** Brand segments; for vertical layouts a single implicit segment over the whole row width. */
    public List<BrandSegment> getSegments() { return segments; }

    public int getDataStartRow() { return dataStartRow; }

    public boolean isValid() { return valid; }

    public List<BrandSegment> extractableSegments() {
        return segments.stream().filter(BrandSegment::isExtractable).toList();
    }

    @Override
    public String toString() {
        return "Structure{" + layout + ", segments=" + segments.size() + ", dataStartRow=" + dataStartRow + ", valid=" + valid + "}";
    }
}
