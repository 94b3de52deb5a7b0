package com.audico.pricelist.service.detection;

import com.audico.pricelist.config.DetectionRules;
import com.audico.pricelist.model.Grid;
import com.audico.pricelist.model.RawProductRow;
import com.audico.pricelist.model.Structure;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SegmentRowExtractorTest {

    private final StructureDetector detector = new StructureDetector(DetectionRules.defaults());
    private final SegmentRowExtractor extractor = new SegmentRowExtractor(detector.getRoleMatcher());

    private List<RawProductRow> extract(Grid grid) {
        Structure s = detector.detect(grid);
        return extractor.extract(grid, s, "Denon", "Uncategorized");
    }

    @Test
    public void horizontalRowsCarrySegmentBrand() {
        List<RawProductRow> rows = extract(StructureDetectorTest.twoBrandSheet());
        assertEquals(3, rows.size());
        assertEquals("YEALINK", rows.get(0).getBrand());
        assertEquals("T54W", rows.get(0).getCode());
        assertEquals("2450.00", rows.get(0).getRawPriceText());
        assertEquals("YEALINK", rows.get(1).getBrand());
        assertEquals("T46U", rows.get(1).getCode());
        assertEquals("JABRA", rows.get(2).getBrand());
        assertEquals("EVOLVE2 65", rows.get(2).getCode());
    }

    @Test
    public void verticalRowsPickUpCategoryHeadings() {
        List<RawProductRow> rows = extract(StructureDetectorTest.singleBrandSheet());
        assertEquals(3, rows.size());
        RawProductRow first = rows.get(0);
        assertEquals("Denon", first.getBrand());
        assertEquals("AVR-X1800H", first.getCode());
        assertEquals("7.2ch 8K receiver", first.getName());
        assertEquals("R 12,990.00", first.getRawPriceText());
        assertEquals("Uncategorized", first.getCategoryLabel());
        assertEquals("P.O.R", rows.get(1).getRawPriceText());
        assertEquals("SOUNDBARS", rows.get(2).getCategoryLabel());
        assertEquals(0, first.getStockQty());
        assertFalse(first.isHasActiveSpecial());
    }

    @Test
    public void repeatedHeadersAndBlankCodesSkipped() {
        Grid grid = Grid.ofRows(
                List.of("Code", "Description", "Price"),
                List.of("SC-LX904", "Receiver", "1000"),
                Arrays.asList(null, "orphan note", "5"),
                List.of("nan", "", ""),
                List.of("Code", "Description", "Price"),
                List.of("VSX-935", "Receiver", "800"));
        List<RawProductRow> rows = extract(grid);
        assertEquals(List.of("SC-LX904", "VSX-935"), rows.stream().map(RawProductRow::getCode).toList());
    }

    @Test
    public void invalidStructureYieldsNothing() {
        Grid grid = Grid.ofRows(List.of("hello", "world"), List.of("foo", "bar"));
        assertTrue(extract(grid).isEmpty());
    }

    @Test
    public void stockCodeUsedWhenBarcodeComesFirst() {
        Grid grid = Grid.ofRows(
                List.of("Barcode", "Stock Code", "Description", "Price"),
                List.of("6001234567890", "AVR-X1800H", "Receiver", "15990"));
        List<RawProductRow> rows = extract(grid);
        assertEquals(1, rows.size());
        assertEquals("AVR-X1800H", rows.get(0).getCode());
    }
}
