package com.audico.pricelist.service.detection;

import com.audico.pricelist.config.DetectionRules;
import com.audico.pricelist.model.BrandSegment;
import com.audico.pricelist.model.ColumnRole;
import com.audico.pricelist.model.Grid;
import com.audico.pricelist.model.Layout;
import com.audico.pricelist.model.Structure;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class StructureDetectorTest {

    private final StructureDetector detector = new StructureDetector(DetectionRules.defaults());

    static Grid twoBrandSheet() {
        return Grid.ofRows(
                List.of("", "", "", ""),
                List.of("YEALINK", "", "JABRA", ""),
                List.of("Stock Code", "Price excl VAT", "Stock Code", "Price excl VAT"),
                List.of("T54W", "2450.00", "EVOLVE2 65", "3100.00"),
                List.of("T46U", "1890.00", "", ""));
    }

    static Grid singleBrandSheet() {
        return Grid.ofRows(
                List.of("DENON PRICELIST", "", "", ""),
                List.of("Model", "Description", "Dealer Price excl VAT", "Retail Price"),
                List.of("AVR-X1800H", "7.2ch 8K receiver", "R 12,990.00", "19990"),
                List.of("AVR-X2800H", "7.2ch receiver", "P.O.R", ""),
                List.of("SOUNDBARS", "", "", ""),
                List.of("DHT-S517", "Soundbar with sub", "5 999", "8999"));
    }

    @Test
    public void twoBrandsSideBySide() {
        Structure s = detector.detect(twoBrandSheet());
        assertEquals(Layout.HORIZONTAL, s.getLayout());
        assertTrue(s.isValid());
        assertEquals(3, s.getDataStartRow());
        assertEquals(2, s.getSegments().size());

        BrandSegment yealink = s.getSegments().get(0);
        assertEquals("YEALINK", yealink.getBrandName());
        assertEquals(0, yealink.getStartColumn());
        assertEquals(1, yealink.getEndColumn());
        assertEquals(ColumnRole.PRODUCT_CODE, yealink.roleOf(0));
        assertEquals(ColumnRole.PRICE, yealink.roleOf(1));

        BrandSegment jabra = s.getSegments().get(1);
        assertEquals("JABRA", jabra.getBrandName());
        assertEquals(2, jabra.getStartColumn());
        assertEquals(5, jabra.getEndColumn());
        assertTrue(jabra.isExtractable());
    }

    @Test
    public void exclusivePriceColumnPreferred() {
        Grid grid = Grid.ofRows(
                List.of("YAMAHA", "", "", "SONOS", "", ""),
                List.of("Code", "Price incl VAT", "Price excl VAT", "Code", "Description", "Dealer"),
                List.of("RX-V6A", "9999", "8695.65", "ERA100", "Speaker", "3499"));
        Structure s = detector.detect(grid);
        BrandSegment yamaha = s.getSegments().get(0);
        assertEquals(2, yamaha.columnFor(ColumnRole.PRICE).getAsInt());
        assertEquals(ColumnRole.UNKNOWN, yamaha.roleOf(1));
        BrandSegment sonos = s.getSegments().get(1);
        assertEquals(5, sonos.columnFor(ColumnRole.PRICE).getAsInt());
        assertEquals(4, sonos.columnFor(ColumnRole.DESCRIPTION).getAsInt());
        assertEquals(2, s.getDataStartRow());
    }

    @Test
    public void singleBrandSheetIsVertical() {
        Structure s = detector.detect(singleBrandSheet());
        assertEquals(Layout.VERTICAL, s.getLayout());
        assertTrue(s.isValid());
        assertEquals(1, s.getSegments().size());
        BrandSegment implicit = s.getSegments().get(0);
        assertEquals("", implicit.getBrandName());
        assertEquals(1, implicit.getHeaderRow());
        assertEquals(0, implicit.columnFor(ColumnRole.PRODUCT_CODE).getAsInt());
        assertEquals(2, implicit.columnFor(ColumnRole.PRICE).getAsInt());
        assertEquals(3, implicit.columnFor(ColumnRole.RETAIL_PRICE).getAsInt());
        assertEquals(2, s.getDataStartRow());
    }

    @Test
    public void headerlessSheetIsInvalid() {
        Grid grid = Grid.ofRows(
                List.of("hello", "world"),
                List.of("foo", "bar"));
        Structure s = detector.detect(grid);
        assertFalse(s.isValid());
        assertTrue(s.extractableSegments().isEmpty());
    }

    @Test
    public void emptyGridDoesNotThrow() {
        Structure s = detector.detect(Grid.of(List.of()));
        assertFalse(s.isValid());
    }

    @Test
    public void brandSegmentWithoutPriceIsNotExtractable() {
        Grid grid = Grid.ofRows(
                List.of("YEALINK", "", "JABRA", ""),
                List.of("Stock Code", "Price", "Stock Code", "Notes"));
        Structure s = detector.detect(grid);
        assertTrue(s.isValid());
        assertEquals(1, s.extractableSegments().size());
        assertFalse(s.getSegments().get(1).isExtractable());
    }

    @Test
    public void stockCodeBeatsBarcodeColumns() {
        Grid grid = Grid.ofRows(
                List.of("Barcode", "EAN Code", "Stock Code", "Description", "Price"),
                List.of("6001234567890", "6001234567890", "AVR-X1800H", "Receiver", "15990"));
        Structure s = detector.detect(grid);
        BrandSegment implicit = s.getSegments().get(0);
        assertEquals(ColumnRole.UNKNOWN, implicit.roleOf(0));
        assertEquals(ColumnRole.UNKNOWN, implicit.roleOf(1));
        assertEquals(2, implicit.columnFor(ColumnRole.PRODUCT_CODE).getAsInt());
    }

    @Test
    public void upperCaseDataUnderHeaderStaysVertical() {
        Grid grid = Grid.ofRows(
                List.of("Code", "Description", "Price"),
                List.of("AVR-X1800H", "AV RECEIVER", "19990"),
                List.of("AVR-X2800H", "AV RECEIVER", "24990"));
        Structure s = detector.detect(grid);
        assertEquals(Layout.VERTICAL, s.getLayout());
        assertTrue(s.isValid());
        assertEquals(1, s.getDataStartRow());
    }
}
