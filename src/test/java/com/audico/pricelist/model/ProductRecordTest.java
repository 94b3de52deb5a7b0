package com.audico.pricelist.model;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ProductRecordTest {

    private static PriceOutcome priced(double excl) {
        PriceTriple t = new PriceTriple(excl, excl * 1.15, excl * 1.15 * 1.4, 28.57);
        return PriceOutcome.priced(t, excl, String.valueOf(excl));
    }

    @Test
    public void categoriesDisplayTruncates() {
        ProductRecord r = new ProductRecord("fp", "Denon", "AVR-X1800H", "", priced(100), null, 1, false,
                new LinkedHashSet<>(List.of("Receivers", "Home Theater", "Audio", "Sale", "Clearance")));
        assertEquals(5, r.getCategoryCount());
        assertEquals("Receivers, Home Theater, Audio +2 more", r.getCategoriesDisplay());
    }

    @Test
    public void displayNameFallsBackToBrandAndCode() {
        ProductRecord r = new ProductRecord("fp", "Denon", "AVR-X1800H", null, priced(100), null, 0, false, null);
        assertEquals("Denon AVR-X1800H", r.getDisplayName());
        assertFalse(r.isInStock());
    }

    @Test
    public void savingsOnlyForSpecials() {
        ProductRecord special = new ProductRecord("fp", "Denon", "X", "", priced(80), priced(100), 1, true, null);
        ProductRecord regular = new ProductRecord("fp", "Denon", "X", "", priced(100), priced(100), 1, false, null);
        assertEquals(20 * 1.15 * 1.4, special.getSavings(), 1e-6);
        assertNull(regular.getSavings());
    }
}
