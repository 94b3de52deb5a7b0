package com.audico.pricelist.service.reconcile;

import com.audico.pricelist.model.RawProductRow;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ProductFingerprinterTest {

    private final ProductFingerprinter fingerprinter = new ProductFingerprinter(List.of("denon", "yamaha", "marantz"));

    @Test
    public void spellingDriftCollides() {
        String a = fingerprinter.fingerprint("DENON", "AVR-X1800H");
        assertEquals(a, fingerprinter.fingerprint("Denon", "avr x1800h"));
        assertEquals(a, fingerprinter.fingerprint("denon", "AVRX1800H"));
        assertEquals(16, a.length());
    }

    @Test
    public void differentProductsDiffer() {
        assertNotEquals(fingerprinter.fingerprint("Denon", "AVR-X1800H"), fingerprinter.fingerprint("Denon", "AVR-X2800H"));
        assertNotEquals(fingerprinter.fingerprint("Denon", "X1"), fingerprinter.fingerprint("Marantz", "X1"));
    }

    @Test
    public void brandInferredFromName() {
        RawProductRow row = new RawProductRow("", "RX-V6A", "Yamaha RX-V6A 7.2 receiver", "9999", "", 0, false, null);
        assertEquals("yamaha", fingerprinter.resolveBrand(row));
        assertEquals(fingerprinter.fingerprint("Yamaha", "RX-V6A"), fingerprinter.fingerprint(row));
    }

    @Test
    public void unknownBrandLandsInEmptyBucket() {
        RawProductRow row = new RawProductRow(null, "XYZ-1", null, "10", null, 0, false, null);
        assertEquals("", fingerprinter.resolveBrand(row));
        assertEquals(fingerprinter.fingerprint("", "XYZ-1"), fingerprinter.fingerprint(row));
    }

    @Test
    public void nameUsedWhenCodeMissing() {
        RawProductRow row = new RawProductRow("Denon", "", "Home 150", "10", null, 0, false, null);
        assertEquals(fingerprinter.fingerprint("Denon", "Home 150"), fingerprinter.fingerprint(row));
    }
}
