package com.audico.pricelist.service.reconcile;

import com.audico.pricelist.model.RawProductRow;
import com.audico.pricelist.util.TextNormalizer;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;

/**
 * Computes the identity of a product row: rows describing the same physical product,
 * however their brand and code are spelled, get the same fingerprint.
 *
 * <p>The fingerprint is a hash of {@code brand + "_" + code}, both normalized and with
 * whitespace removed, so "AVR-X1800H", "avr x1800h" and "AVRX1800H" collide. A row
 * without a brand borrows the first known brand found inside its name or code; if none is
 * found it lands in the empty-brand bucket. Fingerprinting never fails.
 */
public class ProductFingerprinter {
    private static final int FINGERPRINT_HEX_CHARS = 16;

    private final List<String> knownBrands;

    public ProductFingerprinter(List<String> knownBrands) {
        List<String> brands = new ArrayList<>();
        if (knownBrands != null) {
            for (String b : knownBrands) {
                if (!TextNormalizer.isBlank(b)) brands.add(b.trim());
            }
        }
        this.knownBrands = List.copyOf(brands);
    }

    public List<String> getKnownBrands() {
        return knownBrands;
    }

    /** The row's brand, or the inferred one, or "". */
    public String resolveBrand(RawProductRow row) {
        if (!row.getBrand().isEmpty()) return row.getBrand();
        String haystack = TextNormalizer.compact(row.getName()) + " " + TextNormalizer.compact(row.getCode());
        for (String brand : knownBrands) {
            String needle = TextNormalizer.compact(brand);
            if (!needle.isEmpty() && haystack.contains(needle)) {
                return brand;
            }
        }
        return "";
    }

    public String fingerprint(RawProductRow row) {
        return fingerprint(resolveBrand(row), row.codeOrName());
    }

    public String fingerprint(String brand, String codeOrName) {
        String key = TextNormalizer.compact(brand) + "_" + TextNormalizer.compact(codeOrName);
        return sha256Hex(key).substring(0, FINGERPRINT_HEX_CHARS);
    }

    private static String sha256Hex(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] d = md.digest(s.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (byte b : d) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException(e);
        }
    }
}
