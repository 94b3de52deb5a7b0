package com.audico.pricelist.service.pricing;

import com.audico.pricelist.config.DetectionRules;
import com.audico.pricelist.model.PriceOutcome;
import com.audico.pricelist.model.PriceOutcome.UnpricedReason;
import com.audico.pricelist.model.PriceTriple;
import com.audico.pricelist.model.PriceType;
import com.audico.pricelist.model.PricingConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PriceNormalizerTest {

    private static final double EPS = 1e-6;

    private final PriceNormalizer normalizer = new PriceNormalizer(DetectionRules.defaults());
    private final PricingConfig costExcl = PricingConfig.of(PriceType.COST_EXCL_VAT, 0.15, 0.40);

    @Test
    public void costExclusiveWithThousandsSeparator() {
        PriceOutcome out = normalizer.normalize("1,250.00", costExcl);
        assertTrue(out.isPriced());
        PriceTriple t = out.getTriple();
        assertEquals(1250.00, t.getCostExclVat(), EPS);
        assertEquals(1437.50, t.getCostInclVat(), EPS);
        assertEquals(2012.50, t.getRetailInclVat(), EPS);
        assertEquals(28.5714, t.getMarginPct(), 1e-3);
        assertEquals(1250.00, out.getSourceValue(), EPS);
    }

    @Test
    public void priceOnRequestIsUnpriced() {
        PriceOutcome out = normalizer.normalize("P.O.R", costExcl);
        assertFalse(out.isPriced());
        assertEquals(UnpricedReason.SENTINEL, out.getReason());
        assertTrue(out.triple().isEmpty());
    }

    @Test
    public void sentinelsAreCaseInsensitive() {
        assertFalse(normalizer.normalize("poa", costExcl).isPriced());
        assertFalse(normalizer.normalize(" call ", costExcl).isPriced());
        assertFalse(normalizer.normalize("", costExcl).isPriced());
        assertFalse(normalizer.normalize(null, costExcl).isPriced());
    }

    @Test
    public void zeroAndNegativeAreUnpriced() {
        assertEquals(UnpricedReason.NON_POSITIVE, normalizer.normalize("0", costExcl).getReason());
        assertEquals(UnpricedReason.NON_POSITIVE, normalizer.normalize("-15.00", costExcl).getReason());
        assertEquals(UnpricedReason.NON_POSITIVE, normalizer.normalize(0.0, costExcl).getReason());
    }

    @Test
    public void garbageIsUnparseable() {
        assertEquals(UnpricedReason.UNPARSEABLE, normalizer.normalize("see note 4", costExcl).getReason());
        assertEquals(UnpricedReason.UNPARSEABLE, normalizer.normalize("1.2.3", costExcl).getReason());
    }

    @Test
    public void currencyMarkersStripped() {
        assertEquals(1250.0, normalizer.normalize("R 1 250.00", costExcl).getTriple().getCostExclVat(), EPS);
        assertEquals(1250.0, normalizer.normalize("ZAR1,250", costExcl).getTriple().getCostExclVat(), EPS);
        assertEquals(99.5, normalizer.normalize("$99.50", costExcl).getTriple().getCostExclVat(), EPS);
    }

    @Test
    public void decimalCommaRead() {
        assertEquals(1250.5, normalizer.normalize("1250,50", costExcl).getTriple().getCostExclVat(), EPS);
        assertEquals(1250.0, normalizer.normalize("1,250", costExcl).getTriple().getCostExclVat(), EPS);
    }

    @Test
    public void costInclusiveDerivesBackwards() {
        PricingConfig cfg = PricingConfig.of(PriceType.COST_INCL_VAT, 0.15, 0.40);
        PriceTriple t = normalizer.normalize("1437.50", cfg).getTriple();
        assertEquals(1250.0, t.getCostExclVat(), EPS);
        assertEquals(2012.5, t.getRetailInclVat(), EPS);
    }

    @Test
    public void retailInclusiveDerivesBackwards() {
        PricingConfig cfg = PricingConfig.of(PriceType.RETAIL_INCL_VAT, 0.15, 0.40);
        PriceTriple t = normalizer.normalize("2012.50", cfg).getTriple();
        assertEquals(1437.5, t.getCostInclVat(), EPS);
        assertEquals(1250.0, t.getCostExclVat(), EPS);
    }

    @Test
    public void quotedValueRecoverableForEveryType() {
        for (PriceType type : PriceType.values()) {
            for (double vat : new double[]{0.0, 0.15, 1.0}) {
                for (double markup : new double[]{0.0, 0.4, 2.5}) {
                    PricingConfig cfg = PricingConfig.of(type, vat, markup);
                    PriceTriple t = normalizer.derive(4321.99, cfg);
                    assertEquals(4321.99, normalizer.sourceValue(t, cfg), 1e-6, cfg.toString());
                    assertTrue(t.getCostExclVat() <= t.getCostInclVat() + EPS, cfg.toString());
                    assertTrue(t.getCostInclVat() <= t.getRetailInclVat() + EPS, cfg.toString());
                }
            }
        }
    }

    @Test
    public void zeroMarkupHasZeroMargin() {
        PriceTriple t = normalizer.derive(100, PricingConfig.of(PriceType.COST_EXCL_VAT, 0.15, 0.0));
        assertEquals(0.0, t.getMarginPct(), EPS);
    }

    @Test
    public void numberTooLargeIsUnparseable() {
        PriceOutcome out = normalizer.normalize("1" + "0".repeat(400), costExcl);
        assertFalse(out.isPriced());
        assertEquals(UnpricedReason.UNPARSEABLE, out.getReason());
    }
}
