package com.audico.pricelist.service.pricing;

import com.audico.pricelist.config.DetectionRules;
import com.audico.pricelist.model.PriceOutcome;
import com.audico.pricelist.model.PriceOutcome.UnpricedReason;
import com.audico.pricelist.model.PriceTriple;
import com.audico.pricelist.model.PricingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns one raw price cell into a cost-excl / cost-incl / retail price triple.
 *
 * <p>The quoted number is the field named by {@link PricingConfig#getPriceType()}; the
 * other two are derived with exactly one formula each, so the quoted value can always be
 * recomputed from the triple with {@link #sourceValue(PriceTriple, PricingConfig)}:
 * <ul>
 *   <li>cost excl VAT: {@code incl = excl * (1 + vat)}, {@code retail = incl * (1 + markup)}</li>
 *   <li>cost incl VAT: {@code excl = incl / (1 + vat)}, {@code retail = incl * (1 + markup)}</li>
 *   <li>retail incl VAT: {@code incl = retail / (1 + markup)}, {@code excl = incl / (1 + vat)}</li>
 * </ul>
 *
 * <p>Placeholders ("P.O.R", "POA", blank), unparseable text and non-positive numbers yield
 * {@link PriceOutcome#unpriced unpriced}; nothing here throws for bad cell content.
 */
public class PriceNormalizer {
    private static final Logger log = LoggerFactory.getLogger(PriceNormalizer.class);

    private static final Pattern CURRENCY_SYMBOLS = Pattern.compile("\\p{Sc}");
    private static final Pattern CURRENCY_CODE_PREFIX = Pattern.compile("^(?i)(zar|usd|eur|gbp|r)\\s*(?=[\\d.,])");
    private static final Pattern CURRENCY_CODE_SUFFIX = Pattern.compile("(?i)\\s*(zar|usd|eur|gbp)$");
    private static final Pattern DECIMAL_COMMA = Pattern.compile("^\\d+,\\d{2}$");
    private static final Pattern NUMBER = Pattern.compile("^[+-]?(\\d+(\\.\\d*)?|\\.\\d+)$");

    private final Set<String> sentinels;

    public PriceNormalizer(DetectionRules rules) {
        this(rules.sentinelsUpper());
    }

    public PriceNormalizer(Set<String> sentinelsUpper) {
        this.sentinels = Set.copyOf(sentinelsUpper);
    }

    public PriceOutcome normalize(String rawText, PricingConfig config) {
        String text = rawText == null ? "" : rawText.replace('\u00A0', ' ').trim();
        if (text.isEmpty() || sentinels.contains(text.toUpperCase(Locale.ROOT))) {
            return PriceOutcome.unpriced(rawText, UnpricedReason.SENTINEL);
        }
        Double parsed = parseAmount(text, config.getCurrency());
        if (parsed == null) {
            log.debug("Unparseable price '{}'", rawText);
            return PriceOutcome.unpriced(rawText, UnpricedReason.UNPARSEABLE);
        }
        if (parsed <= 0.0) {
            return PriceOutcome.unpriced(rawText, UnpricedReason.NON_POSITIVE);
        }
        return PriceOutcome.priced(derive(parsed, config), parsed, rawText);
    }

    /**
     * Normalizes an already numeric price, e.g. a special price read from the catalog.
     * Non-positive values are unpriced.
     */
    public PriceOutcome normalize(double value, PricingConfig config) {
        String raw = String.valueOf(value);
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return PriceOutcome.unpriced(raw, UnpricedReason.UNPARSEABLE);
        }
        if (value <= 0.0) {
            return PriceOutcome.unpriced(raw, UnpricedReason.NON_POSITIVE);
        }
        return PriceOutcome.priced(derive(value, config), value, raw);
    }

    /** Builds the triple from a positive quoted value. */
    public PriceTriple derive(double source, PricingConfig config) {
        double vat = config.getVatRate();
        double markup = config.getMarkup();
        double excl;
        double incl;
        double retail;
        switch (config.getPriceType()) {
            case COST_EXCL_VAT -> {
                excl = source;
                incl = excl * (1 + vat);
                retail = incl * (1 + markup);
            }
            case COST_INCL_VAT -> {
                incl = source;
                excl = incl / (1 + vat);
                retail = incl * (1 + markup);
            }
            case RETAIL_INCL_VAT -> {
                retail = source;
                incl = retail / (1 + markup);
                excl = incl / (1 + vat);
            }
            default -> throw new IllegalStateException("Unhandled price type " + config.getPriceType());
        }
        Double margin = retail > 0 ? (retail - incl) / retail * 100.0 : null;
        return new PriceTriple(excl, incl, retail, margin);
    }

    /** Inverse of {@link #derive}: the quoted value recomputed from the other two fields. */
    public double sourceValue(PriceTriple triple, PricingConfig config) {
        double vat = config.getVatRate();
        double markup = config.getMarkup();
        return switch (config.getPriceType()) {
            case COST_EXCL_VAT -> triple.getCostInclVat() / (1 + vat);
            case COST_INCL_VAT -> triple.getRetailInclVat() / (1 + markup);
            case RETAIL_INCL_VAT -> triple.getCostInclVat() * (1 + markup);
        };
    }

    /**
     * Strips currency symbols and codes, thousands separators and whitespace, then parses.
     * A lone comma followed by exactly two digits and no dot is read as a decimal comma.
     * Values too large for a double are rejected.
     */
    Double parseAmount(String text, String currency) {
        String s = CURRENCY_SYMBOLS.matcher(text).replaceAll("");
        if (currency != null && !currency.isBlank()) {
            s = s.replace(currency, "");
        }
        s = s.trim();
        s = CURRENCY_CODE_PREFIX.matcher(s).replaceFirst("");
        s = CURRENCY_CODE_SUFFIX.matcher(s).replaceFirst("");
        s = s.replaceAll("\\s+", "");
        if (s.indexOf('.') < 0 && DECIMAL_COMMA.matcher(s).matches()) {
            s = s.replace(',', '.');
        } else {
            s = s.replace(",", "");
        }
        if (!NUMBER.matcher(s).matches()) return null;
        try {
            double value = Double.parseDouble(s);
            return Double.isFinite(value) ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
