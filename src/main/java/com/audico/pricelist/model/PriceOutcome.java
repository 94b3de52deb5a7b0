package com.audico.pricelist.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of normalizing one price cell: either {@code Priced} with a {@link PriceTriple},
 * or {@code Unpriced}. Unpriced is an expected outcome ("P.O.R", "CALL", blank cells)
 * and is distinct from a price of zero.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PriceOutcome {

    public enum Kind { PRICED, UNPRICED }

    public enum UnpricedReason {
        /** Cell held a placeholder such as "POA" or "P.O.R". */
        SENTINEL,
        /** Cell text is not a number once symbols and separators are removed. */
        UNPARSEABLE,
        /** Parsed value was zero or negative. */
        NON_POSITIVE
    }

    private final Kind kind;
    private final PriceTriple triple;
    private final Double sourceValue;
    private final String rawText;
    private final UnpricedReason reason;

    private PriceOutcome(Kind kind, PriceTriple triple, Double sourceValue, String rawText, UnpricedReason reason) {
        this.kind = kind;
        this.triple = triple;
        this.sourceValue = sourceValue;
        this.rawText = rawText;
        this.reason = reason;
    }

    public static PriceOutcome priced(PriceTriple triple, double sourceValue, String rawText) {
        return new PriceOutcome(Kind.PRICED, Objects.requireNonNull(triple, "triple"), sourceValue, rawText, null);
    }

    public static PriceOutcome unpriced(String rawText, UnpricedReason reason) {
        return new PriceOutcome(Kind.UNPRICED, null, null, rawText, Objects.requireNonNull(reason, "reason"));
    }

    public Kind getKind() { return kind; }

    public boolean isPriced() { return kind == Kind.PRICED; }

    public Optional<PriceTriple> triple() { return Optional.ofNullable(triple); }

    public PriceTriple getTriple() { return triple; }

    /** The parsed number the triple was derived from. */
    public Double getSourceValue() { return sourceValue; }

    public String getRawText() { return rawText; }

    public UnpricedReason getReason() { return reason; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PriceOutcome p)) return false;
        return kind == p.kind && Objects.equals(triple, p.triple) && Objects.equals(sourceValue, p.sourceValue)
                && Objects.equals(rawText, p.rawText) && reason == p.reason;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, triple, sourceValue, rawText, reason);
    }

    @Override
    public String toString() {
        return isPriced() ? "Priced{" + triple + "}" : "Unpriced{" + reason + ", '" + rawText + "'}";
    }
}
