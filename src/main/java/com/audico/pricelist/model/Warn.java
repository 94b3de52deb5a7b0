package com.audico.pricelist.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A non-fatal issue found while ingesting a pricelist.
 *
 * <h3>Warning codes</h3>
 * <ul>
 *   <li><strong>INVALID_STRUCTURE</strong> - no segment resolved both a code and a price column</li>
 *   <li><strong>SEGMENT_WITHOUT_ROLES</strong> - a brand segment was kept for diagnostics but not extracted</li>
 *   <li><strong>UNPRICED</strong> - a row carried no usable price and stays in the catalog unpriced</li>
 *   <li><strong>SPECIAL_WITHOUT_PRICE</strong> - a row was flagged special without a positive special price</li>
 *   <li><strong>SPECIAL_NOT_BELOW_REGULAR</strong> - a row's special price is not lower than its regular price</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Warn {
    /** Brand and code of the affected row, or the brand of a segment. */
    private String subject;
    private String code;
    private String message;
    private String evidence;

    public Warn() {}

    public Warn(String subject, String code, String message, String evidence) {
        this.subject = subject;
        this.code = code;
        this.message = message;
        this.evidence = evidence;
    }

    public String getSubject() { return subject; }
    public void setSubject(String subject) { this.subject = subject; }
    public String getCode() { return code; }
    public void setCode(String code) { this.code = code; }
    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }
    public String getEvidence() { return evidence; }
    public void setEvidence(String evidence) { this.evidence = evidence; }

    public static Warn invalidStructure(String evidence) {
        return new Warn(null, "INVALID_STRUCTURE",
            "No brand segment has both a product code and a price column", evidence);
    }

    public static Warn segmentWithoutRoles(String brand, String evidence) {
        return new Warn(brand, "SEGMENT_WITHOUT_ROLES",
            String.format("Segment '%s' is missing a code or price column and was skipped", brand), evidence);
    }

    public static Warn unpriced(String subject, PriceOutcome.UnpricedReason reason, String rawText) {
        return new Warn(subject, "UNPRICED",
            String.format("No usable price (%s)", reason), rawText);
    }

    public static Warn specialWithoutPrice(String subject, Double specialPrice) {
        return new Warn(subject, "SPECIAL_WITHOUT_PRICE",
            "Special flagged active without a positive special price; regular price used",
            String.valueOf(specialPrice));
    }

    public static Warn specialNotBelowRegular(String subject, Double specialPrice, Double regularPrice) {
        return new Warn(subject, "SPECIAL_NOT_BELOW_REGULAR",
            "Special price is not below the regular price; regular price used",
            specialPrice + " >= " + regularPrice);
    }

    @Override
    public String toString() {
        return code + (subject != null ? " [" + subject + "]" : "") + ": " + message;
    }
}
