package com.audico.pricelist.service.detection;

import com.audico.pricelist.config.DetectionRules;
import com.audico.pricelist.model.ColumnRole;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Maps header cell text to a {@link ColumnRole} using the configured keyword table.
 *
 * <p>Keywords match as whole words, with an optional plural 's' ("Price excl VAT" and
 * "Unit Prices" contain "price", "Barcode" does not contain "code"). Roles are tried in
 * table order, so "Retail Price" resolves to RETAIL_PRICE before PRICE. Within a role,
 * keywords run from most to least specific; {@link #keywordRank} exposes that order.
 */
public class HeaderRoleMatcher {
    private final Map<ColumnRole, List<Pattern>> keywordPatterns;
    private final Map<ColumnRole, List<String>> keywords;
    private final List<String> exclusiveQualifiers;

    public HeaderRoleMatcher(DetectionRules rules) {
        this.keywords = rules.roleKeywordsLower();
        Map<ColumnRole, List<Pattern>> patterns = new LinkedHashMap<>();
        keywords.forEach((role, kws) -> patterns.put(role, kws.stream().map(HeaderRoleMatcher::wordPattern).toList()));
        this.keywordPatterns = patterns;
        this.exclusiveQualifiers = rules.getExclusiveVatQualifiers().stream()
                .map(q -> q.trim().toLowerCase(Locale.ROOT))
                .filter(q -> !q.isEmpty())
                .toList();
    }

    private static Pattern wordPattern(String keyword) {
        return Pattern.compile("(^|[^a-z0-9])" + Pattern.quote(keyword) + "s?($|[^a-z0-9])");
    }

    /** First role with a keyword in the header, or UNKNOWN. */
    public ColumnRole match(String header) {
        String h = clean(header);
        if (h.isEmpty()) return ColumnRole.UNKNOWN;
        for (Map.Entry<ColumnRole, List<Pattern>> e : keywordPatterns.entrySet()) {
            for (Pattern p : e.getValue()) {
                if (p.matcher(h).find()) return e.getKey();
            }
        }
        return ColumnRole.UNKNOWN;
    }

    /**
     * Position in the role's keyword list of the first keyword found in the header; lower is
     * more specific. {@link Integer#MAX_VALUE} when none matches.
     */
    public int keywordRank(String header, ColumnRole role) {
        String h = clean(header);
        List<Pattern> patterns = keywordPatterns.getOrDefault(role, List.of());
        for (int i = 0; i < patterns.size(); i++) {
            if (patterns.get(i).matcher(h).find()) return i;
        }
        return Integer.MAX_VALUE;
    }

    /**
     * True when a role keyword appears in {@code text} as whole words. Used to keep
     * brand detection away from header vocabulary without tripping over brand names that
     * merely contain a keyword as a substring.
     */
    public boolean containsKeywordAsWord(String text) {
        String t = clean(text);
        if (t.isEmpty()) return false;
        for (List<Pattern> patterns : keywordPatterns.values()) {
            for (Pattern p : patterns) {
                if (p.matcher(t).find()) return true;
            }
        }
        return false;
    }

    /** True when the whole cell is exactly one of the role's keywords, e.g. a repeated header line. */
    public boolean isHeaderLabel(String text, ColumnRole role) {
        String t = clean(text);
        List<String> kws = keywords.get(role);
        return kws != null && kws.contains(t);
    }

    /** Price headers qualified as exclusive of VAT win over other price columns. */
    public boolean isExclusiveOfVat(String header) {
        String h = clean(header);
        for (String q : exclusiveQualifiers) {
            if (h.contains(q)) return true;
        }
        return false;
    }

    private static String clean(String s) {
        if (s == null) return "";
        return s.replace('\u00A0', ' ').toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();
    }
}
