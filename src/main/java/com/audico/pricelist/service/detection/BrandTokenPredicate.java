package com.audico.pricelist.service.detection;

import com.audico.pricelist.config.DetectionRules;

import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Decides whether a header cell looks like a brand name in a multi-brand sheet.
 *
 * <p>A brand token is 3-20 characters of upper-case letters, digits, '-', '&' and spaces
 * with at least one letter. The stoplist and the role keywords take precedence: a supplier
 * literally called "CODE" is treated as a header, not a brand.
 */
public class BrandTokenPredicate implements Predicate<String> {
    private static final Pattern SHAPE = Pattern.compile("^[A-Z0-9][A-Z0-9&\\- ]{1,18}[A-Z0-9&]$");
    private static final Pattern HAS_LETTER = Pattern.compile("[A-Z]");
    private static final Pattern WORD_SPLIT = Pattern.compile("[\\s&\\-]+");

    private final Set<String> stoplist;
    private final HeaderRoleMatcher roleMatcher;

    public BrandTokenPredicate(DetectionRules rules, HeaderRoleMatcher roleMatcher) {
        this.stoplist = rules.stoplistUpper();
        this.roleMatcher = roleMatcher;
    }

    @Override
    public boolean test(String cell) {
        if (cell == null) return false;
        String token = cell.replace('\u00A0', ' ').trim().replaceAll("\\s+", " ");
        if (!SHAPE.matcher(token).matches() || !HAS_LETTER.matcher(token).find()) return false;
        return !isStopword(token) && !roleMatcher.containsKeywordAsWord(token);
    }

    boolean isStopword(String token) {
        String upper = token.toUpperCase(Locale.ROOT);
        if (stoplist.contains(upper)) return true;
        for (String word : WORD_SPLIT.split(upper)) {
            if (stoplist.contains(word)) return true;
        }
        return false;
    }
}
