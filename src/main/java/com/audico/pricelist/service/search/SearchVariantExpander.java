package com.audico.pricelist.service.search;

import com.audico.pricelist.config.DetectionRules;
import com.audico.pricelist.model.SearchVariantSet;
import com.audico.pricelist.util.TextNormalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites a free-text query into spellings catalog text is likely to use.
 *
 * <p>Variants, in order and without duplicates:
 * <ol>
 *   <li>the query as typed</li>
 *   <li>normalized (lowercase, punctuation dropped, whitespace collapsed)</li>
 *   <li>normalized with spaces as '-'</li>
 *   <li>normalized with all separators removed</li>
 *   <li>normalized with '-' and '_' as spaces</li>
 *   <li>for a model code, the code with and without a separator between prefix and digits</li>
 * </ol>
 *
 * <p>Known model prefixes come from the keyword table in their separated spelling
 * ("avr-x"); "avrx1800h" then yields "avr-x1800h" and "avrx1800h". Without a known prefix
 * the first token of two to four letters followed by digits is split after its letters
 * ("sr6015" / "sr-6015"). Longer letter runs are words glued to a code, not model prefixes,
 * which keeps the expansion of a variant inside the original expansion.
 */
public class SearchVariantExpander {
    private static final Pattern GENERIC_MODEL = Pattern.compile("\\b([a-z]{2,4})(\\d[a-z0-9]*)\\b");
    private static final Pattern SEPARATORS = Pattern.compile("[-_\\s]+");

    private final List<ModelPrefix> prefixes;

    public SearchVariantExpander(DetectionRules rules) {
        this(rules.getModelPrefixes());
    }

    public SearchVariantExpander(List<String> modelPrefixes) {
        List<ModelPrefix> list = new ArrayList<>();
        for (String p : modelPrefixes) {
            ModelPrefix mp = ModelPrefix.parse(p);
            if (mp != null) list.add(mp);
        }
        this.prefixes = List.copyOf(list);
    }

    public SearchVariantSet expand(String query) {
        String raw = query == null ? "" : query;
        String normalized = TextNormalizer.normalize(raw);
        List<String> candidates = new ArrayList<>();
        candidates.add(raw);
        candidates.add(normalized);
        candidates.add(normalized.replaceAll("\\s+", "-"));
        candidates.add(SEPARATORS.matcher(normalized).replaceAll(""));
        candidates.add(normalized.replaceAll("[-_]", " "));
        candidates.addAll(modelVariants(normalized));
        return new SearchVariantSet(raw, candidates);
    }

    /** The two separator toggles for the first model code found, or nothing. */
    List<String> modelVariants(String normalized) {
        for (ModelPrefix p : prefixes) {
            Matcher m = p.pattern.matcher(normalized);
            if (m.find()) {
                return List.of(
                        m.replaceAll(Matcher.quoteReplacement(p.separated)),
                        p.pattern.matcher(normalized).replaceAll(Matcher.quoteReplacement(p.compact)));
            }
        }
        Matcher g = GENERIC_MODEL.matcher(normalized);
        if (g.find()) {
            String before = normalized.substring(0, g.start());
            String after = normalized.substring(g.end());
            return List.of(
                    before + g.group(1) + "-" + g.group(2) + after,
                    before + g.group(1) + g.group(2) + after);
        }
        return List.of();
    }

    /** A configured prefix such as "avr-x", matched in normalized text as "avrx" or "avr x" before a digit. */
    private static final class ModelPrefix {
        final String separated;
        final String compact;
        final Pattern pattern;

        private ModelPrefix(String separated, String compact, Pattern pattern) {
            this.separated = separated;
            this.compact = compact;
            this.pattern = pattern;
        }

        static ModelPrefix parse(String configured) {
            if (configured == null) return null;
            String s = configured.trim().toLowerCase(Locale.ROOT);
            String[] parts = s.split("[-_\\s]+");
            if (parts.length < 2) return null;
            List<String> quoted = new ArrayList<>();
            for (String part : parts) {
                if (!part.matches("[a-z]+")) return null;
                quoted.add(Pattern.quote(part));
            }
            Pattern pattern = Pattern.compile("\\b" + String.join("\\s?", quoted) + "(?=\\d)");
            return new ModelPrefix(String.join("-", parts), String.join("", parts), pattern);
        }
    }
}
