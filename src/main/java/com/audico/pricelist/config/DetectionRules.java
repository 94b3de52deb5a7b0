package com.audico.pricelist.config;

import com.audico.pricelist.model.ColumnRole;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Keyword tables driving structure detection, price sentinels and search variants.
 *
 * <p>Loaded from {@code pricelist/detection-rules.json} so a new supplier's header
 * wording can be supported by editing data. Keywords are matched case-insensitively;
 * the stoplist and sentinels are compared upper-cased.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DetectionRules {
    public static final String DEFAULT_LOCATION = "pricelist/detection-rules.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Words that disqualify a header cell from being a brand name. */
    @JsonProperty("brand_stoplist")
    private List<String> brandStoplist = new ArrayList<>();

    /** Header keywords per column role, checked in map order. */
    @JsonProperty("role_keywords")
    private Map<ColumnRole, List<String>> roleKeywords = new LinkedHashMap<>();

    /** Qualifiers marking a price column as exclusive of VAT. */
    @JsonProperty("exclusive_vat_qualifiers")
    private List<String> exclusiveVatQualifiers = new ArrayList<>();

    /** Cell texts meaning "no price given". */
    @JsonProperty("unpriced_sentinels")
    private List<String> unpricedSentinels = new ArrayList<>();

    /** Model line prefixes in their separated spelling, e.g. "avr-x". */
    @JsonProperty("model_prefixes")
    private List<String> modelPrefixes = new ArrayList<>();

    public DetectionRules() {}

    /** Reads the bundled default table from the classpath. */
    public static DetectionRules defaults() {
        return fromClasspath(DEFAULT_LOCATION);
    }

    public static DetectionRules fromClasspath(String location) {
        String path = location.startsWith("classpath:") ? location.substring("classpath:".length()) : location;
        if (path.startsWith("/")) path = path.substring(1);
        InputStream in = DetectionRules.class.getClassLoader().getResourceAsStream(path);
        if (in == null) {
            throw new DetectionRulesException("Detection rules not found on classpath: " + path);
        }
        try (InputStream stream = in) {
            return read(stream);
        } catch (IOException e) {
            throw new DetectionRulesException("Failed to read detection rules from " + path, e);
        }
    }

    public static DetectionRules read(InputStream in) throws IOException {
        DetectionRules rules = MAPPER.readValue(in, DetectionRules.class);
        rules.validate();
        return rules;
    }

    void validate() {
        for (ColumnRole required : List.of(ColumnRole.PRODUCT_CODE, ColumnRole.PRICE)) {
            List<String> kws = roleKeywords.get(required);
            if (kws == null || kws.isEmpty()) {
                throw new DetectionRulesException("No keywords configured for role " + required);
            }
        }
        if (roleKeywords.containsKey(ColumnRole.UNKNOWN)) {
            throw new DetectionRulesException("UNKNOWN cannot carry keywords");
        }
    }

    public List<String> getBrandStoplist() { return brandStoplist; }
    public void setBrandStoplist(List<String> brandStoplist) { this.brandStoplist = brandStoplist; }

    public Map<ColumnRole, List<String>> getRoleKeywords() { return roleKeywords; }
    public void setRoleKeywords(Map<ColumnRole, List<String>> roleKeywords) { this.roleKeywords = roleKeywords; }

    public List<String> getExclusiveVatQualifiers() { return exclusiveVatQualifiers; }
    public void setExclusiveVatQualifiers(List<String> exclusiveVatQualifiers) { this.exclusiveVatQualifiers = exclusiveVatQualifiers; }

    public List<String> getUnpricedSentinels() { return unpricedSentinels; }
    public void setUnpricedSentinels(List<String> unpricedSentinels) { this.unpricedSentinels = unpricedSentinels; }

    public List<String> getModelPrefixes() { return modelPrefixes; }
    public void setModelPrefixes(List<String> modelPrefixes) { this.modelPrefixes = modelPrefixes; }

    public Set<String> stoplistUpper() {
        return upper(brandStoplist);
    }

    public Set<String> sentinelsUpper() {
        return upper(unpricedSentinels);
    }

    /** Role keywords lowercased, keeping the configured role order. */
    public Map<ColumnRole, List<String>> roleKeywordsLower() {
        Map<ColumnRole, List<String>> out = new LinkedHashMap<>();
        for (Map.Entry<ColumnRole, List<String>> e : roleKeywords.entrySet()) {
            List<String> kws = new ArrayList<>();
            for (String k : e.getValue()) {
                if (k != null && !k.isBlank()) kws.add(k.trim().toLowerCase(Locale.ROOT));
            }
            out.put(e.getKey(), kws);
        }
        return out;
    }

    public Map<ColumnRole, Integer> keywordCounts() {
        Map<ColumnRole, Integer> m = new EnumMap<>(ColumnRole.class);
        roleKeywords.forEach((k, v) -> m.put(k, v.size()));
        return m;
    }

    private static Set<String> upper(List<String> in) {
        Set<String> out = new LinkedHashSet<>();
        for (String s : in) {
            if (s != null) out.add(s.trim().toUpperCase(Locale.ROOT));
        }
        return out;
    }
}
