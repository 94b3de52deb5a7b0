package com.audico.pricelist.config;

import com.audico.pricelist.model.PriceType;
import com.audico.pricelist.model.PricingConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "pricelist")
public class PricelistProperties {
    /**
     * Classpath location of the detection keyword table.
     */
    private String rulesLocation = DetectionRules.DEFAULT_LOCATION;
    /**
     * Brands looked for inside a product name or code when a row has no brand.
     * Order matters: the first brand found wins.
     */
    private List<String> knownBrands = new ArrayList<>(List.of(
            "denon", "yamaha", "marantz", "onkyo", "pioneer", "sony", "bose", "jbl", "polk"));
    /**
     * Category given to rows whose source carries none.
     */
    private String defaultCategory = "Uncategorized";
    private Pricing pricing = new Pricing();

    public String getRulesLocation() {
        return rulesLocation;
    }

    public void setRulesLocation(String rulesLocation) {
        this.rulesLocation = rulesLocation;
    }

    public List<String> getKnownBrands() {
        return knownBrands;
    }

    public void setKnownBrands(List<String> knownBrands) {
        this.knownBrands = knownBrands;
    }

    public String getDefaultCategory() {
        return defaultCategory;
    }

    public void setDefaultCategory(String defaultCategory) {
        this.defaultCategory = defaultCategory;
    }

    public Pricing getPricing() {
        return pricing;
    }

    public void setPricing(Pricing pricing) {
        this.pricing = pricing;
    }

    /** Defaults used when a supplier has no pricing settings of its own. */
    public static class Pricing {
        private String priceType = PriceType.COST_EXCL_VAT.getLabel();
        private double vatRate = 0.15;
        private double markup = 0.40;
        private String currency = PricingConfig.DEFAULT_CURRENCY;

        public String getPriceType() {
            return priceType;
        }

        public void setPriceType(String priceType) {
            this.priceType = priceType;
        }

        public double getVatRate() {
            return vatRate;
        }

        public void setVatRate(double vatRate) {
            this.vatRate = vatRate;
        }

        public double getMarkup() {
            return markup;
        }

        public void setMarkup(double markup) {
            this.markup = markup;
        }

        public String getCurrency() {
            return currency;
        }

        public void setCurrency(String currency) {
            this.currency = currency;
        }

        /**
         * @throws com.audico.pricelist.model.InvalidPricingConfigException when the defaults are invalid
         */
        public PricingConfig toPricingConfig() {
            return new PricingConfig(PriceType.fromLabel(priceType), vatRate, markup, currency);
        }
    }
}
