package com.audico.pricelist.config;

import com.audico.pricelist.service.detection.SegmentRowExtractor;
import com.audico.pricelist.service.detection.StructureDetector;
import com.audico.pricelist.service.ingest.PricelistIngestService;
import com.audico.pricelist.service.pricing.PriceNormalizer;
import com.audico.pricelist.service.reconcile.ProductDeduplicator;
import com.audico.pricelist.service.reconcile.ProductFingerprinter;
import com.audico.pricelist.service.search.SearchMatcher;
import com.audico.pricelist.service.search.SearchVariantExpander;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Wires the engine into a Spring Boot application. Every bean backs off when the
 * application defines its own.
 */
@AutoConfiguration
@EnableConfigurationProperties(PricelistProperties.class)
public class PricelistAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(PricelistAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public DetectionRules detectionRules(PricelistProperties properties) {
        DetectionRules rules = DetectionRules.fromClasspath(properties.getRulesLocation());
        log.info("Loaded detection rules from {}: keywords per role {}", properties.getRulesLocation(), rules.keywordCounts());
        return rules;
    }

    @Bean
    @ConditionalOnMissingBean
    public StructureDetector structureDetector(DetectionRules rules) {
        return new StructureDetector(rules);
    }

    @Bean
    @ConditionalOnMissingBean
    public SegmentRowExtractor segmentRowExtractor(StructureDetector detector) {
        return new SegmentRowExtractor(detector.getRoleMatcher());
    }

    @Bean
    @ConditionalOnMissingBean
    public PriceNormalizer priceNormalizer(DetectionRules rules) {
        return new PriceNormalizer(rules);
    }

    @Bean
    @ConditionalOnMissingBean
    public ProductFingerprinter productFingerprinter(PricelistProperties properties) {
        return new ProductFingerprinter(properties.getKnownBrands());
    }

    @Bean
    @ConditionalOnMissingBean
    public ProductDeduplicator productDeduplicator(ProductFingerprinter fingerprinter, PriceNormalizer normalizer,
                                                   PricelistProperties properties) {
        return new ProductDeduplicator(fingerprinter, normalizer, properties.getDefaultCategory());
    }

    @Bean
    @ConditionalOnMissingBean
    public SearchVariantExpander searchVariantExpander(DetectionRules rules) {
        return new SearchVariantExpander(rules);
    }

    @Bean
    @ConditionalOnMissingBean
    public SearchMatcher searchMatcher(SearchVariantExpander expander) {
        return new SearchMatcher(expander);
    }

    @Bean
    @ConditionalOnMissingBean
    public PricelistIngestService pricelistIngestService(StructureDetector detector, SegmentRowExtractor extractor,
                                                         ProductDeduplicator deduplicator, PricelistProperties properties) {
        return new PricelistIngestService(detector, extractor, deduplicator, properties);
    }
}
