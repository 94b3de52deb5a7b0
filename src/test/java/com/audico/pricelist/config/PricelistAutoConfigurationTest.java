package com.audico.pricelist.config;

import com.audico.pricelist.model.Grid;
import com.audico.pricelist.service.detection.StructureDetector;
import com.audico.pricelist.service.ingest.IngestReport;
import com.audico.pricelist.service.ingest.PricelistIngestService;
import com.audico.pricelist.service.reconcile.ProductFingerprinter;
import com.audico.pricelist.service.search.SearchMatcher;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PricelistAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(PricelistAutoConfiguration.class));

    @Test
    public void registersEngineBeans() {
        runner.run(ctx -> {
            assertNull(ctx.getStartupFailure());
            assertNotNull(ctx.getBean(DetectionRules.class));
            assertNotNull(ctx.getBean(StructureDetector.class));
            assertNotNull(ctx.getBean(SearchMatcher.class));
            assertNotNull(ctx.getBean(PricelistIngestService.class));
        });
    }

    @Test
    public void propertiesBind() {
        runner.withPropertyValues(
                        "pricelist.known-brands=sonos,bose",
                        "pricelist.default-category=Misc",
                        "pricelist.pricing.price-type=retail_incl_vat",
                        "pricelist.pricing.markup=0.25")
                .run(ctx -> {
                    PricelistProperties props = ctx.getBean(PricelistProperties.class);
                    assertEquals("Misc", props.getDefaultCategory());
                    assertEquals(0.25, props.getPricing().getMarkup(), 1e-9);
                    assertEquals(List.of("sonos", "bose"), ctx.getBean(ProductFingerprinter.class).getKnownBrands());
                });
    }

    @Test
    public void userBeanWins() {
        runner.withBean(ProductFingerprinter.class, () -> new ProductFingerprinter(List.of("custom")))
                .run(ctx -> assertEquals(List.of("custom"), ctx.getBean(ProductFingerprinter.class).getKnownBrands()));
    }

    @Test
    public void missingRulesFailStartup() {
        runner.withPropertyValues("pricelist.rules-location=classpath:missing.json")
                .run(ctx -> assertNotNull(ctx.getStartupFailure()));
    }

    @Test
    public void ingestUsesDefaultPricing() {
        runner.run(ctx -> {
            Grid grid = Grid.ofRows(
                    List.of("Code", "Description", "Price"),
                    List.of("SC-LX904", "AV receiver", "1000"));
            IngestReport report = ctx.getBean(PricelistIngestService.class).ingest(grid, "Pioneer");
            assertEquals(1, report.catalog().size());
            double incl = report.catalog().getRecords().get(0).getPrice().getTriple().getCostInclVat();
            assertEquals(1150.0, incl, 1e-9);
        });
    }
}
