package com.audico.pricelist.service.ingest;

import com.audico.pricelist.config.PricelistProperties;
import com.audico.pricelist.model.BrandSegment;
import com.audico.pricelist.model.Grid;
import com.audico.pricelist.model.PricingConfig;
import com.audico.pricelist.model.ProductRecord;
import com.audico.pricelist.model.RawProductRow;
import com.audico.pricelist.model.Structure;
import com.audico.pricelist.model.Warn;
import com.audico.pricelist.service.detection.SegmentRowExtractor;
import com.audico.pricelist.service.detection.StructureDetector;
import com.audico.pricelist.service.reconcile.ProductCatalog;
import com.audico.pricelist.service.reconcile.ProductDeduplicator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Runs one supplier sheet through detection, extraction, pricing and reconciliation.
 *
 * <h3>Flow</h3>
 * <ol>
 *   <li>{@link StructureDetector} infers layout and column roles</li>
 *   <li>{@link SegmentRowExtractor} reads raw rows from extractable segments</li>
 *   <li>{@link ProductDeduplicator} prices each row and folds it into the catalog</li>
 * </ol>
 *
 * <p>Problems with individual rows or segments become {@link Warn}s on the returned
 * {@link IngestReport}; only an invalid pricing config is raised as an exception. A sheet
 * whose structure is invalid yields an empty extraction and an {@code INVALID_STRUCTURE}
 * warning, leaving the target catalog untouched.
 */
public class PricelistIngestService {
    private static final Logger log = LoggerFactory.getLogger(PricelistIngestService.class);
    private static final int EVIDENCE_ROWS = 3;

    private final StructureDetector detector;
    private final SegmentRowExtractor extractor;
    private final ProductDeduplicator deduplicator;
    private final PricelistProperties properties;

    public PricelistIngestService(StructureDetector detector, SegmentRowExtractor extractor,
                                  ProductDeduplicator deduplicator, PricelistProperties properties) {
        this.detector = detector;
        this.extractor = extractor;
        this.deduplicator = deduplicator;
        this.properties = properties;
    }

    /** Ingests with the configured default pricing into a new catalog. */
    public IngestReport ingest(Grid grid, String supplierBrand) {
        return ingest(grid, properties.getPricing().toPricingConfig(), supplierBrand);
    }

    public IngestReport ingest(Grid grid, PricingConfig config, String supplierBrand) {
        return ingestInto(new ProductCatalog(), grid, config, supplierBrand);
    }

    /**
     * Ingests a sheet into an existing catalog, so several suppliers' sheets reconcile
     * into one set of records.
     *
     * @param supplierBrand brand given to rows of single-brand sheets; may be empty
     */
    public IngestReport ingestInto(ProductCatalog catalog, Grid grid, PricingConfig config, String supplierBrand) {
        log.info("Ingesting pricelist for '{}' ({} rows x {} columns)", supplierBrand, grid.rowCount(), grid.width());
        List<Warn> warnings = new ArrayList<>();
        Structure structure = detector.detect(grid);
        for (BrandSegment segment : structure.getSegments()) {
            if (!segment.isExtractable()) {
                warnings.add(Warn.segmentWithoutRoles(segment.getBrandName(), String.valueOf(segment.getRoles())));
            }
        }
        if (!structure.isValid()) {
            warnings.add(Warn.invalidStructure(previewRows(grid)));
            log.warn("No usable structure for '{}'; manual column mapping required", supplierBrand);
            return new IngestReport(structure, catalog, 0, 0, warnings);
        }
        List<RawProductRow> rows = extractor.extract(grid, structure, supplierBrand, properties.getDefaultCategory());
        int unpriced = fold(catalog, rows, config, warnings);
        log.info("Ingest for '{}' done: {} rows, {} unpriced, catalog now {} records, {} warnings",
                supplierBrand, rows.size(), unpriced, catalog.size(), warnings.size());
        return new IngestReport(structure, catalog, rows.size(), unpriced, warnings);
    }

    /**
     * Reconciles rows that did not come from a sheet, e.g. catalog exports carrying stock
     * and specials.
     */
    public IngestReport ingestRows(ProductCatalog catalog, Collection<RawProductRow> rows, PricingConfig config) {
        List<Warn> warnings = new ArrayList<>();
        int unpriced = fold(catalog, rows, config, warnings);
        log.info("Reconciled {} supplied rows, {} unpriced, catalog now {} records", rows.size(), unpriced, catalog.size());
        return new IngestReport(null, catalog, rows.size(), unpriced, warnings);
    }

    private int fold(ProductCatalog catalog, Collection<RawProductRow> rows, PricingConfig config, List<Warn> warnings) {
        int unpriced = 0;
        for (RawProductRow row : rows) {
            ProductRecord record = deduplicator.toRecord(row, config);
            if (row.isHasActiveSpecial() && !record.isHasActiveSpecial()) {
                warnings.add(ProductDeduplicator.hasSpecialPrice(row)
                        ? Warn.specialNotBelowRegular(subject(row), row.getSpecialPrice(), record.getRegularPrice().getSourceValue())
                        : Warn.specialWithoutPrice(subject(row), row.getSpecialPrice()));
            }
            if (!record.getRegularPrice().isPriced()) {
                unpriced++;
                warnings.add(Warn.unpriced(subject(row), record.getRegularPrice().getReason(), row.getRawPriceText()));
            }
            catalog.add(record);
        }
        return unpriced;
    }

    private static String subject(RawProductRow row) {
        return (row.getBrand() + " " + row.codeOrName()).trim();
    }

    private static String previewRows(Grid grid) {
        int n = Math.min(EVIDENCE_ROWS, grid.rowCount());
        List<String> lines = new ArrayList<>();
        for (int r = 0; r < n; r++) {
            lines.add(String.join(" | ", grid.row(r)));
        }
        return String.join(" / ", lines);
    }
}
