package com.audico.pricelist.service.ingest;

import com.audico.pricelist.model.Structure;
import com.audico.pricelist.model.Warn;
import com.audico.pricelist.service.reconcile.ProductCatalog;

import java.util.List;

/**
 * Outcome of ingesting one pricelist sheet.
 *
 * @param structure     detected layout, kept even when invalid so the caller can offer manual mapping;
 *                      null for rows that did not come from a sheet
 * @param catalog       catalog the rows were folded into
 * @param rowsExtracted rows read from the sheet
 * @param unpricedRows  rows that carried no usable regular price
 * @param warnings      non-fatal issues, in the order they were found
 */
public record IngestReport(Structure structure,
                           ProductCatalog catalog,
                           int rowsExtracted,
                           int unpricedRows,
                           List<Warn> warnings) {

    public IngestReport {
        warnings = List.copyOf(warnings);
    }

    public boolean isValid() {
        return structure == null || structure.isValid();
    }
}
