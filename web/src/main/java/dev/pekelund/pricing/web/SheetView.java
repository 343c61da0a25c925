package dev.pekelund.pricing.web;

import dev.pekelund.pricing.certification.CertificationType;
import dev.pekelund.pricing.jobs.AnalysisJob;
import dev.pekelund.pricing.pricing.PricingRow;
import dev.pekelund.pricing.sheet.PricingSheetSession;
import dev.pekelund.pricing.sheet.Sheet;
import dev.pekelund.pricing.sheet.SheetTotals;
import java.math.BigDecimal;
import java.util.List;

/**
 * JSON view of an open pricing sheet: rows, totals, the certification types offered and the
 * analysis job the sheet follows, if any.
 */
public record SheetView(
    String batchId,
    BigDecimal languageMultiplier,
    boolean hasUnsavedChanges,
    List<PricingRow> rows,
    SheetTotals totals,
    List<CertificationType> certificationTypes,
    AnalysisJob job
) {

    static SheetView of(PricingSheetSession session) {
        Sheet sheet = session.sheet();
        return new SheetView(
            sheet.batchId(),
            sheet.languageMultiplier(),
            session.hasUnsavedChanges(),
            sheet.rows(),
            sheet.totals(),
            sheet.certificationTypes().asList(),
            session.currentJob().orElse(null));
    }
}
