package dev.pekelund.pricing.sheet;

import dev.pekelund.pricing.pricing.PricingRow;
import java.math.BigDecimal;
import java.util.Collection;

/**
 * Sums over the rows of a sheet that are not excluded.
 */
public record SheetTotals(
    int totalDocuments,
    BigDecimal totalBillablePages,
    BigDecimal translationSubtotal,
    BigDecimal certificationSubtotal,
    BigDecimal grandTotal
) {

    static SheetTotals of(Collection<PricingRow> rows) {
        int documents = 0;
        BigDecimal pages = BigDecimal.ZERO.setScale(1);
        BigDecimal translation = BigDecimal.ZERO.setScale(2);
        BigDecimal certification = BigDecimal.ZERO.setScale(2);
        BigDecimal total = BigDecimal.ZERO.setScale(2);
        for (PricingRow row : rows) {
            if (row.excluded()) {
                continue;
            }
            documents += row.documentCount();
            pages = pages.add(row.billablePages());
            translation = translation.add(row.translationCost());
            certification = certification.add(row.certificationCost());
            total = total.add(row.lineTotal());
        }
        return new SheetTotals(documents, pages, translation, certification, total);
    }
}
