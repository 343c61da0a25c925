package dev.pekelund.pricing.sheet;

import java.math.BigDecimal;

@FunctionalInterface
interface SheetLoader {

    Sheet load(String batchId, BigDecimal languageMultiplier);
}
