package dev.pekelund.pricing.sheet;

import java.util.List;
import java.util.Objects;

/**
 * Result of applying an edit to a sheet: the new sheet and the store effects the edit implies.
 */
public record SheetTransition(Sheet sheet, List<SheetEffect> effects) {

    public SheetTransition {
        Objects.requireNonNull(sheet, "sheet");
        effects = effects != null ? List.copyOf(effects) : List.of();
    }

    static SheetTransition of(Sheet sheet) {
        return new SheetTransition(sheet, List.of());
    }

    static SheetTransition of(Sheet sheet, SheetEffect effect) {
        return new SheetTransition(sheet, List.of(effect));
    }

    public boolean hasEffects() {
        return !effects.isEmpty();
    }
}
