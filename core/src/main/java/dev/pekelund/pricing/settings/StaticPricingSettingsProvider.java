package dev.pekelund.pricing.settings;

import java.util.Objects;

/**
 * Provider returning a fixed set of settings, used when no settings store is configured.
 */
public class StaticPricingSettingsProvider implements PricingSettingsProvider {

    private final PricingSettings settings;

    public StaticPricingSettingsProvider(PricingSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    @Override
    public PricingSettings loadSettings() {
        return settings;
    }
}
