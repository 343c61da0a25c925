package dev.pekelund.pricing.settings;

/**
 * Source of the global billing constants.
 */
public interface PricingSettingsProvider {

    PricingSettings loadSettings();
}
