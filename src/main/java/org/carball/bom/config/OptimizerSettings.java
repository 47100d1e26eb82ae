package org.carball.bom.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.carball.bom.quote.ExchangeRates;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@Slf4j
public class OptimizerSettings {

    // Extra cost of one more vendor's shipping; cheaper alternatives below this are not worth it
    @Builder.Default
    private double shippingThreshold = 15.0;

    @Builder.Default
    private int cacheTtlHours = 48;

    // Vendor -> minimum order amount
    @Builder.Default
    private Map<String, Double> vendorMinimums = defaultVendorMinimums();

    // Vendor -> priority; lower is considered first for exclusion among equal costs
    @Builder.Default
    private Map<String, Integer> vendorPriorities = defaultVendorPriorities();

    @Builder.Default
    private int autoPriorityStart = 10;

    // Vendor the shipping pass never drops on its own; null for none
    private String neverExcludeVendor;

    @Builder.Default
    private String baseCurrency = ExchangeRates.DEFAULT_BASE_CURRENCY;

    @Builder.Default
    private Map<String, Double> exchangeRates = defaultExchangeRates();

    @Builder.Default
    private String profileName = "default";

    @Builder.Default
    private String profileDescription = "Default balanced shipping trade-off";

    public static OptimizerSettings defaults() {
        return OptimizerSettings.builder().build();
    }

    public Duration getCacheTtl() {
        return Duration.ofHours(cacheTtlHours);
    }

    public ExchangeRates toExchangeRates() {
        return new ExchangeRates(baseCurrency, exchangeRates);
    }

    /**
     * Logs warnings for values that are legal but probably mistaken.
     */
    public void validate() {
        if (shippingThreshold < 0.0) {
            log.warn("Shipping threshold ({}) is negative; no vendor will be dropped for shipping cost",
                    shippingThreshold);
        }

        if (cacheTtlHours <= 0) {
            log.warn("Cache TTL of {} hours discards every cached quote", cacheTtlHours);
        }

        Map<String, Double> usableMinimums = new LinkedHashMap<>();
        vendorMinimums.forEach((vendor, minimum) -> {
            if (minimum == null || minimum < 0.0) {
                log.warn("Ignoring minimum order for {} ({}); it must be a non-negative amount", vendor, minimum);
            } else {
                usableMinimums.put(vendor, minimum);
            }
        });
        vendorMinimums = usableMinimums;

        vendorPriorities.forEach((vendor, priority) -> {
            if (priority != null && priority >= autoPriorityStart && priority < autoPriorityStart + 990) {
                log.warn("Priority {} for {} overlaps the automatically assigned range starting at {}",
                        priority, vendor, autoPriorityStart);
            }
        });

        if (neverExcludeVendor != null && neverExcludeVendor.isBlank()) {
            log.warn("Never-exclude vendor is blank; treating it as unset");
            neverExcludeVendor = null;
        }

        log.debug("Using settings - Shipping: {}, TTL hours: {}, Minimums: {}, Profile: {}",
                shippingThreshold, cacheTtlHours, vendorMinimums.size(), profileName);
    }

    public String getConfigurationSummary() {
        return String.format("Profile: %s | Shipping threshold: %.2f | Cache TTL: %dh | Minimums: %d | Never exclude: %s",
                profileName, shippingThreshold, cacheTtlHours, vendorMinimums.size(),
                neverExcludeVendor == null ? "-" : neverExcludeVendor);
    }

    private static Map<String, Double> defaultVendorMinimums() {
        Map<String, Double> minimums = new LinkedHashMap<>();
        minimums.put("Verical", 100.00);
        minimums.put("Chip1Stop", 100.00);
        return minimums;
    }

    private static Map<String, Integer> defaultVendorPriorities() {
        Map<String, Integer> priorities = new LinkedHashMap<>();
        // 0-9: vendors with serious minimum orders or trans-oceanic shipping
        priorities.put("Verical", 0);
        priorities.put("Chip1Stop", 1);
        priorities.put("Farnell element14", 2);
        priorities.put("element14 Asia-Pacific", 2);
        // 1000+: explicitly preferred vendors
        priorities.put("Arrow", 1000);
        priorities.put("Avnet Express", 1001);
        priorities.put("Newark", 1002);
        priorities.put("Mouser", 1003);
        priorities.put("Digi-Key", 1004);
        return priorities;
    }

    private static Map<String, Double> defaultExchangeRates() {
        return new LinkedHashMap<>(ExchangeRates.defaults().getRatesToBase());
    }
}
