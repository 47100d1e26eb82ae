package org.carball.bom.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    public OptimizerSettings loadProfile(String profileName) {
        try {
            ShippingProfile profile = ShippingProfile.fromName(profileName);
            OptimizerSettings settings = profile.buildSettings();
            log.info("Loaded profile '{}': {}", profileName, settings.getConfigurationSummary());
            return settings;
        } catch (IllegalArgumentException e) {
            log.error("Unknown profile: {}. {}", profileName, e.getMessage());
            throw e;
        }
    }

    /**
     * Starts from {@code profileName} (or the defaults when it is {@code null}), then overlays the
     * settings file, environment variables and CLI arguments in that order.
     */
    public OptimizerSettings loadConfiguration(String profileName, Path settingsFile, String[] args) throws IOException {
        OptimizerSettings base = profileName == null ? OptimizerSettings.defaults() : loadProfile(profileName);
        OptimizerSettings.OptimizerSettingsBuilder builder = base.toBuilder();

        if (settingsFile != null) {
            applySettingsFile(builder, settingsFile);
        }
        applyEnvironmentVariables(builder);
        applyCLIArguments(builder, args);

        OptimizerSettings settings = builder.build();
        settings.validate();

        log.info("Configuration loaded with profile '{}': {}", settings.getProfileName(),
                settings.getConfigurationSummary());
        return settings;
    }

    void applySettingsFile(OptimizerSettings.OptimizerSettingsBuilder builder, Path settingsFile) throws IOException {
        ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
        yamlMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        SettingsFile file;
        try {
            file = yamlMapper.readValue(settingsFile.toFile(), SettingsFile.class);
        } catch (IOException e) {
            throw new IOException("Settings file " + settingsFile + " is not readable: " + e.getMessage(), e);
        }
        if (file == null) {
            log.warn("Settings file {} is empty", settingsFile);
            return;
        }

        log.debug("Applying settings file {}", settingsFile);
        if (file.getShippingThreshold() != null) {
            builder.shippingThreshold(file.getShippingThreshold());
        }
        if (file.getCacheTtlHours() != null) {
            builder.cacheTtlHours(file.getCacheTtlHours());
        }
        if (file.getNeverExcludeVendor() != null) {
            builder.neverExcludeVendor(file.getNeverExcludeVendor());
        }
        if (file.getAutoPriorityStart() != null) {
            builder.autoPriorityStart(file.getAutoPriorityStart());
        }
        if (file.getVendorMinimums() != null) {
            builder.vendorMinimums(new LinkedHashMap<>(file.getVendorMinimums()));
        }
        if (file.getVendorPriorities() != null) {
            builder.vendorPriorities(new LinkedHashMap<>(file.getVendorPriorities()));
        }
        if (file.getBaseCurrency() != null) {
            builder.baseCurrency(file.getBaseCurrency());
        }
        if (file.getExchangeRates() != null) {
            builder.exchangeRates(new LinkedHashMap<>(file.getExchangeRates()));
        }
    }

    private void applyEnvironmentVariables(OptimizerSettings.OptimizerSettingsBuilder builder) {
        try {
            if (environment.containsKey("BOM_SHIPPING_THRESHOLD")) {
                builder.shippingThreshold(Double.parseDouble(environment.get("BOM_SHIPPING_THRESHOLD")));
            }
            if (environment.containsKey("BOM_CACHE_TTL_HOURS")) {
                builder.cacheTtlHours(Integer.parseInt(environment.get("BOM_CACHE_TTL_HOURS")));
            }
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid numeric environment setting: {}", e.getMessage());
        }
        if (environment.containsKey("BOM_NEVER_EXCLUDE_VENDOR")) {
            builder.neverExcludeVendor(environment.get("BOM_NEVER_EXCLUDE_VENDOR"));
        }
    }

    private void applyCLIArguments(OptimizerSettings.OptimizerSettingsBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            try {
                switch (arg) {
                    case "--settings.shipping-threshold":
                        builder.shippingThreshold(Double.parseDouble(value));
                        break;
                    case "--settings.cache-ttl-hours":
                        builder.cacheTtlHours(Integer.parseInt(value));
                        break;
                    case "--settings.never-exclude":
                        builder.neverExcludeVendor(value);
                        break;
                    case "--settings.auto-priority-start":
                        builder.autoPriorityStart(Integer.parseInt(value));
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            }
        }
    }

    /**
     * Returns help text for settings options.
     */
    public static String getSettingsHelp() {
        return """
            Settings Options:

            CLI Arguments:
              --settings.shipping-threshold <num>   Savings a vendor must bring to be worth its shipping
              --settings.cache-ttl-hours <num>      Age after which cached quotes are discarded
              --settings.never-exclude <vendor>     Vendor the shipping pass never drops
              --settings.auto-priority-start <num>  First priority given to unlisted vendors
              --settings <file>                     YAML file with any of the settings below

            Settings File Keys:
              shipping_threshold, cache_ttl_hours, never_exclude_vendor, auto_priority_start,
              vendor_minimums, vendor_priorities, base_currency, exchange_rates

            Environment Variables:
              BOM_SHIPPING_THRESHOLD               Same as --settings.shipping-threshold
              BOM_CACHE_TTL_HOURS                  Same as --settings.cache-ttl-hours
              BOM_NEVER_EXCLUDE_VENDOR             Same as --settings.never-exclude

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Settings file
              4. Profile defaults or built-in defaults
            """;
    }

    @Data
    static class SettingsFile {
        @JsonProperty("shipping_threshold")
        private Double shippingThreshold;

        @JsonProperty("cache_ttl_hours")
        private Integer cacheTtlHours;

        @JsonProperty("never_exclude_vendor")
        private String neverExcludeVendor;

        @JsonProperty("auto_priority_start")
        private Integer autoPriorityStart;

        @JsonProperty("vendor_minimums")
        private Map<String, Double> vendorMinimums;

        @JsonProperty("vendor_priorities")
        private Map<String, Integer> vendorPriorities;

        @JsonProperty("base_currency")
        private String baseCurrency;

        @JsonProperty("exchange_rates")
        private Map<String, Double> exchangeRates;
    }
}
