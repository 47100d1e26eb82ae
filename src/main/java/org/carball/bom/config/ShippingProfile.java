package org.carball.bom.config;

import lombok.Getter;

@Getter
public enum ShippingProfile {

    BALANCED("balanced", "Drop a vendor unless it saves at least one typical shipment", 15.0),

    LOW_SHIPPING("low-shipping", "Cheap domestic shipping - keep vendors that save a few dollars", 5.0),

    CONSOLIDATE("consolidate", "Strongly prefer fewer vendors and fewer packages", 50.0),

    COST_ONLY("cost-only", "Lowest part cost only - drop vendors only when they save nothing", 0.0);

    private final String name;
    private final String description;
    private final double shippingThreshold;

    ShippingProfile(String name, String description, double shippingThreshold) {
        this.name = name;
        this.description = description;
        this.shippingThreshold = shippingThreshold;
    }

    public OptimizerSettings buildSettings() {
        return OptimizerSettings.builder()
                .profileName(name)
                .profileDescription(description)
                .shippingThreshold(shippingThreshold)
                .build();
    }

    public static ShippingProfile fromName(String name) {
        for (ShippingProfile profile : values()) {
            if (profile.getName().equalsIgnoreCase(name)) {
                return profile;
            }
        }
        throw new IllegalArgumentException("Unknown shipping profile: " + name +
                ". Available profiles: " + getAvailableProfiles());
    }

    public static String getAvailableProfiles() {
        StringBuilder sb = new StringBuilder();
        for (ShippingProfile profile : values()) {
            if (!sb.isEmpty()) sb.append(", ");
            sb.append(profile.getName());
        }
        return sb.toString();
    }

    public static String getProfileHelp() {
        StringBuilder help = new StringBuilder();
        help.append("Available Shipping Profiles:\n\n");
        for (ShippingProfile profile : values()) {
            help.append(String.format("  %-15s %-6s %s\n", profile.getName(),
                    String.format("$%.0f", profile.getShippingThreshold()), profile.getDescription()));
        }
        help.append("\nUse --profile <name> to select a profile.\n");
        return help.toString();
    }
}
