package org.carball.bom.model.order;

/**
 * Why a vendor was dropped from the order. {@code amount} is the vendor's order total for
 * {@link ExclusionReason#BELOW_MINIMUM_ORDER} and the forgone savings for the shipping reasons.
 */
public record VendorExclusion(String vendorName, ExclusionReason reason, double amount, double limit) {

    public static VendorExclusion of(String vendorName, ExclusionReason reason) {
        return new VendorExclusion(vendorName, reason, 0.0, 0.0);
    }

    public String message() {
        return switch (reason) {
            case EXPLICIT -> String.format("Excluding '%s': excluded by order", vendorName);
            case NOT_ALLOWED -> String.format("Excluding '%s': not on the vendor allow-list", vendorName);
            case BELOW_MINIMUM_ORDER -> String.format("Excluding '%s': needed order %.2f < minimum order %.2f",
                    vendorName, amount, limit);
            case NO_SAVINGS -> String.format("Excluding '%s': saves nothing", vendorName);
            case SHIPPING_NOT_JUSTIFIED -> String.format("Excluding '%s': only saves %.2f (shipping threshold %.2f)",
                    vendorName, amount, limit);
        };
    }
}
