package org.carball.bom.model.order;

import java.util.List;
import java.util.Set;

/**
 * Everything report generators need from a processed order.
 */
public record OrderResult(
        List<PartSelection> selections,
        int missingPartsCount,
        int errorCount,
        Set<String> excludedVendorNames,
        List<VendorExclusion> vendorExclusions,
        List<String> finalVendorNames,
        double totalCost
) {

    public List<PartSelection> missingParts() {
        return selections.stream().filter(selection -> !selection.isFulfilled()).toList();
    }
}
