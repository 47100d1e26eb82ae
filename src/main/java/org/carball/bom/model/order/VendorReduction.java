package org.carball.bom.model.order;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Outcome of vendor set optimization: the final exclusion set and the exclusions made, in order.
 */
public record VendorReduction(Set<String> excludedVendorNames, List<VendorExclusion> exclusions) {

    public VendorReduction {
        excludedVendorNames = Collections.unmodifiableSet(new LinkedHashSet<>(excludedVendorNames));
        exclusions = List.copyOf(exclusions);
    }
}
