package org.carball.bom.optimizer;

import java.util.Comparator;

/**
 * Cost of the whole order with one more vendor excluded. Sorts so the most attractive vendor to drop
 * comes first.
 */
record TrialCost(int missingParts, double totalCost, int vendorPriority, String vendorName) {

    static final Comparator<TrialCost> ORDER = Comparator
            .comparingInt(TrialCost::missingParts)
            .thenComparingDouble(TrialCost::totalCost)
            .thenComparingInt(TrialCost::vendorPriority)
            .thenComparing(TrialCost::vendorName);
}
