package org.carball.bom.model.order;

import org.carball.bom.model.part.ChoicePart;

/**
 * Final outcome for one choice part of an order. {@code selection} is {@code null} when no vendor
 * can fulfill the part.
 */
public record PartSelection(
        ChoicePart choicePart,
        int requiredQuantity,
        String references,
        SelectionResult selection
) {

    public boolean isFulfilled() {
        return selection != null;
    }

    public String name() {
        return choicePart.getName();
    }

    public double totalCost() {
        return selection == null ? 0.0 : selection.totalCost();
    }

    public String vendorName() {
        return selection == null ? "" : selection.vendorName();
    }
}
