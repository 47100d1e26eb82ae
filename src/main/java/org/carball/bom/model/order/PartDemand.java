package org.carball.bom.model.order;

import org.carball.bom.model.part.ChoicePart;

/**
 * A choice part together with the number of pieces an order needs.
 */
public record PartDemand(ChoicePart choicePart, int requiredQuantity) {
}
