package org.carball.bom.optimizer;

/**
 * Missing parts and total cost of an order under one exclusion set.
 */
public record OrderCost(int missingParts, double totalCost) {
}
