package org.carball.bom.model.order;

public enum ExclusionReason {
    EXPLICIT,
    NOT_ALLOWED,
    BELOW_MINIMUM_ORDER,
    NO_SAVINGS,
    SHIPPING_NOT_JUSTIFIED
}
