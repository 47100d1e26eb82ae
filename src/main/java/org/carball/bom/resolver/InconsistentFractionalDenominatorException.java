package org.carball.bom.resolver;

/**
 * Two fractional parts slice the same choice part with different denominators. This is a catalog
 * modeling mistake that cannot be worked around, so it is not recoverable.
 */
public class InconsistentFractionalDenominatorException extends IllegalStateException {

    public InconsistentFractionalDenominatorException(String message) {
        super(message);
    }
}
