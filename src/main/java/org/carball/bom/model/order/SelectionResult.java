package org.carball.bom.model.order;

import org.carball.bom.model.part.ActualPart;
import org.carball.bom.model.quote.PriceBreak;
import org.carball.bom.model.quote.VendorQuote;

/**
 * The chosen (actual part, vendor quote, price break) for one choice part. Derived data: recomputed
 * whenever the excluded vendor set changes and never persisted.
 */
public record SelectionResult(
        String choicePartName,
        ActualPart actualPart,
        VendorQuote vendorQuote,
        int priceBreakIndex,
        int orderQuantity,
        double totalCost
) {

    public String vendorName() {
        return vendorQuote.vendorName();
    }

    public PriceBreak priceBreak() {
        return vendorQuote.priceBreaks().get(priceBreakIndex);
    }
}
