package org.carball.bom.model.quote;

import org.carball.bom.model.part.ActualPartKey;

/**
 * A vendor offer written directly into the catalog definition, e.g.
 * {@code ("Digi-Key", "490-1524-1-ND", "1/0.10 10/0.05")}.
 */
public record InlineOffer(String vendorName, String vendorPartName, String priceBreaks) {

    /**
     * Inline offers carry no stock figure, so they are treated as always in stock.
     */
    public static final int INLINE_STOCK = 1_000_000;

    public VendorQuote toQuote(ActualPartKey actualPartKey) {
        var breaks = PriceBreak.parseAll(priceBreaks);
        if (breaks.isEmpty()) {
            throw new IllegalArgumentException("Inline offer " + vendorName + " " + vendorPartName
                    + " for " + actualPartKey + " has no price breaks");
        }
        return new VendorQuote(actualPartKey, vendorName, vendorPartName, INLINE_STOCK, breaks, null);
    }
}
