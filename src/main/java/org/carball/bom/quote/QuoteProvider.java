package org.carball.bom.quote;

import org.carball.bom.model.part.ActualPart;
import org.carball.bom.model.quote.VendorQuote;

import java.util.List;

/**
 * Source of current vendor quotes for a manufacturer part. Implementations own their retry policy;
 * callers treat a failure as "no quotes".
 */
@FunctionalInterface
public interface QuoteProvider {

    List<VendorQuote> fetch(ActualPart actualPart) throws QuoteProviderException;

    /**
     * A provider that never finds anything; useful when the catalog carries inline offers only.
     */
    static QuoteProvider none() {
        return actualPart -> List.of();
    }
}
