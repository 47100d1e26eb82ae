package org.carball.bom.model.part;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.carball.bom.model.quote.VendorKey;
import org.carball.bom.model.quote.VendorQuote;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * A specific manufacturer part. Its quote list only grows: inline quotes from the catalog
 * definition first, then whatever the quote provider (or cache) supplies.
 */
@Slf4j
@Getter
public class ActualPart {

    private final ActualPartKey key;
    private final List<VendorQuote> quotes = new ArrayList<>();

    public ActualPart(String manufacturerName, String manufacturerPartName) {
        this.key = new ActualPartKey(manufacturerName, manufacturerPartName);
    }

    public String getManufacturerName() {
        return key.manufacturerName();
    }

    public String getManufacturerPartName() {
        return key.manufacturerPartName();
    }

    public List<VendorQuote> getQuotes() {
        return Collections.unmodifiableList(quotes);
    }

    /**
     * Appends {@code newQuotes}, skipping any vendor offer already present.
     *
     * @return number of quotes actually added
     */
    public int addQuotes(List<VendorQuote> newQuotes) {
        int added = 0;
        for (VendorQuote quote : newQuotes) {
            if (!key.equals(quote.actualPartKey())) {
                log.warn("Quote {} belongs to {} and not to {}; ignoring it",
                        quote.key(), quote.actualPartKey(), key);
                continue;
            }
            if (hasQuote(quote.key())) {
                log.debug("Quote {} already attached to {}", quote.key(), key);
                continue;
            }
            quotes.add(quote);
            added++;
        }
        return added;
    }

    public boolean hasQuote(VendorKey vendorKey) {
        return quotes.stream().anyMatch(quote -> quote.key().equals(vendorKey));
    }

    /**
     * Adds the vendor names of every quote not in {@code excludedVendorNames} to {@code vendorNames}.
     */
    public void collectVendorNames(Set<String> vendorNames, Set<String> excludedVendorNames) {
        for (VendorQuote quote : quotes) {
            if (!excludedVendorNames.contains(quote.vendorName())) {
                vendorNames.add(quote.vendorName());
            }
        }
    }

    @Override
    public String toString() {
        return key.toString();
    }
}
