package org.carball.bom.model.quote;

import org.carball.bom.model.part.ActualPartKey;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * A distributor's offer for one {@link org.carball.bom.model.part.ActualPart}: stock on hand plus
 * price breaks in ascending quantity order.
 */
public record VendorQuote(
        ActualPartKey actualPartKey,
        String vendorName,
        String vendorPartName,
        int availableQuantity,
        List<PriceBreak> priceBreaks,
        Instant fetchedAt
) {

    public VendorQuote {
        Objects.requireNonNull(actualPartKey, "actualPartKey");
        Objects.requireNonNull(vendorName, "vendorName");
        Objects.requireNonNull(vendorPartName, "vendorPartName");
        if (availableQuantity < 0) {
            throw new IllegalArgumentException("Available quantity must not be negative for "
                    + vendorName + " " + vendorPartName);
        }
        List<PriceBreak> sorted = new ArrayList<>(priceBreaks == null ? List.of() : priceBreaks);
        sorted.sort(Comparator.comparingInt(PriceBreak::minQuantity));
        priceBreaks = List.copyOf(sorted);
        fetchedAt = fetchedAt == null ? Instant.EPOCH : fetchedAt;
    }

    public VendorKey key() {
        return new VendorKey(vendorName, vendorPartName);
    }

    public boolean isOlderThan(Instant cutoff) {
        return fetchedAt.isBefore(cutoff);
    }

    public String priceBreaksText() {
        return PriceBreak.format(priceBreaks);
    }
}
