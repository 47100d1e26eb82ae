package org.carball.bom.selector;

import lombok.extern.slf4j.Slf4j;
import org.carball.bom.model.order.SelectionResult;
import org.carball.bom.model.part.ActualPart;
import org.carball.bom.model.part.ChoicePart;
import org.carball.bom.model.quote.PriceBreak;
import org.carball.bom.model.quote.VendorQuote;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Picks the cheapest way to buy one choice part.
 * <p>
 * Every (actual part, vendor quote, price break) triple is a candidate when the vendor is not
 * excluded and has enough stock for the order quantity, {@code max(required, break quantity)}.
 * The winner minimizes {@code (cost, orderQuantity, actualIndex, quoteIndex, breakIndex)}; the
 * trailing indices only make ties deterministic.
 */
@Slf4j
public class ChoicePartSelector {

    public Optional<SelectionResult> select(ChoicePart choicePart, int requiredQuantity,
                                            Set<String> excludedVendorNames) {
        SelectionResult best = null;

        List<ActualPart> actualParts = choicePart.getActualParts();
        for (int actualIndex = 0; actualIndex < actualParts.size(); actualIndex++) {
            ActualPart actualPart = actualParts.get(actualIndex);
            List<VendorQuote> quotes = actualPart.getQuotes();
            for (int quoteIndex = 0; quoteIndex < quotes.size(); quoteIndex++) {
                VendorQuote quote = quotes.get(quoteIndex);
                if (excludedVendorNames.contains(quote.vendorName())) {
                    continue;
                }

                List<PriceBreak> priceBreaks = quote.priceBreaks();
                for (int breakIndex = 0; breakIndex < priceBreaks.size(); breakIndex++) {
                    PriceBreak priceBreak = priceBreaks.get(breakIndex);
                    int orderQuantity = priceBreak.orderQuantity(requiredQuantity);
                    if (quote.availableQuantity() < orderQuantity) {
                        continue;
                    }

                    double cost = orderQuantity * priceBreak.unitPrice();
                    // Indices only grow while iterating, so a strict improvement keeps the lowest-index tie
                    if (best == null || isCheaper(cost, orderQuantity, best)) {
                        best = new SelectionResult(choicePart.getName(), actualPart, quote, breakIndex,
                                orderQuantity, cost);
                    }
                }
            }
        }

        if (best == null) {
            log.debug("No vendor can supply {} of {}", requiredQuantity, choicePart.getName());
        }
        return Optional.ofNullable(best);
    }

    private static boolean isCheaper(double cost, int orderQuantity, SelectionResult best) {
        int byCost = Double.compare(cost, best.totalCost());
        if (byCost != 0) {
            return byCost < 0;
        }
        return orderQuantity < best.orderQuantity();
    }
}
