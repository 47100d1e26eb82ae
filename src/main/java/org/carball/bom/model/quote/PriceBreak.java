package org.carball.bom.model.quote;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * A pricing tier: ordering at least {@code minQuantity} pieces costs {@code unitPrice} each.
 */
public record PriceBreak(
        @JsonProperty("min_quantity") int minQuantity,
        @JsonProperty("unit_price") double unitPrice
) {

    public PriceBreak {
        if (minQuantity < 1) {
            throw new IllegalArgumentException("Price break quantity must be positive: " + minQuantity);
        }
        if (unitPrice < 0.0) {
            throw new IllegalArgumentException("Price break price must not be negative: " + unitPrice);
        }
    }

    /**
     * Quantity actually ordered at this tier when {@code requiredQuantity} pieces are needed.
     */
    public int orderQuantity(int requiredQuantity) {
        return Math.max(requiredQuantity, minQuantity);
    }

    public double cost(int requiredQuantity) {
        return orderQuantity(requiredQuantity) * unitPrice;
    }

    /**
     * Parses whitespace separated {@code quantity/price} pairs such as {@code "1/0.10 10/0.05"}.
     * The result is sorted by ascending quantity.
     */
    public static List<PriceBreak> parseAll(String text) {
        List<PriceBreak> breaks = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return breaks;
        }

        for (String pair : text.trim().split("\\s+")) {
            String[] parts = pair.split("/");
            if (parts.length != 2) {
                throw new IllegalArgumentException("Price break '" + pair + "' is not of the form quantity/price");
            }

            int quantity;
            try {
                quantity = Integer.parseInt(parts[0]);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Quantity '" + parts[0] + "' is not an integer");
            }

            double price;
            try {
                price = Double.parseDouble(parts[1].replace("$", ""));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Price '" + parts[1] + "' is not a number");
            }
            breaks.add(new PriceBreak(quantity, price));
        }

        breaks.sort(Comparator.comparingInt(PriceBreak::minQuantity));
        return breaks;
    }

    public static String format(List<PriceBreak> breaks) {
        StringBuilder text = new StringBuilder();
        for (PriceBreak priceBreak : breaks) {
            if (!text.isEmpty()) text.append(' ');
            text.append(String.format("%d/$%.3f", priceBreak.minQuantity(), priceBreak.unitPrice()));
        }
        return text.toString();
    }
}
