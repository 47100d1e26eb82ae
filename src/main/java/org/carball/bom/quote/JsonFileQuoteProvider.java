package org.carball.bom.quote;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.carball.bom.model.part.ActualPart;
import org.carball.bom.model.part.ActualPartKey;
import org.carball.bom.model.quote.PriceBreak;
import org.carball.bom.model.quote.VendorQuote;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Serves quotes from an exported JSON quote feed, converting foreign currency prices into the base
 * currency of an {@link ExchangeRates} snapshot.
 * <p>
 * Feed format:
 * <pre>
 * {"quotes": [{"manufacturer": "Yageo", "manufacturer_part_name": "RC0603FR-0710KL",
 *              "vendor_name": "Mouser", "vendor_part_name": "603-RC0603FR-0710KL",
 *              "available_quantity": 5000, "currency": "USD",
 *              "price_breaks": [{"min_quantity": 1, "unit_price": 0.10}]}]}
 * </pre>
 */
@Slf4j
public class JsonFileQuoteProvider implements QuoteProvider {

    private final Map<ActualPartKey, List<FeedQuote>> feed = new HashMap<>();
    private final ExchangeRates exchangeRates;
    private final Clock clock;

    public JsonFileQuoteProvider(Path feedFile, ExchangeRates exchangeRates, Clock clock) throws IOException {
        if (!Files.exists(feedFile)) {
            throw new IOException("Quote feed file not found: " + feedFile);
        }
        this.exchangeRates = exchangeRates;
        this.clock = clock;

        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        QuoteFeed quoteFeed = objectMapper.readValue(feedFile.toFile(), QuoteFeed.class);
        if (quoteFeed.getQuotes() == null) {
            throw new IllegalStateException("Missing quotes section in quote feed " + feedFile);
        }

        for (FeedQuote quote : quoteFeed.getQuotes()) {
            ActualPartKey key = new ActualPartKey(quote.getManufacturer(), quote.getManufacturerPartName());
            feed.computeIfAbsent(key, k -> new ArrayList<>()).add(quote);
        }
        log.info("Loaded quote feed {} with offers for {} parts", feedFile, feed.size());
    }

    @Override
    public List<VendorQuote> fetch(ActualPart actualPart) throws QuoteProviderException {
        List<FeedQuote> offers = feed.getOrDefault(actualPart.getKey(), List.of());
        Instant now = clock.instant();

        List<VendorQuote> quotes = new ArrayList<>();
        for (FeedQuote offer : offers) {
            if (!exchangeRates.supports(offer.getCurrency())) {
                throw new QuoteProviderException("Quote " + offer.getVendorName() + " " + offer.getVendorPartName()
                        + " is priced in " + offer.getCurrency() + ", which has no exchange rate to "
                        + exchangeRates.getBaseCurrency());
            }

            List<PriceBreak> breaks = new ArrayList<>();
            for (PriceBreak priceBreak : offer.getPriceBreaks()) {
                breaks.add(new PriceBreak(priceBreak.minQuantity(),
                        exchangeRates.toBase(priceBreak.unitPrice(), offer.getCurrency())));
            }
            if (breaks.isEmpty()) {
                log.debug("Skipping {} {}: no price breaks", offer.getVendorName(), offer.getVendorPartName());
                continue;
            }
            quotes.add(new VendorQuote(actualPart.getKey(), offer.getVendorName(), offer.getVendorPartName(),
                    offer.getAvailableQuantity(), breaks, now));
        }

        log.debug("Found {} quotes for {}", quotes.size(), actualPart.getKey());
        return quotes;
    }

    @Data
    @NoArgsConstructor
    static class QuoteFeed {
        @JsonProperty("quotes")
        private List<FeedQuote> quotes;
    }

    @Data
    @NoArgsConstructor
    static class FeedQuote {
        @JsonProperty("manufacturer")
        private String manufacturer;

        @JsonProperty("manufacturer_part_name")
        private String manufacturerPartName;

        @JsonProperty("vendor_name")
        private String vendorName;

        @JsonProperty("vendor_part_name")
        private String vendorPartName;

        @JsonProperty("available_quantity")
        private int availableQuantity;

        @JsonProperty("currency")
        private String currency;

        @JsonProperty("price_breaks")
        private List<PriceBreak> priceBreaks = new ArrayList<>();
    }
}
