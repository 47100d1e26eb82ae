package org.carball.bom.quote;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * A fixed snapshot of exchange rates into one base currency. Rates are never refreshed during a run.
 */
@Getter
public class ExchangeRates {

    public static final String DEFAULT_BASE_CURRENCY = "USD";

    private final String baseCurrency;
    private final Map<String, Double> ratesToBase;

    public ExchangeRates(String baseCurrency, Map<String, Double> ratesToBase) {
        this.baseCurrency = baseCurrency.toUpperCase(Locale.ROOT);
        Map<String, Double> rates = new LinkedHashMap<>();
        ratesToBase.forEach((currency, rate) -> {
            if (rate == null || rate <= 0.0) {
                throw new IllegalArgumentException("Exchange rate for " + currency + " must be positive");
            }
            rates.put(currency.toUpperCase(Locale.ROOT), rate);
        });
        rates.put(this.baseCurrency, 1.0);
        this.ratesToBase = Collections.unmodifiableMap(rates);
    }

    /**
     * USD based snapshot covering the currencies the quote feeds usually report.
     */
    public static ExchangeRates defaults() {
        Map<String, Double> rates = new LinkedHashMap<>();
        rates.put("EUR", 1.08);
        rates.put("GBP", 1.27);
        return new ExchangeRates(DEFAULT_BASE_CURRENCY, rates);
    }

    public boolean supports(String currency) {
        return currency == null || ratesToBase.containsKey(currency.toUpperCase(Locale.ROOT));
    }

    /**
     * Converts {@code amount} in {@code currency} into the base currency. A {@code null} currency is
     * taken to already be the base currency.
     */
    public double toBase(double amount, String currency) {
        if (currency == null) {
            return amount;
        }
        Double rate = ratesToBase.get(currency.toUpperCase(Locale.ROOT));
        if (rate == null) {
            throw new IllegalArgumentException("No exchange rate from " + currency + " to " + baseCurrency);
        }
        return amount * rate;
    }
}
