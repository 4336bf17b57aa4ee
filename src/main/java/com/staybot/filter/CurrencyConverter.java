package com.staybot.filter;

import com.staybot.config.Config;
import com.staybot.config.ConfigException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Fixed-rate currency conversion. Uses the direct rate when one is configured,
 * otherwise routes through the pivot currency, otherwise leaves the amount unchanged.
 */
public final class CurrencyConverter {
    public static final String PIVOT = "RON";

    private final Map<String, Double> rates;

    public CurrencyConverter(Map<String, Double> rates) {
        Map<String, Double> copy = new LinkedHashMap<>();
        if (rates != null) {
            rates.forEach((key, value) -> copy.put(key.toUpperCase(Locale.ROOT), value));
        }
        this.rates = Collections.unmodifiableMap(copy);
    }

    /**
     * Parses {@code currency.rates}, e.g. {@code EUR:RON=4.98,USD:RON=4.52}.
     */
    public static CurrencyConverter fromConfig(Config config) {
        Map<String, Double> rates = new LinkedHashMap<>();
        for (String entry : config.getList("currency.rates")) {
            int eq = entry.indexOf('=');
            int colon = entry.indexOf(':');
            if (eq <= 0 || colon <= 0 || colon > eq) {
                throw new ConfigException("currency.rates entry must look like FROM:TO=rate, got " + entry);
            }
            String from = entry.substring(0, colon).trim();
            String to = entry.substring(colon + 1, eq).trim();
            double rate;
            try {
                rate = Double.parseDouble(entry.substring(eq + 1).trim());
            } catch (NumberFormatException e) {
                throw new ConfigException("currency.rates has a non-numeric rate: " + entry, e);
            }
            if (!(rate > 0.0)) {
                throw new ConfigException("currency.rates must be positive: " + entry);
            }
            rates.put(key(from, to), rate);
        }
        return new CurrencyConverter(rates);
    }

    public double convert(double amount, String from, String to) {
        String src = normalize(from);
        String dst = normalize(to);
        if (src.equals(dst)) {
            return amount;
        }
        Double direct = rates.get(key(src, dst));
        if (direct != null) {
            return amount * direct;
        }
        if (!src.equals(PIVOT) && !dst.equals(PIVOT)
                && rates.containsKey(key(src, PIVOT)) && rates.containsKey(key(PIVOT, dst))) {
            return amount * rates.get(key(src, PIVOT)) * rates.get(key(PIVOT, dst));
        }
        return amount;
    }

    private static String key(String from, String to) {
        return normalize(from) + ":" + normalize(to);
    }

    private static String normalize(String code) {
        return code == null ? "" : code.trim().toUpperCase(Locale.ROOT);
    }
}
