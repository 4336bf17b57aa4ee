package com.staybot.model;

import com.staybot.config.Config;
import com.staybot.config.ConfigException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

/**
 * The standing query the agent polls for.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class SearchCriteria {
    public final String destination;
    public final LocalDate checkIn;
    public final LocalDate checkOut;
    public final int guests;
    public final double maxPrice;
    public final String currency;
    public final List<String> propertyTypes;
    public final double minRating;

    public int nights() {
        return (int) Math.max(1L, checkOut.toEpochDay() - checkIn.toEpochDay());
    }

    /**
     * Reads {@code search.*} keys. Explicit dates win; otherwise the stay starts
     * {@code search.days_ahead} days after {@code today} and lasts {@code search.nights}.
     */
    public static SearchCriteria fromConfig(Config config, LocalDate today) {
        String destination = config.getString("search.destination");
        if (destination.isEmpty()) {
            throw new ConfigException("search.destination must not be empty");
        }

        LocalDate checkIn = parseDate(config, "search.check_in");
        LocalDate checkOut = parseDate(config, "search.check_out");
        if (checkIn == null) {
            checkIn = today.plusDays(Math.max(0, config.getInt("search.days_ahead")));
        }
        if (checkOut == null) {
            checkOut = checkIn.plusDays(Math.max(1, config.getInt("search.nights")));
        }
        if (!checkOut.isAfter(checkIn)) {
            throw new ConfigException("search.check_out must be after search.check_in: "
                    + checkIn + " / " + checkOut);
        }

        int guests = config.getInt("search.guests");
        if (guests <= 0) {
            throw new ConfigException("search.guests must be positive, got " + guests);
        }
        double maxPrice = config.getDouble("search.max_price");
        if (!(maxPrice > 0.0)) {
            throw new ConfigException("search.max_price must be positive, got " + maxPrice);
        }
        double minRating = config.getDouble("search.min_rating");
        if (minRating < 0.0 || minRating > 10.0) {
            throw new ConfigException("search.min_rating must be within [0, 10], got " + minRating);
        }

        return SearchCriteria.builder()
                .destination(destination)
                .checkIn(checkIn)
                .checkOut(checkOut)
                .guests(guests)
                .maxPrice(maxPrice)
                .currency(config.getString("search.currency").toUpperCase(Locale.ROOT))
                .propertyTypes(List.copyOf(config.getList("search.property_types")))
                .minRating(minRating)
                .build();
    }

    private static LocalDate parseDate(Config config, String key) {
        String raw = config.getString(key);
        if (raw.isEmpty()) {
            return null;
        }
        try {
            return LocalDate.parse(raw);
        } catch (DateTimeParseException e) {
            throw new ConfigException(key + " must be an ISO date (yyyy-MM-dd), got " + raw, e);
        }
    }
}
