package com.staybot.filter;

import com.staybot.model.Candidate;
import com.staybot.model.SearchCriteria;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CandidateFilterTest {

    private static final CurrencyConverter RATES = new CurrencyConverter(Map.of("EUR:RON", 5.0, "RON:EUR", 0.2));

    @Test
    void applyAll_shouldFilterCollapseAndSortByPrice() {
        CandidateFilter filter = new CandidateFilter(criteria(500.0, 7.0), RATES, false);

        List<Candidate> out = filter.applyAll(List.of(
                listing("Hotel Central", "Centrul Vechi", 450.0, "RON", 8.7),
                listing("Too Expensive", "Dorobanți", 900.0, "RON", 9.5),
                listing("Low Rated", "Pipera", 150.0, "RON", 6.0),
                listing("Garden Studio", "Floreasca", 60.0, "EUR", 8.0),
                listing("hotel central ", "centrul vechi", 300.0, "RON", 8.7)
        ));

        assertEquals(2, out.size());
        assertEquals("Garden Studio", out.get(0).title);
        assertEquals(300.0, out.get(0).price, 1e-9);
        assertEquals("RON", out.get(0).currency);
        assertEquals("Hotel Central", out.get(1).title);
    }

    @Test
    void filterByPrice_shouldCompareInCriteriaCurrency() {
        CandidateFilter filter = new CandidateFilter(criteria(500.0, 0.0), RATES, false);

        List<Candidate> out = filter.filterByPrice(List.of(
                listing("Euro Cheap", "A", 99.0, "EUR", 0.0),
                listing("Euro Dear", "B", 101.0, "EUR", 0.0)
        ));

        assertEquals(1, out.size());
        assertEquals(495.0, out.get(0).price, 1e-9);
    }

    @Test
    void filterDuplicates_shouldKeepFirstOccurrence() {
        CandidateFilter filter = new CandidateFilter(criteria(500.0, 0.0), RATES, false);

        List<Candidate> out = filter.filterDuplicates(List.of(
                listing("Vila Rosa", "Băneasa", 200.0, "RON", 8.0),
                listing("VILA ROSA", " băneasa", 150.0, "RON", 9.0)
        ));

        assertEquals(1, out.size());
        assertEquals(200.0, out.get(0).price, 1e-9);
    }

    @Test
    void highQualityOnly_shouldRequireRatingAndLocation() {
        CandidateFilter filter = new CandidateFilter(criteria(500.0, 0.0), RATES, true);

        List<Candidate> out = filter.applyAll(List.of(
                listing("Great", "Centru", 300.0, "RON", 8.0),
                listing("Good", "Centru", 280.0, "RON", 7.9),
                listing("Nowhere", "", 250.0, "RON", 9.0)
        ));

        assertEquals(1, out.size());
        assertEquals("Great", out.get(0).title);
        assertTrue(CandidateFilter.isHighQuality(out.get(0)));
        assertFalse(CandidateFilter.isHighQuality(listing("Free", "Centru", 0.0, "RON", 9.0)));
    }

    @Test
    void belowTarget_shouldMatchOnlyTargetCurrencyAtOrUnderTarget() {
        List<Candidate> hits = CandidateFilter.belowTarget(List.of(
                listing("At Target", "A", 400.0, "RON", 8.0),
                listing("Above", "B", 401.0, "RON", 8.0),
                listing("Other Currency", "C", 50.0, "EUR", 8.0)
        ), 400.0, "RON");

        assertEquals(1, hits.size());
        assertEquals("At Target", hits.get(0).title);
    }

    @Test
    void converter_shouldUseDirectThenPivotThenIdentity() {
        CurrencyConverter converter = new CurrencyConverter(Map.of(
                "EUR:RON", 5.0,
                "RON:USD", 0.25,
                "USD:EUR", 0.9));

        assertEquals(50.0, converter.convert(10.0, "eur", "RON"), 1e-9);
        assertEquals(12.5, converter.convert(10.0, "EUR", "USD"), 1e-9);
        assertEquals(10.0, converter.convert(10.0, "GBP", "RON"), 1e-9);
        assertEquals(10.0, converter.convert(10.0, "RON", "RON"), 1e-9);
    }

    private static Candidate listing(String title, String location, double price, String currency, double rating) {
        return Candidate.builder()
                .title(title)
                .location(location)
                .price(price)
                .currency(currency)
                .rating(rating)
                .source("booking")
                .amenities(List.of())
                .build();
    }

    private static SearchCriteria criteria(double maxPrice, double minRating) {
        return SearchCriteria.builder()
                .destination("București")
                .checkIn(LocalDate.of(2026, 4, 1))
                .checkOut(LocalDate.of(2026, 4, 3))
                .guests(2)
                .maxPrice(maxPrice)
                .currency("RON")
                .propertyTypes(List.of("hotel"))
                .minRating(minRating)
                .build();
    }
}
