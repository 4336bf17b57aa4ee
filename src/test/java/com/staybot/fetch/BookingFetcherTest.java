package com.staybot.fetch;

import com.staybot.config.Config;
import com.staybot.config.ConfigException;
import com.staybot.fetch.http.HttpClientEx;
import com.staybot.model.Candidate;
import com.staybot.model.SearchCriteria;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BookingFetcherTest {

    private static final String BASE = "https://www.booking.com";

    @Test
    void parse_fixture_shouldExtractPricedCards() throws Exception {
        BookingFetcher fetcher = new BookingFetcher(new CannedHttp(null), BASE, 10, 25);

        List<Candidate> out = fetcher.parse(fixture());

        assertEquals(3, out.size());
        Candidate central = out.get(0);
        assertEquals("Hotel Central", central.title);
        assertEquals(1234.0, central.price, 1e-9);
        assertEquals("RON", central.currency);
        assertEquals(8.7, central.rating, 1e-9);
        assertEquals("Centrul Vechi, București", central.location);
        assertEquals("https://www.booking.com/hotel/ro/central.ro.html", central.url);
        assertEquals("https://cf.bstatic.com/images/central.jpg", central.imageUrl);
        assertEquals("booking", central.source);

        assertEquals(450.0, out.get(1).price, 1e-9);
        assertEquals(9.1, out.get(1).rating, 1e-9);

        Candidate garden = out.get(2);
        assertEquals("EUR", garden.currency);
        assertEquals(99.0, garden.price, 1e-9);
        assertEquals(0.0, garden.rating, 1e-9);
        assertNull(garden.imageUrl);
    }

    @Test
    void parse_shouldStopAtMaxResults() throws Exception {
        BookingFetcher fetcher = new BookingFetcher(new CannedHttp(null), BASE, 10, 2);

        assertEquals(2, fetcher.parse(fixture()).size());
    }

    @Test
    void parse_unrelatedPage_shouldReturnEmpty() {
        BookingFetcher fetcher = new BookingFetcher(new CannedHttp(null), BASE, 10, 25);

        assertTrue(fetcher.parse("<html><body><p>captcha</p></body></html>").isEmpty());
        assertTrue(fetcher.parse(null).isEmpty());
    }

    @Test
    void buildSearchUrl_shouldEncodeCriteria() {
        BookingFetcher fetcher = new BookingFetcher(new CannedHttp(null), BASE + "/", 10, 25);

        String url = fetcher.buildSearchUrl(criteria());

        assertTrue(url.startsWith("https://www.booking.com/searchresults.html?ss=Bucure%C8%99ti%2C+Rom%C3%A2nia"));
        assertTrue(url.contains("&checkin=2026-04-01&checkout=2026-04-03"));
        assertTrue(url.contains("&group_adults=2&group_children=0&no_rooms=1"));
    }

    @Test
    void fetch_shouldParseDownloadedPage() throws Exception {
        CannedHttp http = new CannedHttp(fixture());
        BookingFetcher fetcher = new BookingFetcher(http, BASE, 10, 25);

        List<Candidate> out = fetcher.fetch(criteria());

        assertEquals(3, out.size());
        assertTrue(http.lastUrl.contains("searchresults.html"));
    }

    @Test
    void fetch_httpFailure_shouldRaiseFetchExceptionNamingSource() {
        BookingFetcher fetcher = new BookingFetcher(new CannedHttp(null), BASE, 10, 25);

        FetchException e = assertThrows(FetchException.class, () -> fetcher.fetch(criteria()));
        assertEquals("booking", e.source());
    }

    @Test
    void parseAmount_shouldHandleLocaleSeparators() {
        assertEquals(1234.0, BookingFetcher.parseAmount("1.234 lei"), 1e-9);
        assertEquals(1234.5, BookingFetcher.parseAmount("RON 1,234.50"), 1e-9);
        assertEquals(1234.5, BookingFetcher.parseAmount("1.234,50 lei"), 1e-9);
        assertEquals(123.45, BookingFetcher.parseAmount("123,45 lei"), 1e-9);
        assertEquals(1234.0, BookingFetcher.parseAmount("1 234 lei"), 1e-9);
        assertEquals(0.0, BookingFetcher.parseAmount("preț indisponibil"), 1e-9);
    }

    @Test
    void detectCurrency_shouldDefaultToRon() {
        assertEquals("EUR", BookingFetcher.detectCurrency("€ 99"));
        assertEquals("USD", BookingFetcher.detectCurrency("US$120"));
        assertEquals("RON", BookingFetcher.detectCurrency("450 lei"));
    }

    @Test
    void registry_shouldRejectUnknownSources() {
        HttpClientEx http = new CannedHttp(null);

        FetcherRegistry registry = FetcherRegistry.fromConfig(Config.fromMap(Path.of("."), Map.of()), http);
        assertEquals(List.of("booking"), registry.names());
        assertThrows(ConfigException.class, () -> FetcherRegistry.fromConfig(
                Config.fromMap(Path.of("."), Map.of("sources", "booking,tripadvisor")), http));
        assertThrows(IllegalArgumentException.class,
                () -> registry.register(new BookingFetcher(http, BASE, 10, 25)));
    }

    private static String fixture() throws IOException {
        try (InputStream in = BookingFetcherTest.class.getResourceAsStream("/fixtures/booking_results.html")) {
            if (in == null) {
                throw new IOException("missing fixture booking_results.html");
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static SearchCriteria criteria() {
        return SearchCriteria.builder()
                .destination("București, România")
                .checkIn(LocalDate.of(2026, 4, 1))
                .checkOut(LocalDate.of(2026, 4, 3))
                .guests(2)
                .maxPrice(500.0)
                .currency("RON")
                .propertyTypes(List.of("hotel"))
                .minRating(7.0)
                .build();
    }

    private static final class CannedHttp extends HttpClientEx {
        private final String body;
        private String lastUrl;

        private CannedHttp(String body) {
            super("test-agent", 1);
            this.body = body;
        }

        @Override
        public String getText(String url, int timeoutSeconds) throws IOException {
            lastUrl = url;
            if (body == null) {
                throw new IOException("HTTP 503 for " + url);
            }
            return body;
        }
    }
}
