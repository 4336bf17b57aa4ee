package com.staybot.fetch;

import com.staybot.config.Config;
import com.staybot.fetch.http.HttpClientEx;
import com.staybot.model.Candidate;
import com.staybot.model.SearchCriteria;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scrapes the Booking.com search results page.
 */
public final class BookingFetcher implements Fetcher {
    private static final Logger LOG = LogManager.getLogger(BookingFetcher.class);
    public static final String NAME = "booking";

    private static final Pattern NUMBER = Pattern.compile("[0-9][0-9.,\\s\\u00a0\\u202f]*");

    private final HttpClientEx http;
    private final String baseUrl;
    private final int timeoutSeconds;
    private final int maxResults;

    public BookingFetcher(Config config, HttpClientEx http) {
        this(http,
                config.getString("fetch.booking.base_url"),
                config.getInt("fetch.timeout_sec"),
                config.getInt("fetch.max_results"));
    }

    public BookingFetcher(HttpClientEx http, String baseUrl, int timeoutSeconds, int maxResults) {
        this.http = http;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeoutSeconds = Math.max(1, timeoutSeconds);
        this.maxResults = Math.max(1, maxResults);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Candidate> fetch(SearchCriteria criteria) throws FetchException {
        String url = buildSearchUrl(criteria);
        LOG.info("Searching {}: {}", NAME, url);
        String html;
        try {
            html = http.getText(url, timeoutSeconds);
        } catch (IOException e) {
            throw new FetchException(NAME, "request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(NAME, "request interrupted", e);
        } catch (IllegalArgumentException e) {
            throw new FetchException(NAME, "invalid search url: " + url, e);
        }
        List<Candidate> candidates = parse(html);
        LOG.info("Source {} returned {} listings", NAME, candidates.size());
        return candidates;
    }

    public String buildSearchUrl(SearchCriteria criteria) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("ss", criteria.destination);
        params.put("checkin", criteria.checkIn.toString());
        params.put("checkout", criteria.checkOut.toString());
        params.put("group_adults", String.valueOf(criteria.guests));
        params.put("group_children", "0");
        params.put("no_rooms", "1");
        params.put("sb_price_type", "total");
        params.put("lang", "ro");

        StringBuilder sb = new StringBuilder(baseUrl).append("/searchresults.html?");
        boolean first = true;
        for (Map.Entry<String, String> entry : params.entrySet()) {
            if (!first) {
                sb.append('&');
            }
            first = false;
            sb.append(entry.getKey()).append('=').append(URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8));
        }
        return sb.toString();
    }

    /**
     * Extracts listings from a results page. Cards without a positive price are dropped.
     */
    public List<Candidate> parse(String html) {
        Document doc = Jsoup.parse(html == null ? "" : html, baseUrl);
        Elements cards = doc.select("div[data-testid=property-card]");
        if (cards.isEmpty()) {
            cards = doc.select("div.sr_property_block, div.listItem");
        }
        LOG.debug("Found {} property cards", cards.size());

        List<Candidate> out = new ArrayList<>();
        for (Element card : cards) {
            if (out.size() >= maxResults) {
                break;
            }
            try {
                Candidate candidate = parseCard(card);
                if (candidate != null && candidate.price > 0.0) {
                    out.add(candidate);
                }
            } catch (RuntimeException e) {
                LOG.warn("Skipping unparseable property card: {}", e.getMessage());
            }
        }
        return out;
    }

    private Candidate parseCard(Element card) {
        Element titleEl = first(card, "[data-testid=title]", "h3");
        String title = titleEl == null ? "" : titleEl.text().trim();
        if (title.isEmpty()) {
            return null;
        }

        double price = 0.0;
        String currency = "RON";
        Element priceEl = first(card, "span[data-testid=price-and-discounted-price]", "span.prco-valign-middle-helper");
        if (priceEl != null) {
            String priceText = priceEl.text();
            price = parseAmount(priceText);
            currency = detectCurrency(priceText);
        }

        double rating = 0.0;
        Element ratingEl = first(card, "div[data-testid=review-score]");
        if (ratingEl != null) {
            rating = parseRating(ratingEl.text());
        }

        Element addressEl = first(card, "span[data-testid=address]");
        String location = addressEl == null ? "" : addressEl.text().trim();

        Element linkEl = first(card, "a[data-testid=title-link]", "a[href]");
        String url = linkEl == null ? null : emptyToNull(linkEl.absUrl("href"));

        Element imgEl = first(card, "img");
        String imageUrl = imgEl == null ? null : emptyToNull(imgEl.absUrl("src"));

        return Candidate.builder()
                .title(title)
                .price(price)
                .currency(currency)
                .rating(rating)
                .location(location)
                .url(url)
                .imageUrl(imageUrl)
                .description(null)
                .amenities(List.of())
                .source(NAME)
                .build();
    }

    private static Element first(Element root, String... selectors) {
        for (String selector : selectors) {
            Element found = root.selectFirst(selector);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    static String detectCurrency(String text) {
        if (text.contains("EUR") || text.contains("€")) {
            return "EUR";
        }
        if (text.contains("USD") || text.contains("$")) {
            return "USD";
        }
        return "RON";
    }

    /**
     * Reads a price such as "1.234 lei", "RON 1,234.50" or "€ 99". A lone separator followed by
     * exactly three digits is taken as a thousands separator.
     */
    static double parseAmount(String text) {
        Matcher m = NUMBER.matcher(text == null ? "" : text);
        if (!m.find()) {
            return 0.0;
        }
        String raw = m.group().replaceAll("[\\s\\u00a0\\u202f]", "");
        raw = raw.replaceAll("[.,]+$", "");
        int lastDot = raw.lastIndexOf('.');
        int lastComma = raw.lastIndexOf(',');
        String normalized;
        if (lastDot >= 0 && lastComma >= 0) {
            char decimal = lastDot > lastComma ? '.' : ',';
            char grouping = decimal == '.' ? ',' : '.';
            normalized = raw.replace(String.valueOf(grouping), "").replace(decimal, '.');
        } else if (lastDot >= 0 || lastComma >= 0) {
            char sep = lastDot >= 0 ? '.' : ',';
            int last = Math.max(lastDot, lastComma);
            boolean grouping = raw.length() - last - 1 == 3 || raw.indexOf(sep) != last;
            normalized = grouping ? raw.replace(String.valueOf(sep), "") : raw.replace(sep, '.');
        } else {
            normalized = raw;
        }
        try {
            return Double.parseDouble(normalized);
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    static double parseRating(String text) {
        Matcher m = Pattern.compile("([0-9]+(?:[.,][0-9]+)?)").matcher(text == null ? "" : text);
        if (!m.find()) {
            return 0.0;
        }
        double value = Double.parseDouble(m.group(1).replace(',', '.'));
        return value <= 10.0 ? value : 0.0;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
