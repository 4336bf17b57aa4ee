package com.staybot.identity;

import com.staybot.model.Candidate;
import com.staybot.model.SearchCriteria;
import org.json.JSONObject;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Stable content keys for listings and search criteria.
 *
 * <p>An item key depends only on normalized title, location and source, so
 * price and rating changes never split one listing into two tracked items.
 * A criteria key ignores the stay dates, so rolling date windows keep
 * aggregating under one key.
 */
public final class IdentityHasher {

    private IdentityHasher() {
    }

    public static String itemIdentity(Candidate candidate) {
        if (candidate == null) {
            throw new IllegalArgumentException("candidate must not be null");
        }
        return itemIdentity(candidate.title, candidate.location, candidate.source);
    }

    public static String itemIdentity(String title, String location, String source) {
        String material = normalize(title) + "_" + normalize(location) + "_" + normalize(source);
        return md5Hex(material);
    }

    public static String criteriaIdentity(SearchCriteria criteria) {
        return md5Hex(canonicalJson(criteriaFields(criteria, false)));
    }

    /**
     * Full criteria, dates included, as canonical JSON for the search log.
     */
    public static String criteriaJson(SearchCriteria criteria) {
        return canonicalJson(criteriaFields(criteria, true));
    }

    public static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    private static Map<String, Object> criteriaFields(SearchCriteria criteria, boolean includeDates) {
        if (criteria == null) {
            throw new IllegalArgumentException("criteria must not be null");
        }
        Map<String, Object> fields = new TreeMap<>();
        fields.put("destination", criteria.destination == null ? "" : criteria.destination.trim());
        fields.put("guests", criteria.guests);
        fields.put("max_price", criteria.maxPrice);
        fields.put("currency", criteria.currency == null ? "" : criteria.currency.trim());
        List<String> types = new ArrayList<>(criteria.propertyTypes == null ? List.of() : criteria.propertyTypes);
        fields.put("property_types", types);
        fields.put("min_rating", criteria.minRating);
        if (includeDates) {
            fields.put("check_in", String.valueOf(criteria.checkIn));
            fields.put("check_out", String.valueOf(criteria.checkOut));
        }
        return fields;
    }

    // JSONObject keeps keys in a HashMap, so ordering is written out by hand.
    private static String canonicalJson(Map<String, Object> sorted) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : sorted.entrySet()) {
            if (!first) {
                sb.append(',');
            }
            first = false;
            sb.append(JSONObject.quote(entry.getKey()))
                    .append(':')
                    .append(JSONObject.valueToString(entry.getValue()));
        }
        return sb.append('}').toString();
    }

    static String md5Hex(String material) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            byte[] hash = digest.digest(material.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                sb.append(String.format(Locale.ROOT, "%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
