package com.staybot.filter;

import com.staybot.identity.IdentityHasher;
import com.staybot.model.Candidate;
import com.staybot.model.SearchCriteria;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Narrows raw fetch results down to what the criteria ask for.
 */
public final class CandidateFilter {
    private static final Logger LOG = LogManager.getLogger(CandidateFilter.class);
    static final double HIGH_QUALITY_MIN_RATING = 8.0;

    private final SearchCriteria criteria;
    private final CurrencyConverter converter;
    private final boolean highQualityOnly;

    public CandidateFilter(SearchCriteria criteria, CurrencyConverter converter, boolean highQualityOnly) {
        this.criteria = criteria;
        this.converter = converter;
        this.highQualityOnly = highQualityOnly;
    }

    /**
     * Price ceiling, minimum rating, optional quality gate, duplicate collapse, then cheapest first.
     */
    public List<Candidate> applyAll(List<Candidate> candidates) {
        List<Candidate> filtered = filterByPrice(candidates);
        LOG.debug("After price filter: {}", filtered.size());
        filtered = filterByRating(filtered);
        LOG.debug("After rating filter: {}", filtered.size());
        if (highQualityOnly) {
            filtered = filterHighQuality(filtered);
            LOG.debug("After quality filter: {}", filtered.size());
        }
        filtered = filterDuplicates(filtered);
        LOG.debug("After duplicate collapse: {}", filtered.size());
        filtered.sort(Comparator.comparingDouble((Candidate c) -> c.price));
        return filtered;
    }

    /**
     * Keeps candidates whose price, converted into the criteria currency, is within the ceiling.
     * Survivors carry the converted price and currency.
     */
    public List<Candidate> filterByPrice(List<Candidate> candidates) {
        List<Candidate> out = new ArrayList<>();
        for (Candidate candidate : candidates) {
            double converted = converter.convert(candidate.price, candidate.currency, criteria.currency);
            if (converted <= criteria.maxPrice) {
                out.add(candidate.toBuilder().price(converted).currency(criteria.currency).build());
            }
        }
        return out;
    }

    public List<Candidate> filterByRating(List<Candidate> candidates) {
        List<Candidate> out = new ArrayList<>();
        for (Candidate candidate : candidates) {
            if (candidate.rating >= criteria.minRating) {
                out.add(candidate);
            }
        }
        return out;
    }

    /**
     * First occurrence wins per normalized title and location.
     */
    public List<Candidate> filterDuplicates(List<Candidate> candidates) {
        Set<String> seen = new HashSet<>();
        List<Candidate> out = new ArrayList<>();
        for (Candidate candidate : candidates) {
            String key = IdentityHasher.normalize(candidate.title) + "_" + IdentityHasher.normalize(candidate.location);
            if (seen.add(key)) {
                out.add(candidate);
            }
        }
        return out;
    }

    public List<Candidate> filterHighQuality(List<Candidate> candidates) {
        List<Candidate> out = new ArrayList<>();
        for (Candidate candidate : candidates) {
            if (isHighQuality(candidate)) {
                out.add(candidate);
            }
        }
        return out;
    }

    public static boolean isHighQuality(Candidate candidate) {
        return candidate.rating >= HIGH_QUALITY_MIN_RATING
                && candidate.price > 0.0
                && candidate.title != null && !candidate.title.isBlank()
                && candidate.location != null && !candidate.location.isBlank();
    }

    /**
     * Candidates already in {@code currency} priced at or below {@code targetPrice}.
     */
    public static List<Candidate> belowTarget(List<Candidate> candidates, double targetPrice, String currency) {
        List<Candidate> out = new ArrayList<>();
        for (Candidate candidate : candidates) {
            if (candidate.currency != null && candidate.currency.equalsIgnoreCase(currency)
                    && candidate.price <= targetPrice) {
                out.add(candidate);
            }
        }
        return out;
    }
}
