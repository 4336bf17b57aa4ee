package com.staybot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One listing as returned by a fetcher. Carries no identity until hashed.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class Candidate {
    public final String title;
    public final double price;
    public final String currency;
    /** Review score on a 0-10 scale; 0 when the source shows none. */
    public final double rating;
    public final String location;
    public final String url;
    public final String imageUrl;
    public final String description;
    public final List<String> amenities;
    public final String source;
}
