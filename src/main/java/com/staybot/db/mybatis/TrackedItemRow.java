package com.staybot.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrackedItemRow {
    private long id;
    private String identityKey;
    private String title;
    private double price;
    private String currency;
    private double rating;
    private String location;
    private String url;
    private String imageUrl;
    private String description;
    private String amenities;
    private String source;
    private long firstSeen;
    private long lastSeen;
    private int timesSeen;
    private boolean notified;
    private Long lastDropAlertObservationId;
}
