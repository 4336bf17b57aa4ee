package com.staybot.model;

public enum NotificationKind {
    NEW_ITEMS("new_accommodations"),
    PRICE_DROP("price_drop"),
    BELOW_TARGET("below_target"),
    TEST("test");

    private final String label;

    NotificationKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
