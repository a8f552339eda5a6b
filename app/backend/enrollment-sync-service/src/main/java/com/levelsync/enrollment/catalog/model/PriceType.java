package com.levelsync.enrollment.catalog.model;

public enum PriceType {
    FREE,
    PAID;

    public static PriceType from(String value) {
        return "free".equalsIgnoreCase(value) ? FREE : PAID;
    }
}
