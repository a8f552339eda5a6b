package com.levelsync.enrollment.catalog.model;

/**
 * 수강 등록 출처
 */
public enum AttributionSource {
    MEMBERSHIP,
    INDIVIDUAL;

    public static AttributionSource fromWireValue(String value) {
        if ("membership".equalsIgnoreCase(value)) {
            return MEMBERSHIP;
        }
        if ("individual".equalsIgnoreCase(value)) {
            return INDIVIDUAL;
        }
        return null;
    }

    public String toWireValue() {
        return name().toLowerCase();
    }
}
