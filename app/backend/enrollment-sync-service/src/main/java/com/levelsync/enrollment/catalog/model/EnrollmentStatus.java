package com.levelsync.enrollment.catalog.model;

public enum EnrollmentStatus {
    ACTIVE,
    COMPLETED,
    CANCELLED;

    public static EnrollmentStatus from(String value) {
        if (value == null) {
            return CANCELLED;
        }
        return switch (value.toLowerCase()) {
            case "completed" -> COMPLETED;
            case "cancel", "cancelled", "canceled" -> CANCELLED;
            default -> ACTIVE;
        };
    }

    public String toWireValue() {
        return name().toLowerCase();
    }
}
