package com.levelsync.enrollment.catalog.model;

/**
 * 수강 등록에 기록하는 출처 정보
 * levelId, orderId, orderCode는 없을 수 있다.
 */
public record EnrollmentAttribution(AttributionSource source, Long levelId, Long orderId, String orderCode) {

    public static EnrollmentAttribution membership(Long levelId) {
        return new EnrollmentAttribution(AttributionSource.MEMBERSHIP, levelId, null, null);
    }

    public static EnrollmentAttribution membership(Long levelId, Long orderId, String orderCode) {
        return new EnrollmentAttribution(AttributionSource.MEMBERSHIP, levelId, orderId, orderCode);
    }

    public static EnrollmentAttribution individual() {
        return new EnrollmentAttribution(AttributionSource.INDIVIDUAL, null, null, null);
    }
}
