package com.levelsync.enrollment.catalog.model;

/**
 * Catalog 수강 등록 정보
 * attribution은 아직 기록되지 않았으면 null
 */
public record CourseEnrollment(
        Long enrollmentId,
        Long userId,
        Long courseId,
        EnrollmentStatus status,
        EnrollmentAttribution attribution
) {

    public boolean isActive() {
        return status == EnrollmentStatus.ACTIVE || status == EnrollmentStatus.COMPLETED;
    }

    public boolean isAttributed() {
        return attribution != null && attribution.source() != null;
    }

    public boolean isIndividual() {
        return isAttributed() && attribution.source() == AttributionSource.INDIVIDUAL;
    }
}
