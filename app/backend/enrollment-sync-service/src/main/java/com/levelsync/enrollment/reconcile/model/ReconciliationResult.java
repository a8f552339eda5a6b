package com.levelsync.enrollment.reconcile.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 재조정 결과 (로그 및 Internal API 응답용)
 *
 * @param enrolledCourseIds   새로 등록한 과목 (번들 하위 과목 포함)
 * @param unenrolledCourseIds 취소한 과목
 * @param failedCourseIds     처리 중 오류가 난 과목
 */
public record ReconciliationResult(
        Set<Long> enrolledCourseIds,
        Set<Long> unenrolledCourseIds,
        Set<Long> failedCourseIds
) {

    public ReconciliationResult {
        enrolledCourseIds = Collections.unmodifiableSet(new LinkedHashSet<>(enrolledCourseIds));
        unenrolledCourseIds = Collections.unmodifiableSet(new LinkedHashSet<>(unenrolledCourseIds));
        failedCourseIds = Collections.unmodifiableSet(new LinkedHashSet<>(failedCourseIds));
    }

    public static ReconciliationResult empty() {
        return new ReconciliationResult(Set.of(), Set.of(), Set.of());
    }

    /**
     * 같은 사용자에 대해 연달아 적용한 두 결과를 합친다.
     */
    public ReconciliationResult merge(ReconciliationResult next) {
        Set<Long> enrolled = new LinkedHashSet<>(enrolledCourseIds);
        enrolled.addAll(next.enrolledCourseIds());
        Set<Long> unenrolled = new LinkedHashSet<>(unenrolledCourseIds);
        unenrolled.addAll(next.unenrolledCourseIds());
        Set<Long> failed = new LinkedHashSet<>(failedCourseIds);
        failed.addAll(next.failedCourseIds());
        return new ReconciliationResult(enrolled, unenrolled, failed);
    }

    public boolean isEmpty() {
        return enrolledCourseIds.isEmpty() && unenrolledCourseIds.isEmpty() && failedCourseIds.isEmpty();
    }
}
