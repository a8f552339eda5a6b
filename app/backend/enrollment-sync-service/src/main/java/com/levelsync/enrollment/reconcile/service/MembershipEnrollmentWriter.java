package com.levelsync.enrollment.reconcile.service;

import com.levelsync.enrollment.catalog.client.CourseCatalogGateway;
import com.levelsync.enrollment.catalog.model.CourseEnrollment;
import com.levelsync.enrollment.catalog.model.EnrollmentAttribution;
import com.levelsync.enrollment.catalog.model.EnrollmentStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 멤버십 수강 등록/취소 (멱등)
 * 이미 원하는 상태면 Catalog를 호출하지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MembershipEnrollmentWriter {

    private final CourseCatalogGateway catalogGateway;

    /**
     * 활성 수강 등록이 없을 때만 등록하고 completed 처리 후 출처를 기록한다.
     *
     * @return 새로 등록했으면 true
     */
    public boolean grant(Long userId, Long courseId, EnrollmentAttribution attribution) {
        Optional<CourseEnrollment> existing = catalogGateway.findEnrollment(userId, courseId);
        if (existing.isPresent() && existing.get().isActive()) {
            log.debug("Already enrolled, skipping: userId={}, courseId={}", userId, courseId);
            return false;
        }

        Long enrollmentId = catalogGateway.enroll(userId, courseId);
        catalogGateway.changeEnrollmentStatus(enrollmentId, EnrollmentStatus.COMPLETED);
        catalogGateway.tagEnrollment(enrollmentId, attribution);

        log.info("Granted membership enrollment: userId={}, courseId={}, enrollmentId={}, levelId={}",
                userId, courseId, enrollmentId, attribution.levelId());
        return true;
    }

    /**
     * 활성 수강 등록이 있을 때만 취소한다.
     *
     * @param keepIndividual true면 개별 구매로 기록된 등록은 취소하지 않는다
     * @return 취소했으면 true
     */
    public boolean revoke(Long userId, Long courseId, boolean keepIndividual) {
        Optional<CourseEnrollment> existing = catalogGateway.findEnrollment(userId, courseId);
        if (existing.isEmpty() || !existing.get().isActive()) {
            log.debug("Not enrolled, skipping: userId={}, courseId={}", userId, courseId);
            return false;
        }
        if (keepIndividual && existing.get().isIndividual()) {
            log.info("Keeping individually purchased enrollment: userId={}, courseId={}", userId, courseId);
            return false;
        }

        catalogGateway.cancelEnrollment(userId, courseId);
        log.info("Revoked membership enrollment: userId={}, courseId={}", userId, courseId);
        return true;
    }
}
