package com.levelsync.enrollment.reconcile.service;

import com.levelsync.enrollment.billing.service.MembershipBillingGateway;
import com.levelsync.enrollment.catalog.client.CourseCatalogGateway;
import com.levelsync.enrollment.catalog.model.AttributionSource;
import com.levelsync.enrollment.catalog.model.CatalogCourse;
import com.levelsync.enrollment.catalog.model.CourseEnrollment;
import com.levelsync.enrollment.catalog.model.EnrollmentAttribution;
import com.levelsync.enrollment.common.capability.Capabilities;
import com.levelsync.enrollment.common.config.MembershipSyncProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * 수강 등록 완료 시 출처(membership / individual) 기록
 *
 * 멤버십 전용 모드이거나 사용자가 활성 레벨을 하나라도 보유하면 membership, 아니면 individual.
 * 이미 출처가 기록된 등록은 덮어쓰지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AttributionTagger {

    private final MembershipBillingGateway billingGateway;
    private final CourseCatalogGateway catalogGateway;
    private final BundleCascadeHandler bundleCascadeHandler;
    private final MembershipSyncProperties properties;
    private final Capabilities capabilities;

    public void onEnrollmentCompleted(Long userId, Long courseId) {
        if (!capabilities.courseCatalogAvailable()) {
            return;
        }
        if (userId == null || courseId == null) {
            log.warn("Ignoring enrollment notification without user or course: userId={}, courseId={}",
                    userId, courseId);
            return;
        }

        try {
            tag(userId, courseId);
        } catch (RuntimeException e) {
            log.error("Failed to tag enrollment: userId={}, courseId={}", userId, courseId, e);
        }
    }

    private void tag(Long userId, Long courseId) {
        Optional<CourseEnrollment> found = catalogGateway.findEnrollment(userId, courseId);
        if (found.isEmpty()) {
            log.warn("Enrollment not found for notification: userId={}, courseId={}", userId, courseId);
            return;
        }

        CourseEnrollment enrollment = found.get();
        if (enrollment.isAttributed()) {
            log.debug("Enrollment already attributed: enrollmentId={}, source={}",
                    enrollment.enrollmentId(), enrollment.attribution().source());
            return;
        }

        List<Long> heldLevelIds = billingGateway.findHeldLevelIds(userId);
        EnrollmentAttribution attribution = decide(heldLevelIds);
        catalogGateway.tagEnrollment(enrollment.enrollmentId(), attribution);
        log.info("Tagged enrollment: enrollmentId={}, userId={}, courseId={}, source={}",
                enrollment.enrollmentId(), userId, courseId, attribution.source());

        if (attribution.source() == AttributionSource.MEMBERSHIP && capabilities.bundleAddonAvailable()) {
            Optional<CatalogCourse> course = catalogGateway.findCourse(courseId);
            if (course.isPresent() && course.get().isBundle()) {
                bundleCascadeHandler.cascade(userId, course.get(), heldLevelIds, attribution);
            }
        }
    }

    private EnrollmentAttribution decide(List<Long> heldLevelIds) {
        if (properties.isMembershipOnlyMode() || !heldLevelIds.isEmpty()) {
            return EnrollmentAttribution.membership(heldLevelIds.isEmpty() ? null : heldLevelIds.get(0));
        }
        return EnrollmentAttribution.individual();
    }
}
