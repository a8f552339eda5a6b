package com.levelsync.enrollment.reconcile.service;

import com.levelsync.enrollment.billing.model.AccessModel;
import com.levelsync.enrollment.billing.model.LevelDetails;
import com.levelsync.enrollment.billing.service.MembershipBillingGateway;
import com.levelsync.enrollment.catalog.client.CourseCatalogGateway;
import com.levelsync.enrollment.catalog.model.CatalogCourse;
import com.levelsync.enrollment.catalog.model.CourseEnrollment;
import com.levelsync.enrollment.common.capability.Capabilities;
import com.levelsync.enrollment.reconcile.model.LevelIds;
import com.levelsync.enrollment.reconcile.model.ReconciliationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 멤버십 해지 시 접근 모델 기준 수강 취소
 *
 * 관리자 해지는 다른 보유 레벨과 무관하게 취소한다 (차집합 경로를 거치지 않음).
 * 레벨 변경으로 인한 해지는 남은 레벨이 계속 부여하는 과목을 취소 대상에서 제외한다.
 * - full_website: 사용자의 모든 활성 수강 등록
 * - category_wise: 해지된 레벨의 카테고리에 속한 과목의 활성 수강 등록
 * - 과목 지정 레벨은 재조정 경로에서 처리하므로 여기서는 아무 것도 하지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccessModelRevoker {

    private final MembershipBillingGateway billingGateway;
    private final CourseCatalogGateway catalogGateway;
    private final CourseEligibilityFilter eligibilityFilter;
    private final LevelCourseResolver resolver;
    private final Capabilities capabilities;

    public ReconciliationResult revoke(Long userId, Long cancelledLevelId) {
        return revoke(userId, cancelledLevelId, Collections.emptySet());
    }

    /**
     * @param retainedLevelIds 해지 후에도 유지되는 레벨 (이 레벨들이 부여하는 과목은 취소하지 않는다)
     */
    public ReconciliationResult revoke(Long userId, Long cancelledLevelId, Collection<Long> retainedLevelIds) {
        if (!capabilities.courseCatalogAvailable()) {
            log.debug("Course catalog unavailable, skipping access-model revoke: userId={}", userId);
            return ReconciliationResult.empty();
        }
        if (userId == null || !LevelIds.isValid(cancelledLevelId)) {
            return ReconciliationResult.empty();
        }

        Optional<LevelDetails> level = billingGateway.findLevel(cancelledLevelId);
        if (level.isEmpty() || level.get().accessModel() == AccessModel.COURSE_SPECIFIC) {
            return ReconciliationResult.empty();
        }

        LevelDetails details = level.get();
        Set<Long> retainedCourseIds = eligibilityFilter.filter(resolver.resolve(retainedLevelIds)).keySet();
        List<CourseEnrollment> enrollments = catalogGateway.findActiveEnrollments(userId);
        Set<Long> unenrolled = new LinkedHashSet<>();
        Set<Long> failed = new LinkedHashSet<>();

        for (CourseEnrollment enrollment : enrollments) {
            Long courseId = enrollment.courseId();
            if (retainedCourseIds.contains(courseId)) {
                continue;
            }
            try {
                Optional<CatalogCourse> course = catalogGateway.findCourse(courseId);
                if (!isCovered(details, course)) {
                    continue;
                }
                catalogGateway.cancelEnrollment(userId, courseId);
                unenrolled.add(courseId);
            } catch (RuntimeException e) {
                log.error("Failed to revoke enrollment: userId={}, courseId={}, levelId={}",
                        userId, courseId, cancelledLevelId, e);
                failed.add(courseId);
            }
        }

        log.info("Revoked {} access of level {} for userId={}: unenrolled={}, failed={}",
                details.accessModel(), cancelledLevelId, userId, unenrolled, failed);
        return new ReconciliationResult(Collections.emptySet(), unenrolled, failed);
    }

    private boolean isCovered(LevelDetails level, Optional<CatalogCourse> course) {
        if (course.isPresent() && !eligibilityFilter.isMembershipGated(course.get())) {
            return false;
        }
        if (level.accessModel() == AccessModel.FULL_WEBSITE) {
            return true;
        }
        return course.filter(CatalogCourse::published)
                .map(c -> !Collections.disjoint(c.categoryIds(), level.categoryIds()))
                .orElse(false);
    }
}
