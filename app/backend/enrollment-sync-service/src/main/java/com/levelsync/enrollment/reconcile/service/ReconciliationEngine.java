package com.levelsync.enrollment.reconcile.service;

import com.levelsync.enrollment.catalog.model.CatalogCourse;
import com.levelsync.enrollment.catalog.model.EnrollmentAttribution;
import com.levelsync.enrollment.common.capability.Capabilities;
import com.levelsync.enrollment.reconcile.model.ReconciliationInput;
import com.levelsync.enrollment.reconcile.model.ReconciliationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 멤버십 → 수강 등록 재조정
 *
 * 이전 레벨 집합과 새 레벨 집합이 부여하는 과목의 차집합을 구해
 * 취소를 먼저, 등록을 나중에 적용한다. 과목 하나의 실패는 나머지 과목 처리에 영향을 주지 않는다.
 * 같은 입력으로 다시 호출해도 추가 변경이 없다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReconciliationEngine {

    private final LevelCourseResolver resolver;
    private final CourseEligibilityFilter eligibilityFilter;
    private final MembershipEnrollmentWriter enrollmentWriter;
    private final BundleCascadeHandler bundleCascadeHandler;
    private final Capabilities capabilities;

    public ReconciliationResult reconcile(ReconciliationInput input) {
        if (!capabilities.courseCatalogAvailable()) {
            log.debug("Course catalog unavailable, skipping reconciliation: userId={}", input.userId());
            return ReconciliationResult.empty();
        }

        Long userId = input.userId();
        Map<Long, CatalogCourse> oldCourses = gatedCourses(input.oldLevelIds());
        Map<Long, CatalogCourse> newCourses = gatedCourses(input.newLevelIds());

        Set<Long> toUnenroll = new LinkedHashSet<>(oldCourses.keySet());
        toUnenroll.removeAll(newCourses.keySet());

        Map<Long, CatalogCourse> toEnroll = new LinkedHashMap<>(newCourses);
        toEnroll.keySet().removeAll(oldCourses.keySet());

        Set<Long> enrolled = new LinkedHashSet<>();
        Set<Long> unenrolled = new LinkedHashSet<>();
        Set<Long> failed = new LinkedHashSet<>();

        for (Long courseId : toUnenroll) {
            try {
                if (enrollmentWriter.revoke(userId, courseId, true)) {
                    unenrolled.add(courseId);
                }
            } catch (RuntimeException e) {
                log.error("Failed to unenroll: userId={}, courseId={}", userId, courseId, e);
                failed.add(courseId);
            }
        }

        EnrollmentAttribution attribution = attributionFor(input);
        for (CatalogCourse course : toEnroll.values()) {
            try {
                if (!enrollmentWriter.grant(userId, course.id(), attribution)) {
                    continue;
                }
                enrolled.add(course.id());
                if (course.isBundle()) {
                    ReconciliationResult cascaded = bundleCascadeHandler.cascade(userId, course, newCourses, attribution);
                    enrolled.addAll(cascaded.enrolledCourseIds());
                    failed.addAll(cascaded.failedCourseIds());
                }
            } catch (RuntimeException e) {
                log.error("Failed to enroll: userId={}, courseId={}", userId, course.id(), e);
                failed.add(course.id());
            }
        }

        ReconciliationResult result = new ReconciliationResult(enrolled, unenrolled, failed);
        log.info("Reconciled userId={} levels {} -> {}: enrolled={}, unenrolled={}, failed={}",
                userId, input.oldLevelIds(), input.newLevelIds(), enrolled, unenrolled, failed);
        return result;
    }

    private Map<Long, CatalogCourse> gatedCourses(Collection<Long> levelIds) {
        return eligibilityFilter.filter(resolver.resolve(levelIds));
    }

    private EnrollmentAttribution attributionFor(ReconciliationInput input) {
        Long levelId = input.grantingLevelId();
        return input.order()
                .map(order -> EnrollmentAttribution.membership(levelId, order.orderId(), order.orderCode()))
                .orElseGet(() -> EnrollmentAttribution.membership(levelId));
    }
}
