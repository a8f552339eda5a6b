package com.levelsync.enrollment.reconcile.service;

import com.levelsync.enrollment.catalog.client.CourseCatalogGateway;
import com.levelsync.enrollment.catalog.model.CatalogCourse;
import com.levelsync.enrollment.catalog.model.EnrollmentAttribution;
import com.levelsync.enrollment.common.capability.Capabilities;
import com.levelsync.enrollment.reconcile.model.ReconciliationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 번들 수강 등록 시 하위 과목으로 등록 확장
 *
 * 보유 레벨이 하위 과목 자체에도 접근을 부여하는 경우에만 등록한다.
 * 한 단계만 확장하며, 번들 안의 번들은 풀지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BundleCascadeHandler {

    private final CourseCatalogGateway catalogGateway;
    private final LevelCourseResolver resolver;
    private final CourseEligibilityFilter eligibilityFilter;
    private final MembershipEnrollmentWriter enrollmentWriter;
    private final Capabilities capabilities;

    /**
     * 레벨 집합 기준으로 번들 하위 과목 등록
     */
    public ReconciliationResult cascade(Long userId, CatalogCourse bundle, Collection<Long> levelIds,
                                        EnrollmentAttribution attribution) {
        if (!bundle.isBundle() || !capabilities.bundleAddonAvailable()) {
            return ReconciliationResult.empty();
        }
        return cascade(userId, bundle, eligibilityFilter.filter(resolver.resolve(levelIds)), attribution);
    }

    /**
     * 이미 계산된 접근 가능 과목 기준으로 번들 하위 과목 등록
     *
     * @param grantableCourses 보유 레벨이 부여하는 동기화 대상 과목
     */
    public ReconciliationResult cascade(Long userId, CatalogCourse bundle, Map<Long, CatalogCourse> grantableCourses,
                                        EnrollmentAttribution attribution) {
        if (!bundle.isBundle() || !capabilities.bundleAddonAvailable()) {
            return ReconciliationResult.empty();
        }

        List<Long> memberIds = catalogGateway.findBundleCourseIds(bundle.id());
        Set<Long> enrolled = new LinkedHashSet<>();
        Set<Long> failed = new LinkedHashSet<>();

        for (Long memberId : memberIds) {
            if (memberId == null || memberId.equals(bundle.id())) {
                continue;
            }
            if (!grantableCourses.containsKey(memberId)) {
                log.debug("Bundle member not granted by held levels: bundleId={}, courseId={}", bundle.id(), memberId);
                continue;
            }
            try {
                if (enrollmentWriter.grant(userId, memberId, attribution)) {
                    enrolled.add(memberId);
                }
            } catch (RuntimeException e) {
                log.error("Failed to enroll bundle member: userId={}, bundleId={}, courseId={}",
                        userId, bundle.id(), memberId, e);
                failed.add(memberId);
            }
        }

        if (!enrolled.isEmpty()) {
            log.info("Cascaded bundle enrollment: userId={}, bundleId={}, members={}", userId, bundle.id(), enrolled);
        }
        return new ReconciliationResult(enrolled, Set.of(), failed);
    }
}
