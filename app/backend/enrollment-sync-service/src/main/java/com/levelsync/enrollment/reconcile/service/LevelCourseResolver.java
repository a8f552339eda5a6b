package com.levelsync.enrollment.reconcile.service;

import com.levelsync.enrollment.billing.service.MembershipBillingGateway;
import com.levelsync.enrollment.catalog.client.CourseCatalogGateway;
import com.levelsync.enrollment.catalog.model.CatalogCourse;
import com.levelsync.enrollment.reconcile.model.LevelIds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 레벨 → 과목 변환
 *
 * 두 연결 경로의 합집합을 사용한다.
 * 1. 레벨별 제한 페이지 테이블 (기본 경로)
 * 2. 레벨 속성 역방향 조회 (bound_course_id, bound_bundle_id)
 *
 * 모든 후보는 Catalog에서 다시 확인하고, 존재하지 않거나 게시되지 않은 항목은 버린다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LevelCourseResolver {

    private static final List<String> BOUND_KEYS = List.of(
            MembershipBillingGateway.BOUND_COURSE_ID,
            MembershipBillingGateway.BOUND_BUNDLE_ID
    );

    private final MembershipBillingGateway billingGateway;
    private final CourseCatalogGateway catalogGateway;

    /**
     * 레벨 집합이 접근을 부여하는 과목 조회
     *
     * @param levelIds 레벨 ID 집합 (비어 있으면 조회 없이 빈 결과)
     * @return 과목 ID → 과목 (중복 없음, 게시된 과목/번들만)
     */
    public Map<Long, CatalogCourse> resolve(Collection<Long> levelIds) {
        Set<Long> levels = LevelIds.normalize(levelIds);
        if (levels.isEmpty()) {
            return Collections.emptyMap();
        }

        Set<Long> candidates = new LinkedHashSet<>(billingGateway.findRestrictedPageIds(levels));
        for (String key : BOUND_KEYS) {
            candidates.addAll(parseCourseIds(key, billingGateway.findLevelAttributeValues(key, levels)));
        }

        Map<Long, CatalogCourse> courses = new LinkedHashMap<>();
        for (Long candidate : candidates) {
            catalogGateway.findCourse(candidate)
                    .filter(CatalogCourse::isPublishedCourseEntry)
                    .ifPresentOrElse(
                            course -> courses.put(candidate, course),
                            () -> log.debug("Discarding binding to missing or unpublished course: courseId={}", candidate)
                    );
        }

        log.debug("Resolved levels {} to courses {}", levels, courses.keySet());
        return courses;
    }

    private Set<Long> parseCourseIds(String key, List<String> values) {
        Set<Long> courseIds = new LinkedHashSet<>();
        for (String value : values) {
            if (value == null || value.isBlank()) {
                continue;
            }
            try {
                long courseId = Long.parseLong(value.trim());
                if (courseId > 0) {
                    courseIds.add(courseId);
                }
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-numeric level attribute: key={}, value={}", key, value);
            }
        }
        return courseIds;
    }
}
