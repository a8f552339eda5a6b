package com.levelsync.enrollment.reconcile.service;

import com.levelsync.enrollment.catalog.model.CatalogCourse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.levelsync.enrollment.support.FakeCourseCatalog.freeCourse;
import static com.levelsync.enrollment.support.FakeCourseCatalog.paidCourse;
import static com.levelsync.enrollment.support.FakeCourseCatalog.publicCourse;
import static org.assertj.core.api.Assertions.assertThat;

class CourseEligibilityFilterTest {

    private final CourseEligibilityFilter filter = new CourseEligibilityFilter();

    @Test
    @DisplayName("유료 비공개 과목만 멤버십 동기화 대상")
    void onlyPaidPrivateCoursesAreGated() {
        assertThat(filter.isMembershipGated(paidCourse(1L))).isTrue();
        assertThat(filter.isMembershipGated(freeCourse(2L))).isFalse();
        assertThat(filter.isMembershipGated(publicCourse(3L))).isFalse();
    }

    @Test
    @DisplayName("filter는 대상 과목만 순서대로 남긴다")
    void filterKeepsGatedCoursesInOrder() {
        Map<Long, CatalogCourse> courses = new LinkedHashMap<>();
        courses.put(3L, publicCourse(3L));
        courses.put(1L, paidCourse(1L));
        courses.put(2L, freeCourse(2L));
        courses.put(4L, paidCourse(4L));

        assertThat(filter.filter(courses).keySet()).containsExactly(1L, 4L);
    }
}
