package com.levelsync.enrollment.reconcile.service;

import com.levelsync.enrollment.billing.model.AccessModel;
import com.levelsync.enrollment.catalog.model.EnrollmentAttribution;
import com.levelsync.enrollment.catalog.model.EnrollmentStatus;
import com.levelsync.enrollment.reconcile.model.ReconciliationResult;
import com.levelsync.enrollment.support.FakeCourseCatalog;
import com.levelsync.enrollment.support.ReconciliationFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.levelsync.enrollment.support.FakeCourseCatalog.freeCourse;
import static com.levelsync.enrollment.support.FakeCourseCatalog.paidCourse;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AccessModelRevoker 테스트")
class AccessModelRevokerTest {

    private static final Long USER_ID = 6L;

    private ReconciliationFixture fixture;
    private FakeCourseCatalog catalog;
    private AccessModelRevoker revoker;

    @BeforeEach
    void setUp() {
        fixture = new ReconciliationFixture();
        catalog = fixture.catalog;
        revoker = fixture.accessModelRevoker;

        catalog.withCourses(paidCourse(10L, 100L), paidCourse(11L, 200L), paidCourse(12L, 100L, 300L), freeCourse(30L));
        catalog.givenEnrollment(USER_ID, 10L, EnrollmentStatus.COMPLETED, EnrollmentAttribution.membership(2L));
        catalog.givenEnrollment(USER_ID, 11L, EnrollmentStatus.ACTIVE, EnrollmentAttribution.individual());
        catalog.givenEnrollment(USER_ID, 12L, EnrollmentStatus.COMPLETED, null);
        catalog.givenEnrollment(USER_ID, 30L, EnrollmentStatus.ACTIVE, null);
    }

    @Test
    @DisplayName("full_website 레벨 해지 시 모든 활성 수강을 취소한다 (출처 무관)")
    void fullWebsiteCancelsEverything() {
        fixture.billing.level(2L, AccessModel.FULL_WEBSITE);

        ReconciliationResult result = revoker.revoke(USER_ID, 2L);

        assertThat(result.unenrolledCourseIds()).containsExactlyInAnyOrder(10L, 11L, 12L);
        assertThat(catalog.isActivelyEnrolled(USER_ID, 11L)).isFalse();
        assertThat(catalog.isActivelyEnrolled(USER_ID, 30L)).isTrue();
    }

    @Test
    @DisplayName("category_wise 레벨 해지 시 레벨 카테고리에 속한 과목만 취소한다")
    void categoryWiseCancelsIntersection() {
        fixture.billing.level(3L, AccessModel.CATEGORY_WISE, 100L);

        ReconciliationResult result = revoker.revoke(USER_ID, 3L);

        assertThat(result.unenrolledCourseIds()).containsExactlyInAnyOrder(10L, 12L);
        assertThat(catalog.isActivelyEnrolled(USER_ID, 11L)).isTrue();
    }

    @Test
    @DisplayName("과목 지정 레벨이나 알 수 없는 레벨은 아무 것도 하지 않는다")
    void courseSpecificOrUnknownLevelIsNoOp() {
        fixture.billing.level(4L, AccessModel.COURSE_SPECIFIC);

        assertThat(revoker.revoke(USER_ID, 4L).isEmpty()).isTrue();
        assertThat(revoker.revoke(USER_ID, 999L).isEmpty()).isTrue();
        assertThat(revoker.revoke(USER_ID, 0L).isEmpty()).isTrue();
        assertThat(catalog.mutations()).isEmpty();
    }

    @Test
    @DisplayName("한 과목의 취소 실패는 나머지 과목 취소를 막지 않는다")
    void failureIsIsolated() {
        fixture.billing.level(2L, AccessModel.FULL_WEBSITE);
        catalog.failOn(10L);

        ReconciliationResult result = revoker.revoke(USER_ID, 2L);

        assertThat(result.failedCourseIds()).containsExactly(10L);
        assertThat(result.unenrolledCourseIds()).containsExactlyInAnyOrder(11L, 12L);
    }

    @Test
    @DisplayName("유지되는 레벨이 계속 부여하는 과목은 취소하지 않는다")
    void retainedLevelsKeepTheirCourses() {
        fixture.billing.level(2L, AccessModel.FULL_WEBSITE).restricts(7L, 11L, 12L);

        ReconciliationResult result = revoker.revoke(USER_ID, 2L, List.of(7L));

        assertThat(result.unenrolledCourseIds()).containsExactly(10L);
        assertThat(catalog.isActivelyEnrolled(USER_ID, 11L)).isTrue();
        assertThat(catalog.isActivelyEnrolled(USER_ID, 12L)).isTrue();
    }
}
