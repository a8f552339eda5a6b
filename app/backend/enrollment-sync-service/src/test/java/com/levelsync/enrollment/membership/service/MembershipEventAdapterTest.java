package com.levelsync.enrollment.membership.service;

import com.levelsync.enrollment.billing.model.AccessModel;
import com.levelsync.enrollment.catalog.model.EnrollmentAttribution;
import com.levelsync.enrollment.catalog.model.EnrollmentStatus;
import com.levelsync.enrollment.reconcile.model.OrderReference;
import com.levelsync.enrollment.reconcile.model.ReconciliationResult;
import com.levelsync.enrollment.support.FakeCourseCatalog;
import com.levelsync.enrollment.support.ReconciliationFixture;
import com.levelsync.shared.dto.sqs.OrderPayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.levelsync.enrollment.support.FakeCourseCatalog.paidCourse;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MembershipEventAdapter 테스트")
class MembershipEventAdapterTest {

    private ReconciliationFixture fixture;
    private FakeCourseCatalog catalog;
    private MembershipEventAdapter adapter;

    @BeforeEach
    void setUp() {
        fixture = new ReconciliationFixture();
        catalog = fixture.catalog;
        adapter = fixture.adapter;

        catalog.withCourses(paidCourse(10L), paidCourse(11L), paidCourse(12L));
        fixture.billing
                .restricts(5L, 10L)
                .restricts(7L, 12L)
                .restricts(9L, 10L, 11L);
    }

    @Nested
    @DisplayName("결제 완료")
    class CheckoutCompleted {

        @Test
        @DisplayName("보유 레벨과 구매 레벨의 과목을 주문 정보와 함께 등록한다")
        void enrollsHeldAndPurchasedLevels() {
            fixture.billing.holds(1L, 7L);
            OrderPayload payload = OrderPayload.builder().id(55L).code("ORD55").userId(1L).membershipId(5L).build();

            ReconciliationResult result = adapter.onCheckoutCompleted(null, OrderReference.from(payload));

            assertThat(result.enrolledCourseIds()).containsExactlyInAnyOrder(10L, 12L);
            EnrollmentAttribution attribution = catalog.attributionOf(1L, 10L).orElseThrow();
            assertThat(attribution.orderId()).isEqualTo(55L);
            assertThat(attribution.orderCode()).isEqualTo("ORD55");
            assertThat(attribution.levelId()).isEqualTo(5L);
        }

        @Test
        @DisplayName("결제는 기존 수강을 취소하지 않는다")
        void neverUnenrolls() {
            catalog.givenEnrollment(1L, 11L, EnrollmentStatus.COMPLETED, EnrollmentAttribution.membership(9L));

            ReconciliationResult result = adapter.onCheckoutCompleted(1L,
                    Optional.of(new OrderReference(56L, "ORD56", 7L, 1L)));

            assertThat(result.unenrolledCourseIds()).isEmpty();
            assertThat(catalog.isActivelyEnrolled(1L, 11L)).isTrue();
        }

        @Test
        @DisplayName("사용자를 알 수 없으면 무시한다")
        void ignoresCheckoutWithoutUser() {
            assertThat(adapter.onCheckoutCompleted(null, Optional.empty()).isEmpty()).isTrue();
            assertThat(catalog.mutations()).isEmpty();
        }
    }

    @Nested
    @DisplayName("환불")
    class OrderRefunded {

        @Test
        @DisplayName("다른 보유 레벨이 같은 과목을 부여하면 수강을 유지한다")
        void keepsCourseGrantedByAnotherLevel() {
            fixture.billing.holds(2L, 5L, 9L);
            catalog.givenEnrollment(2L, 10L, EnrollmentStatus.COMPLETED, EnrollmentAttribution.membership(5L));
            OrderPayload refund = OrderPayload.builder().id(60L).userId(2L).membershipId(5L).build();

            ReconciliationResult result = adapter.onOrderRefunded(OrderReference.from(refund));

            assertThat(result.unenrolledCourseIds()).isEmpty();
            assertThat(catalog.isActivelyEnrolled(2L, 10L)).isTrue();
        }

        @Test
        @DisplayName("환불된 레벨만 부여하던 과목은 취소한다")
        void revokesCourseOnlyGrantedByRefundedLevel() {
            fixture.billing.holds(2L, 5L);
            catalog.givenEnrollment(2L, 10L, EnrollmentStatus.COMPLETED, EnrollmentAttribution.membership(5L));
            OrderPayload refund = OrderPayload.builder().id(60L).userId(2L).membershipId(5L).build();

            ReconciliationResult result = adapter.onOrderRefunded(OrderReference.from(refund));

            assertThat(result.unenrolledCourseIds()).containsExactly(10L);
        }

        @Test
        @DisplayName("사용자나 레벨이 없는 주문은 무시한다")
        void ignoresIncompleteOrder() {
            OrderPayload noLevel = OrderPayload.builder().id(61L).userId(2L).membershipId(0L).build();

            assertThat(adapter.onOrderRefunded(OrderReference.from(noLevel)).isEmpty()).isTrue();
            assertThat(adapter.onOrderRefunded(OrderReference.from(null)).isEmpty()).isTrue();
            assertThat(fixture.billing.queryCount()).isZero();
        }
    }

    @Nested
    @DisplayName("일괄 레벨 변경")
    class LevelsSwept {

        @Test
        @DisplayName("한 사용자의 과목 처리 실패가 다른 사용자의 재조정을 막지 않는다")
        void courseFailureOfOneUserDoesNotStopOthers() {
            for (long userId = 1; userId <= 3; userId++) {
                fixture.billing.holds(userId, 7L);
                catalog.givenEnrollment(userId, 10L, EnrollmentStatus.COMPLETED, EnrollmentAttribution.membership(5L));
            }
            catalog.failOn(2L, 12L);

            Map<Long, List<Long>> oldLevels = new LinkedHashMap<>();
            oldLevels.put(1L, List.of(5L));
            oldLevels.put(2L, List.of(5L));
            oldLevels.put(3L, List.of(5L));

            Map<Long, ReconciliationResult> results = adapter.onLevelsSwept(oldLevels);

            assertThat(results.get(2L).failedCourseIds()).containsExactly(12L);
            for (Long userId : List.of(1L, 3L)) {
                assertThat(results.get(userId).enrolledCourseIds()).containsExactly(12L);
                assertThat(results.get(userId).unenrolledCourseIds()).containsExactly(10L);
                assertThat(catalog.isActivelyEnrolled(userId, 12L)).isTrue();
                assertThat(catalog.isActivelyEnrolled(userId, 10L)).isFalse();
            }
        }

        @Test
        @DisplayName("한 사용자의 조회 실패는 해당 사용자만 건너뛴다")
        void billingFailureSkipsOnlyThatUser() {
            fixture.billing.holds(1L, 7L).holds(3L, 7L);
            fixture.billing.failFor(2L);

            Map<Long, List<Long>> oldLevels = new LinkedHashMap<>();
            oldLevels.put(1L, List.of(5L));
            oldLevels.put(2L, List.of(5L));
            oldLevels.put(3L, List.of(5L));

            Map<Long, ReconciliationResult> results = adapter.onLevelsSwept(oldLevels);

            assertThat(results).containsOnlyKeys(1L, 3L);
            assertThat(catalog.isActivelyEnrolled(1L, 12L)).isTrue();
            assertThat(catalog.isActivelyEnrolled(3L, 12L)).isTrue();
        }
    }

    @Nested
    @DisplayName("단일 레벨 변경")
    class LevelChanged {

        @Test
        @DisplayName("해지 레벨의 과목을 취소하고 새 레벨의 과목을 등록한다")
        void movesFromCancelledToNewLevel() {
            fixture.billing.holds(4L, 7L);
            catalog.givenEnrollment(4L, 10L, EnrollmentStatus.COMPLETED, EnrollmentAttribution.membership(5L));

            ReconciliationResult result = adapter.onLevelChanged(4L, 7L, 5L);

            assertThat(result.unenrolledCourseIds()).containsExactly(10L);
            assertThat(result.enrolledCourseIds()).containsExactly(12L);
        }

        @Test
        @DisplayName("새 레벨 0은 대체 없는 해지로 처리한다")
        void zeroLevelMeansCancellation() {
            catalog.givenEnrollment(4L, 10L, EnrollmentStatus.COMPLETED, EnrollmentAttribution.membership(5L));

            ReconciliationResult result = adapter.onLevelChanged(4L, 0L, 5L);

            assertThat(result.unenrolledCourseIds()).containsExactly(10L);
            assertThat(result.enrolledCourseIds()).isEmpty();
        }

        @Test
        @DisplayName("레벨 정보가 없으면 아무 것도 하지 않는다")
        void noLevelsIsNoOp() {
            assertThat(adapter.onLevelChanged(4L, 0L, null).isEmpty()).isTrue();
            assertThat(fixture.billing.queryCount()).isZero();
        }
    }

    @Test
    @DisplayName("관리자 해지는 접근 모델 기준으로 취소한다")
    void membershipCancellationUsesAccessModel() {
        fixture.billing.level(2L, AccessModel.FULL_WEBSITE).holds(5L, 9L);
        catalog.givenEnrollment(5L, 10L, EnrollmentStatus.COMPLETED, EnrollmentAttribution.membership(2L));

        ReconciliationResult result = adapter.onMembershipCancelled(5L, 2L);

        assertThat(result.unenrolledCourseIds()).containsExactly(10L);
    }

    @Test
    @DisplayName("운영 재조정은 현재 보유 레벨 기준으로 누락된 과목을 등록한다")
    void manualReconcileUsesHeldLevels() {
        fixture.billing.holds(8L, 9L);

        ReconciliationResult result = adapter.onReconcileRequested(8L, List.of());

        assertThat(result.enrolledCourseIds()).containsExactly(10L, 11L);
    }

    @Test
    @DisplayName("Catalog를 사용할 수 없으면 모든 진입점이 아무 것도 하지 않는다")
    void everyEntryPointIsNoOpWithoutCatalog() {
        fixture.capabilities.disableCatalog();
        fixture.billing.holds(1L, 5L);

        adapter.onCheckoutCompleted(1L, Optional.of(new OrderReference(1L, "X", 5L, 1L)));
        adapter.onLevelChanged(1L, 5L, 7L);
        adapter.onLevelsSwept(Map.of(1L, List.of(7L)));
        adapter.onOrderRefunded(Optional.of(new OrderReference(1L, "X", 5L, 1L)));
        adapter.onMembershipCancelled(1L, 5L);

        assertThat(fixture.billing.queryCount()).isZero();
        assertThat(catalog.mutations()).isEmpty();
    }
}
