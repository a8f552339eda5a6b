package com.levelsync.enrollment.reconcile.model;

import com.levelsync.shared.dto.sqs.OrderPayload;

import java.util.Optional;

/**
 * 멤버십 주문 참조 (추적용)
 * 이벤트의 주문 정보는 어댑터 경계에서 한 번만 해석하고, 이후에는 Optional로만 전달한다.
 *
 * @param orderId   주문 ID (없을 수 있음)
 * @param orderCode 주문 코드 (없을 수 있음)
 * @param levelId   주문한 레벨 ID (0 이하는 null로 정규화)
 * @param userId    주문자 ID (없을 수 있음)
 */
public record OrderReference(Long orderId, String orderCode, Long levelId, Long userId) {

    public static Optional<OrderReference> from(OrderPayload payload) {
        if (payload == null) {
            return Optional.empty();
        }
        String code = payload.getCode() == null || payload.getCode().isBlank() ? null : payload.getCode();
        return Optional.of(new OrderReference(
                positiveOrNull(payload.getId()),
                code,
                positiveOrNull(payload.getMembershipId()),
                positiveOrNull(payload.getUserId())
        ));
    }

    public boolean hasLevel() {
        return levelId != null;
    }

    private static Long positiveOrNull(Long value) {
        return value != null && value > 0 ? value : null;
    }
}
