package com.levelsync.shared.dto.sqs;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Billing 시스템의 멤버십 변경 이벤트
 *
 * Queue: billing-to-enrollment-sync
 * Publisher: Membership Billing
 * Consumer: Enrollment-Sync-Service
 *
 * eventType 별 사용 필드:
 * - CHECKOUT_COMPLETED: userId, order
 * - MEMBERSHIP_LEVEL_CHANGED: userId, levelId (0 = 해지), cancelLevelId
 * - MEMBERSHIP_LEVELS_SWEPT: oldLevelsByUser
 * - ORDER_REFUNDED: order (userId, membershipId 필수)
 * - MEMBERSHIP_CANCELLED: userId, cancelLevelId
 */
@Data
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
@NoArgsConstructor
@AllArgsConstructor
public class MembershipEventMessage {

    public static final String CHECKOUT_COMPLETED = "CHECKOUT_COMPLETED";
    public static final String MEMBERSHIP_LEVEL_CHANGED = "MEMBERSHIP_LEVEL_CHANGED";
    public static final String MEMBERSHIP_LEVELS_SWEPT = "MEMBERSHIP_LEVELS_SWEPT";
    public static final String ORDER_REFUNDED = "ORDER_REFUNDED";
    public static final String MEMBERSHIP_CANCELLED = "MEMBERSHIP_CANCELLED";

    /**
     * 이벤트 타입
     */
    private String eventType;

    /**
     * 대상 사용자 ID
     */
    private Long userId;

    /**
     * 변경 후 레벨 ID (0이면 대체 레벨 없이 해지)
     */
    private Long levelId;

    /**
     * 해지되는 레벨 ID
     */
    private Long cancelLevelId;

    /**
     * 주문 정보 (결제 완료/환불 이벤트)
     */
    private OrderPayload order;

    /**
     * 일괄 변경 전 사용자별 보유 레벨 목록 (userId → levelIds)
     */
    private Map<Long, List<Long>> oldLevelsByUser;
}
