package com.levelsync.enrollment.membership.listener;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.levelsync.enrollment.membership.service.MembershipEventAdapter;
import com.levelsync.enrollment.reconcile.model.OrderReference;
import com.levelsync.shared.dto.sqs.MembershipEventMessage;
import io.awspring.cloud.sqs.annotation.SqsListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Membership Billing 이벤트 리스너
 * billing-to-enrollment-sync 큐의 메시지를 eventType별 어댑터 진입점으로 전달한다.
 *
 * 파싱할 수 없는 메시지는 재전송해도 처리할 수 없으므로 로그만 남기고 소비한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MembershipEventListener {

    private final MembershipEventAdapter membershipEventAdapter;
    private final ObjectMapper objectMapper;

    @SqsListener(value = "${sqs.billing-events-queue}")
    public void receiveMembershipEvent(String messageBody) {
        MembershipEventMessage message;
        try {
            message = objectMapper.readValue(messageBody, MembershipEventMessage.class);
        } catch (JsonProcessingException e) {
            log.error("Failed to parse membership event: {}", messageBody, e);
            return;
        }
        if (message == null) {
            log.warn("Ignoring empty membership event: {}", messageBody);
            return;
        }

        String eventType = message.getEventType();
        log.info("Received membership event: eventType={}, userId={}", eventType, message.getUserId());

        if (eventType == null) {
            log.warn("Membership event without eventType: {}", messageBody);
            return;
        }

        switch (eventType) {
            case MembershipEventMessage.CHECKOUT_COMPLETED -> membershipEventAdapter.onCheckoutCompleted(
                    message.getUserId(), OrderReference.from(message.getOrder()));
            case MembershipEventMessage.MEMBERSHIP_LEVEL_CHANGED -> membershipEventAdapter.onLevelChanged(
                    message.getUserId(), message.getLevelId(), message.getCancelLevelId());
            case MembershipEventMessage.MEMBERSHIP_LEVELS_SWEPT -> membershipEventAdapter.onLevelsSwept(
                    message.getOldLevelsByUser());
            case MembershipEventMessage.ORDER_REFUNDED -> membershipEventAdapter.onOrderRefunded(
                    OrderReference.from(message.getOrder()));
            case MembershipEventMessage.MEMBERSHIP_CANCELLED -> membershipEventAdapter.onMembershipCancelled(
                    message.getUserId(), message.getCancelLevelId());
            default -> log.warn("Unknown membership eventType: {}", eventType);
        }
    }
}
