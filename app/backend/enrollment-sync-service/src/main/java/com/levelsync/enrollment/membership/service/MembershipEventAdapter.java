package com.levelsync.enrollment.membership.service;

import com.levelsync.enrollment.billing.service.MembershipBillingGateway;
import com.levelsync.enrollment.common.capability.Capabilities;
import com.levelsync.enrollment.reconcile.model.LevelIds;
import com.levelsync.enrollment.reconcile.model.OrderReference;
import com.levelsync.enrollment.reconcile.model.ReconciliationInput;
import com.levelsync.enrollment.reconcile.model.ReconciliationResult;
import com.levelsync.enrollment.reconcile.service.AccessModelRevoker;
import com.levelsync.enrollment.reconcile.service.ReconciliationEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Billing 이벤트 → 재조정 입력 변환
 *
 * 모든 진입점은 Catalog 가용 여부를 먼저 확인하고, 예외를 호출자에게 전파하지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MembershipEventAdapter {

    private final MembershipBillingGateway billingGateway;
    private final ReconciliationEngine reconciliationEngine;
    private final AccessModelRevoker accessModelRevoker;
    private final Capabilities capabilities;

    /**
     * 결제 완료: 현재 보유 레벨 ∪ 구매 레벨의 과목을 등록한다 (취소 없음).
     */
    public ReconciliationResult onCheckoutCompleted(Long userId, Optional<OrderReference> order) {
        if (!capabilities.courseCatalogAvailable()) {
            return ReconciliationResult.empty();
        }
        Long buyerId = userId != null ? userId : order.map(OrderReference::userId).orElse(null);
        if (buyerId == null) {
            log.warn("Ignoring checkout without user: order={}", order);
            return ReconciliationResult.empty();
        }

        try {
            Set<Long> newLevelIds = new LinkedHashSet<>(billingGateway.findHeldLevelIds(buyerId));
            order.map(OrderReference::levelId).ifPresent(newLevelIds::add);
            return reconciliationEngine.reconcile(new ReconciliationInput(buyerId, Set.of(), newLevelIds, order));
        } catch (RuntimeException e) {
            log.error("Checkout reconciliation failed: userId={}, order={}", buyerId, order, e);
            return ReconciliationResult.empty();
        }
    }

    /**
     * 단일 레벨 변경
     *
     * 해지된 레벨이 있으면 접근 모델 기준 취소를 먼저 적용한 뒤 차집합 재조정을 한다.
     * 취소 단계는 보유 레벨 ∪ 새 레벨이 계속 부여하는 과목을 건드리지 않는다.
     *
     * @param levelId       새 레벨 (0 = 해지, 대체 레벨 없음)
     * @param cancelLevelId 해지된 레벨 (없으면 0 또는 null)
     */
    public ReconciliationResult onLevelChanged(Long userId, Long levelId, Long cancelLevelId) {
        if (!capabilities.courseCatalogAvailable()) {
            return ReconciliationResult.empty();
        }
        if (userId == null || (!LevelIds.isValid(levelId) && !LevelIds.isValid(cancelLevelId))) {
            return ReconciliationResult.empty();
        }

        try {
            Set<Long> newLevelIds = new LinkedHashSet<>(billingGateway.findHeldLevelIds(userId));
            newLevelIds.addAll(LevelIds.of(levelId));
            ReconciliationResult revoked = LevelIds.isValid(cancelLevelId)
                    ? accessModelRevoker.revoke(userId, cancelLevelId, newLevelIds)
                    : ReconciliationResult.empty();
            return revoked.merge(reconciliationEngine.reconcile(
                    ReconciliationInput.of(userId, LevelIds.of(cancelLevelId), newLevelIds)));
        } catch (RuntimeException e) {
            log.error("Level change reconciliation failed: userId={}, levelId={}, cancelLevelId={}",
                    userId, levelId, cancelLevelId, e);
            return ReconciliationResult.empty();
        }
    }

    /**
     * 일괄 레벨 변경: 사용자별로 독립 처리한다. 한 사용자의 실패는 나머지 사용자에 영향을 주지 않는다.
     *
     * @param oldLevelsByUser 사용자 ID → 변경 전 보유 레벨
     * @return 처리에 성공한 사용자별 결과
     */
    public Map<Long, ReconciliationResult> onLevelsSwept(Map<Long, List<Long>> oldLevelsByUser) {
        Map<Long, ReconciliationResult> results = new LinkedHashMap<>();
        if (!capabilities.courseCatalogAvailable() || oldLevelsByUser == null) {
            return results;
        }

        oldLevelsByUser.forEach((userId, oldLevelIds) -> {
            if (userId == null) {
                return;
            }
            try {
                results.put(userId, reconcileWithHeldLevels(userId, oldLevelIds));
            } catch (RuntimeException e) {
                log.error("Sweep reconciliation failed for userId={}, continuing with next user", userId, e);
            }
        });

        log.info("Processed level sweep: users={}, reconciled={}", oldLevelsByUser.size(), results.size());
        return results;
    }

    /**
     * 환불: 환불된 레벨을 제외한 나머지 보유 레벨로도 접근 가능한지 기준으로 취소한다.
     */
    public ReconciliationResult onOrderRefunded(Optional<OrderReference> order) {
        if (!capabilities.courseCatalogAvailable()) {
            return ReconciliationResult.empty();
        }
        if (order.isEmpty() || order.get().userId() == null || !order.get().hasLevel()) {
            log.warn("Ignoring refund without user or level: order={}", order);
            return ReconciliationResult.empty();
        }

        Long userId = order.get().userId();
        Long refundedLevelId = order.get().levelId();
        try {
            Set<Long> remainingLevelIds = new LinkedHashSet<>(billingGateway.findHeldLevelIds(userId));
            remainingLevelIds.remove(refundedLevelId);
            return reconciliationEngine.reconcile(
                    ReconciliationInput.of(userId, Set.of(refundedLevelId), remainingLevelIds));
        } catch (RuntimeException e) {
            log.error("Refund reconciliation failed: userId={}, levelId={}", userId, refundedLevelId, e);
            return ReconciliationResult.empty();
        }
    }

    /**
     * 관리자 해지: 해지된 레벨의 접근 모델 기준으로 바로 취소한다.
     */
    public ReconciliationResult onMembershipCancelled(Long userId, Long cancelledLevelId) {
        if (!capabilities.courseCatalogAvailable()) {
            return ReconciliationResult.empty();
        }

        try {
            return accessModelRevoker.revoke(userId, cancelledLevelId);
        } catch (RuntimeException e) {
            log.error("Access-model revoke failed: userId={}, levelId={}", userId, cancelledLevelId, e);
            return ReconciliationResult.empty();
        }
    }

    /**
     * 변경 전 레벨 → 현재 보유 레벨로 다시 재조정 (운영 복구용)
     */
    public ReconciliationResult onReconcileRequested(Long userId, Collection<Long> previousLevelIds) {
        if (!capabilities.courseCatalogAvailable() || userId == null) {
            return ReconciliationResult.empty();
        }

        try {
            return reconcileWithHeldLevels(userId, previousLevelIds);
        } catch (RuntimeException e) {
            log.error("Manual reconciliation failed: userId={}", userId, e);
            return ReconciliationResult.empty();
        }
    }

    private ReconciliationResult reconcileWithHeldLevels(Long userId, Collection<Long> oldLevelIds) {
        List<Long> heldLevelIds = billingGateway.findHeldLevelIds(userId);
        return reconciliationEngine.reconcile(ReconciliationInput.of(userId, oldLevelIds, heldLevelIds));
    }
}
