package com.levelsync.enrollment.reconcile.model;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/**
 * 한 사용자에 대한 재조정 입력 (이벤트마다 새로 만들고 저장하지 않는다)
 */
public record ReconciliationInput(
        Long userId,
        Set<Long> oldLevelIds,
        Set<Long> newLevelIds,
        Optional<OrderReference> order
) {

    public ReconciliationInput {
        oldLevelIds = LevelIds.normalize(oldLevelIds);
        newLevelIds = LevelIds.normalize(newLevelIds);
        order = order == null ? Optional.empty() : order;
    }

    public static ReconciliationInput of(Long userId, Collection<Long> oldLevelIds, Collection<Long> newLevelIds) {
        return new ReconciliationInput(
                userId,
                LevelIds.normalize(oldLevelIds),
                LevelIds.normalize(newLevelIds),
                Optional.empty()
        );
    }

    /**
     * 새로 부여하는 수강 등록에 기록할 레벨 ID
     *
     * 주문 레벨이 있으면 주문 레벨, 없으면 새 레벨 집합의 첫 번째 값(보유 레벨 중 가장 먼저 가입한 레벨).
     * 주문이 없는 경로(레벨 변경, 일괄 변경, 운영 재조정)에서는 과목을 실제로 부여한 레벨과 다를 수 있다.
     * 과목별로 부여 레벨을 기록하려면 resolver가 과목 → 레벨 매핑을 돌려줘야 한다.
     */
    public Long grantingLevelId() {
        return order.map(OrderReference::levelId)
                .orElseGet(() -> newLevelIds.stream().findFirst().orElse(null));
    }
}
