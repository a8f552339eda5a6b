package com.levelsync.enrollment.billing.service;

import com.levelsync.enrollment.billing.model.LevelDetails;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Membership Billing 조회 인터페이스 (읽기 전용)
 */
public interface MembershipBillingGateway {

    String BOUND_COURSE_ID = "bound_course_id";
    String BOUND_BUNDLE_ID = "bound_bundle_id";

    /**
     * 사용자가 현재 보유한 레벨 ID (중복 없음, 가입 순)
     */
    List<Long> findHeldLevelIds(Long userId);

    /**
     * 레벨 메타데이터 조회 (레벨이 없으면 empty)
     */
    Optional<LevelDetails> findLevel(Long levelId);

    /**
     * 레벨 목록에 연결된 제한 페이지 ID
     */
    List<Long> findRestrictedPageIds(Collection<Long> levelIds);

    /**
     * 레벨 목록의 특정 속성 값 (역방향 조회)
     */
    List<String> findLevelAttributeValues(String key, Collection<Long> levelIds);
}
