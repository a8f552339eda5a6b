package com.levelsync.enrollment.membership.controller;

import com.levelsync.enrollment.membership.dto.CancelMembershipRequest;
import com.levelsync.enrollment.membership.dto.ReconcileRequest;
import com.levelsync.enrollment.membership.dto.ReconciliationResponse;
import com.levelsync.enrollment.membership.service.MembershipEventAdapter;
import com.levelsync.enrollment.reconcile.model.ReconciliationResult;
import com.levelsync.shared.security.ServiceAuthValidator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 멤버십 동기화 내부 API (운영 도구 및 Billing 관리 화면 호출용)
 *
 * 인증: X-Api-Key 헤더 (ServiceAuthValidator)
 * 경로: /internal/v1/memberships/**
 */
@Slf4j
@RestController
@RequestMapping("/internal/v1/memberships")
@RequiredArgsConstructor
@Tag(name = "Internal Membership Sync API", description = "멤버십 해지 및 수강 재조정 (X-Api-Key 인증)")
public class MembershipInternalController {

    private final MembershipEventAdapter membershipEventAdapter;
    private final ServiceAuthValidator serviceAuthValidator;

    /**
     * 관리자 멤버십 해지: 레벨의 접근 모델(full_website / category_wise) 기준으로 수강 취소
     */
    @PostMapping("/users/{userId}/cancellations")
    @Operation(summary = "멤버십 해지에 따른 수강 취소", description = "해지된 레벨의 접근 모델 기준으로 활성 수강을 취소합니다.")
    public ResponseEntity<ReconciliationResponse> cancelMembership(
            @PathVariable Long userId,
            @RequestHeader("X-Api-Key") String apiKey,
            @Valid @RequestBody CancelMembershipRequest request
    ) {
        String caller = serviceAuthValidator.validateAndGetCaller(apiKey);
        log.info("[Internal API] cancel membership: userId={}, levelId={}, caller={}",
                userId, request.getLevelId(), caller);

        ReconciliationResult result = membershipEventAdapter.onMembershipCancelled(userId, request.getLevelId());
        return ResponseEntity.ok(ReconciliationResponse.of(userId, result));
    }

    /**
     * 변경 전 레벨 기준으로 현재 보유 레벨과 다시 재조정
     */
    @PostMapping("/users/{userId}/reconciliations")
    @Operation(summary = "수강 재조정", description = "변경 전 레벨과 현재 보유 레벨의 과목 차이를 다시 적용합니다.")
    public ResponseEntity<ReconciliationResponse> reconcile(
            @PathVariable Long userId,
            @RequestHeader("X-Api-Key") String apiKey,
            @Valid @RequestBody ReconcileRequest request
    ) {
        String caller = serviceAuthValidator.validateAndGetCaller(apiKey);
        log.info("[Internal API] reconcile: userId={}, previousLevelIds={}, caller={}",
                userId, request.getPreviousLevelIds(), caller);

        ReconciliationResult result = membershipEventAdapter.onReconcileRequested(userId, request.getPreviousLevelIds());
        return ResponseEntity.ok(ReconciliationResponse.of(userId, result));
    }
}
