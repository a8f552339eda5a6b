package com.levelsync.enrollment.membership.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 관리자 멤버십 해지 요청
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CancelMembershipRequest {

    @NotNull
    @Positive
    private Long levelId;
}
