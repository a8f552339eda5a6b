package com.levelsync.enrollment.membership.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 운영 재조정 요청
 * previousLevelIds가 비어 있으면 현재 보유 레벨의 과목 등록만 보정한다.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReconcileRequest {

    @NotNull
    private List<Long> previousLevelIds;
}
