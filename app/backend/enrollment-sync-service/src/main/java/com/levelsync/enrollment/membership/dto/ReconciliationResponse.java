package com.levelsync.enrollment.membership.dto;

import com.levelsync.enrollment.reconcile.model.ReconciliationResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
@AllArgsConstructor
public class ReconciliationResponse {

    private Long userId;

    private List<Long> enrolledCourseIds;

    private List<Long> unenrolledCourseIds;

    private List<Long> failedCourseIds;

    public static ReconciliationResponse of(Long userId, ReconciliationResult result) {
        return ReconciliationResponse.builder()
                .userId(userId)
                .enrolledCourseIds(List.copyOf(result.enrolledCourseIds()))
                .unenrolledCourseIds(List.copyOf(result.unenrolledCourseIds()))
                .failedCourseIds(List.copyOf(result.failedCourseIds()))
                .build();
    }
}
