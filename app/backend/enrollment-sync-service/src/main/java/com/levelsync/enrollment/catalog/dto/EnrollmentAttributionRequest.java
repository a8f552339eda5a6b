package com.levelsync.enrollment.catalog.dto;

import com.levelsync.enrollment.catalog.model.EnrollmentAttribution;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 수강 등록 출처 기록 요청
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnrollmentAttributionRequest {

    private String attribution;

    private Long levelId;

    private Long orderId;

    private String orderCode;

    public static EnrollmentAttributionRequest from(EnrollmentAttribution attribution) {
        return EnrollmentAttributionRequest.builder()
                .attribution(attribution.source().toWireValue())
                .levelId(attribution.levelId())
                .orderId(attribution.orderId())
                .orderCode(attribution.orderCode())
                .build();
    }
}
