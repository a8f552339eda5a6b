package com.levelsync.shared.dto.sqs;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 멤버십 주문 정보 (결제/환불 이벤트에 포함)
 * 모든 필드는 누락될 수 있다.
 */
@Data
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
@NoArgsConstructor
@AllArgsConstructor
public class OrderPayload {

    private Long id;

    /**
     * 주문 코드 (예: "A1B2C3D4E5")
     */
    private String code;

    private Long userId;

    /**
     * 주문한 멤버십 레벨 ID
     */
    private Long membershipId;
}
