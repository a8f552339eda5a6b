package com.levelsync.enrollment.common.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * MembershipLevel Entity - Billing 멤버십 레벨 (읽기 전용)
 */
@Entity
@Table(name = "membership_levels")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class MembershipLevel {

    @Id
    private Long id;

    /**
     * 레벨 이름 (예: "Gold")
     */
    @Column(nullable = false)
    private String name;
}
