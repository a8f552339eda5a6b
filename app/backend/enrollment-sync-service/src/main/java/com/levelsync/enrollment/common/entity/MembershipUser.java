package com.levelsync.enrollment.common.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * MembershipUser Entity - 사용자의 레벨 보유 이력 (읽기 전용)
 */
@Entity
@Table(name = "membership_users", indexes = {
    @Index(name = "idx_membership_users_user", columnList = "user_id, status")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class MembershipUser {

    public static final String STATUS_ACTIVE = "active";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "membership_id", nullable = false)
    private Long membershipId;

    /**
     * active / cancelled / expired / changed ...
     */
    @Column(nullable = false)
    private String status;

    @Column(name = "start_date")
    private LocalDateTime startDate;

    /**
     * 만료 시각 (null이면 무기한)
     */
    @Column(name = "end_date")
    private LocalDateTime endDate;
}
