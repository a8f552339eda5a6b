package com.levelsync.enrollment.common.entity;

import jakarta.persistence.*;
import lombok.*;

import java.io.Serializable;

/**
 * MembershipCategory Entity - 카테고리 단위 레벨이 접근 가능한 과목 카테고리 (읽기 전용)
 */
@Entity
@Table(name = "membership_categories")
@IdClass(MembershipCategory.Key.class)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class MembershipCategory {

    @Id
    @Column(name = "membership_id", nullable = false)
    private Long membershipId;

    @Id
    @Column(name = "category_id", nullable = false)
    private Long categoryId;

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode
    public static class Key implements Serializable {
        private Long membershipId;
        private Long categoryId;
    }
}
