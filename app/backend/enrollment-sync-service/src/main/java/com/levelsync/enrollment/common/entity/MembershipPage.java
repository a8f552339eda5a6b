package com.levelsync.enrollment.common.entity;

import jakarta.persistence.*;
import lombok.*;

import java.io.Serializable;

/**
 * MembershipPage Entity - 레벨별 접근 제한 페이지(과목) 연결 (읽기 전용)
 */
@Entity
@Table(name = "membership_pages")
@IdClass(MembershipPage.Key.class)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class MembershipPage {

    @Id
    @Column(name = "membership_id", nullable = false)
    private Long membershipId;

    /**
     * 제한 대상 페이지 ID (Catalog의 과목/번들 ID)
     */
    @Id
    @Column(name = "page_id", nullable = false)
    private Long pageId;

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode
    public static class Key implements Serializable {
        private Long membershipId;
        private Long pageId;
    }
}
