package com.levelsync.enrollment.common.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * MembershipLevelMeta Entity - 레벨 속성 (key/value, 읽기 전용)
 *
 * 사용하는 key:
 * - access_model: full_website / category_wise (없으면 과목 지정 레벨)
 * - bound_course_id: 레벨이 연결된 과목 ID
 * - bound_bundle_id: 레벨이 연결된 번들 ID
 */
@Entity
@Table(name = "membership_level_meta", indexes = {
    @Index(name = "idx_level_meta_key", columnList = "level_id, meta_key")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class MembershipLevelMeta {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "meta_id")
    private Long id;

    @Column(name = "level_id", nullable = false)
    private Long levelId;

    @Column(name = "meta_key", nullable = false)
    private String metaKey;

    /**
     * 문자열로 저장된 값 (숫자 ID도 문자열)
     */
    @Column(name = "meta_value", length = 2000)
    private String metaValue;
}
