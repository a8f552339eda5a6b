package com.levelsync.enrollment.common.repository;

import com.levelsync.enrollment.common.entity.MembershipLevelMeta;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface MembershipLevelMetaRepository extends JpaRepository<MembershipLevelMeta, Long> {

    /**
     * 여러 레벨의 특정 key 값 조회 (역방향 조회: bound_course_id 등)
     */
    @Query("SELECT DISTINCT m.metaValue FROM MembershipLevelMeta m " +
           "WHERE m.metaKey = :metaKey AND m.levelId IN :levelIds")
    List<String> findValuesByMetaKeyAndLevelIdIn(@Param("metaKey") String metaKey,
                                                 @Param("levelIds") Collection<Long> levelIds);

    /**
     * 단일 레벨의 특정 key 조회 (access_model 등)
     */
    Optional<MembershipLevelMeta> findFirstByLevelIdAndMetaKey(Long levelId, String metaKey);
}
