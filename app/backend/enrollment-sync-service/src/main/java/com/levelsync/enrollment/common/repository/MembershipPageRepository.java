package com.levelsync.enrollment.common.repository;

import com.levelsync.enrollment.common.entity.MembershipPage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface MembershipPageRepository extends JpaRepository<MembershipPage, MembershipPage.Key> {

    /**
     * 레벨 목록에 연결된 제한 페이지 ID (중복 제거)
     */
    @Query("SELECT DISTINCT p.pageId FROM MembershipPage p WHERE p.membershipId IN :levelIds")
    List<Long> findPageIdsByMembershipIdIn(@Param("levelIds") Collection<Long> levelIds);
}
