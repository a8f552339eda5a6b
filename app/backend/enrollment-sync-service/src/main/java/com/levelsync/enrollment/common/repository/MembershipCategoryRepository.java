package com.levelsync.enrollment.common.repository;

import com.levelsync.enrollment.common.entity.MembershipCategory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MembershipCategoryRepository extends JpaRepository<MembershipCategory, MembershipCategory.Key> {

    @Query("SELECT c.categoryId FROM MembershipCategory c WHERE c.membershipId = :membershipId")
    List<Long> findCategoryIdsByMembershipId(@Param("membershipId") Long membershipId);
}
