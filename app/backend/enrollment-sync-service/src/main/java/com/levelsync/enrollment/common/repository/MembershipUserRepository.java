package com.levelsync.enrollment.common.repository;

import com.levelsync.enrollment.common.entity.MembershipUser;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface MembershipUserRepository extends JpaRepository<MembershipUser, Long> {

    /**
     * 사용자가 현재 보유한 레벨 ID (active 상태, 만료되지 않은 것만)
     * 가장 먼저 가입한 레벨이 앞에 온다.
     */
    @Query("SELECT u.membershipId FROM MembershipUser u " +
           "WHERE u.userId = :userId AND u.status = 'active' " +
           "AND (u.endDate IS NULL OR u.endDate > :now) " +
           "ORDER BY u.id")
    List<Long> findActiveMembershipIds(@Param("userId") Long userId, @Param("now") LocalDateTime now);
}
