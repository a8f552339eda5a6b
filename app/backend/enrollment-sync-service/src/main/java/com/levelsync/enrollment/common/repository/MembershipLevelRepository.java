package com.levelsync.enrollment.common.repository;

import com.levelsync.enrollment.common.entity.MembershipLevel;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface MembershipLevelRepository extends JpaRepository<MembershipLevel, Long> {
}
