package com.levelsync.enrollment.billing.service;

import com.levelsync.enrollment.billing.model.AccessModel;
import com.levelsync.enrollment.billing.model.LevelDetails;
import com.levelsync.enrollment.common.entity.MembershipLevel;
import com.levelsync.enrollment.common.entity.MembershipLevelMeta;
import com.levelsync.enrollment.common.repository.MembershipCategoryRepository;
import com.levelsync.enrollment.common.repository.MembershipLevelMetaRepository;
import com.levelsync.enrollment.common.repository.MembershipLevelRepository;
import com.levelsync.enrollment.common.repository.MembershipPageRepository;
import com.levelsync.enrollment.common.repository.MembershipUserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Billing DB 테이블을 직접 조회하는 MembershipBillingGateway
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaMembershipBillingGateway implements MembershipBillingGateway {

    static final String ACCESS_MODEL = "access_model";

    private final MembershipUserRepository membershipUserRepository;
    private final MembershipLevelRepository membershipLevelRepository;
    private final MembershipLevelMetaRepository membershipLevelMetaRepository;
    private final MembershipPageRepository membershipPageRepository;
    private final MembershipCategoryRepository membershipCategoryRepository;
    private final Clock clock;

    @Override
    public List<Long> findHeldLevelIds(Long userId) {
        if (userId == null || userId <= 0) {
            return List.of();
        }
        List<Long> levelIds = membershipUserRepository.findActiveMembershipIds(userId, LocalDateTime.now(clock));
        return new ArrayList<>(new LinkedHashSet<>(levelIds));
    }

    @Override
    public Optional<LevelDetails> findLevel(Long levelId) {
        if (levelId == null || levelId <= 0) {
            return Optional.empty();
        }
        Optional<MembershipLevel> level = membershipLevelRepository.findById(levelId);
        if (level.isEmpty()) {
            log.debug("Membership level not found: levelId={}", levelId);
            return Optional.empty();
        }

        AccessModel accessModel = membershipLevelMetaRepository.findFirstByLevelIdAndMetaKey(levelId, ACCESS_MODEL)
                .map(MembershipLevelMeta::getMetaValue)
                .map(AccessModel::fromMetaValue)
                .orElse(AccessModel.COURSE_SPECIFIC);

        List<Long> categoryIds = accessModel == AccessModel.CATEGORY_WISE
                ? membershipCategoryRepository.findCategoryIdsByMembershipId(levelId)
                : List.of();

        return Optional.of(new LevelDetails(levelId, level.get().getName(), accessModel, categoryIds));
    }

    @Override
    public List<Long> findRestrictedPageIds(Collection<Long> levelIds) {
        if (levelIds == null || levelIds.isEmpty()) {
            return List.of();
        }
        return membershipPageRepository.findPageIdsByMembershipIdIn(levelIds);
    }

    @Override
    public List<String> findLevelAttributeValues(String key, Collection<Long> levelIds) {
        if (levelIds == null || levelIds.isEmpty()) {
            return List.of();
        }
        return membershipLevelMetaRepository.findValuesByMetaKeyAndLevelIdIn(key, levelIds);
    }
}
