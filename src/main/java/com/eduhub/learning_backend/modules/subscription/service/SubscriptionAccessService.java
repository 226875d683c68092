package com.eduhub.learning_backend.modules.subscription.service;

import com.eduhub.learning_backend.common.exception.BizException;
import com.eduhub.learning_backend.modules.course.dto.ContentSummary;
import com.eduhub.learning_backend.modules.course.enums.ContentType;
import com.eduhub.learning_backend.modules.course.enums.MonetizationType;
import com.eduhub.learning_backend.modules.course.mapper.CourseContentMapper;
import com.eduhub.learning_backend.modules.subscription.entity.Subscription;
import com.eduhub.learning_backend.modules.subscription.entity.SubscriptionAccess;
import com.eduhub.learning_backend.modules.subscription.enums.AccessType;
import com.eduhub.learning_backend.modules.subscription.enums.SubscriptionStatus;
import com.eduhub.learning_backend.modules.subscription.mapper.SubscriptionAccessMapper;
import com.eduhub.learning_backend.modules.subscription.mapper.SubscriptionMapper;
import com.eduhub.learning_backend.modules.subscription.port.AccessGrantingPort;
import com.eduhub.learning_backend.modules.subscription.vo.AccessibleContentVo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@Slf4j
public class SubscriptionAccessService implements AccessGrantingPort {

    private final SubscriptionMapper subscriptionMapper;
    private final SubscriptionAccessMapper accessMapper;
    private final CourseContentMapper courseContentMapper;
    private final Clock clock;

    public SubscriptionAccessService(SubscriptionMapper subscriptionMapper,
                                     SubscriptionAccessMapper accessMapper,
                                     CourseContentMapper courseContentMapper,
                                     Clock clock) {
        this.subscriptionMapper = subscriptionMapper;
        this.accessMapper = accessMapper;
        this.courseContentMapper = courseContentMapper;
        this.clock = clock;
    }

    @Override
    public void grantAccess(String userId, ContentType contentType, String contentId,
                            AccessType accessType, LocalDateTime expiresAt) {
        Subscription subscription = subscriptionMapper.selectByUserId(userId)
                .filter(s -> s.getStatus() == SubscriptionStatus.COMPLETED)
                .orElseThrow(() -> new BizException(403, "用户没有生效中的订阅"));

        SubscriptionAccess access = new SubscriptionAccess();
        access.setId(UUID.randomUUID().toString());
        access.setUserId(userId);
        access.setContentType(contentType);
        access.setContentId(contentId);
        access.setAccessType(accessType != null ? accessType : AccessType.SUBSCRIPTION);
        access.setGrantedAt(LocalDateTime.now(clock));
        access.setExpiresAt(expiresAt != null ? expiresAt : subscription.getExpiresAt());
        accessMapper.upsert(access);
    }

    /**
     * FREE 内容始终可访问；其余内容需要未过期的订阅和未过期的授权记录。
     */
    public boolean hasAccess(String userId, ContentType contentType, String contentId) {
        MonetizationType monetization = courseContentMapper.selectMonetizationType(contentType, contentId);
        if (monetization == MonetizationType.FREE) {
            return true;
        }
        LocalDateTime now = LocalDateTime.now(clock);
        Subscription subscription = subscriptionMapper.selectByUserId(userId).orElse(null);
        if (subscription == null || subscription.getStatus() != SubscriptionStatus.COMPLETED) {
            return false;
        }
        if (subscription.getExpiresAt() != null && subscription.getExpiresAt().isBefore(now)) {
            return false;
        }
        return accessMapper.selectOne(userId, contentType, contentId)
                .map(access -> access.getExpiresAt() == null || !access.getExpiresAt().isBefore(now))
                .orElse(false);
    }

    /**
     * 删除已过期订阅用户的授权记录。
     *
     * @return 删除的记录数
     */
    public int revokeExpiredAccess() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<String> userIds = subscriptionMapper.findExpiredUserIds(now);
        if (userIds == null || userIds.isEmpty()) {
            return 0;
        }
        int revoked = accessMapper.deleteExpired(userIds, now);
        log.info("Expired subscription access revoked. users={}, records={}", userIds.size(), revoked);
        return revoked;
    }

    public List<AccessibleContentVo> getAccessibleContent(String userId) {
        List<SubscriptionAccess> accesses = accessMapper.findActiveByUser(userId, LocalDateTime.now(clock));
        if (accesses.isEmpty()) {
            return List.of();
        }
        Map<ContentType, List<String>> idsByType = accesses.stream()
                .collect(Collectors.groupingBy(SubscriptionAccess::getContentType,
                        () -> new EnumMap<>(ContentType.class),
                        Collectors.mapping(SubscriptionAccess::getContentId, Collectors.toList())));
        Map<String, ContentSummary> summaries = new HashMap<>();
        idsByType.forEach((type, ids) -> {
            for (ContentSummary summary : courseContentMapper.selectSummaries(type, ids)) {
                summaries.put(type.contentKey(summary.getId()), summary);
            }
        });

        List<AccessibleContentVo> result = new ArrayList<>(accesses.size());
        for (SubscriptionAccess access : accesses) {
            AccessibleContentVo vo = new AccessibleContentVo();
            vo.setContentType(access.getContentType());
            vo.setContentId(access.getContentId());
            vo.setAccessType(access.getAccessType());
            vo.setGrantedAt(access.getGrantedAt());
            vo.setExpiresAt(access.getExpiresAt());
            ContentSummary summary = summaries.get(access.getContentType().contentKey(access.getContentId()));
            if (summary != null) {
                vo.setTitle(summary.getTitle());
                vo.setThumbnailUrl(summary.getThumbnailUrl());
            }
            result.add(vo);
        }
        return result;
    }
}
