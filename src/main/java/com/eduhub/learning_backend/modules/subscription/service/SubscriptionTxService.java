package com.eduhub.learning_backend.modules.subscription.service;

import com.eduhub.learning_backend.common.exception.BizException;
import com.eduhub.learning_backend.modules.earnings.config.RevenueProperties;
import com.eduhub.learning_backend.modules.subscription.entity.Subscription;
import com.eduhub.learning_backend.modules.subscription.enums.SubscriptionStatus;
import com.eduhub.learning_backend.modules.subscription.mapper.SubscriptionMapper;
import com.eduhub.learning_backend.modules.users.enums.UserSubscriptionStatus;
import com.eduhub.learning_backend.modules.users.mapper.UserMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 订阅状态迁移的事务实现（public 方法 + 由 SubscriptionService 调用，确保 @Transactional 生效）。
 * 订阅行与用户订阅状态在同一事务内更新。
 */
@Service
@Slf4j
public class SubscriptionTxService {

    private final SubscriptionMapper subscriptionMapper;
    private final UserMapper userMapper;
    private final RevenueProperties revenueProperties;
    private final Clock clock;

    public SubscriptionTxService(SubscriptionMapper subscriptionMapper,
                                 UserMapper userMapper,
                                 RevenueProperties revenueProperties,
                                 Clock clock) {
        this.subscriptionMapper = subscriptionMapper;
        this.userMapper = userMapper;
        this.revenueProperties = revenueProperties;
        this.clock = clock;
    }

    @Transactional
    public Subscription activate(String userId, String provider, String transactionId) {
        Subscription subscription = subscriptionMapper.selectByUserIdForUpdate(userId)
                .orElseThrow(() -> new BizException(404, "订阅不存在"));
        if (subscription.getStatus() == SubscriptionStatus.COMPLETED) {
            throw new BizException(409, "订阅已生效");
        }
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime expiresAt = now.plusDays(revenueProperties.getSubscriptionDurationDays());
        subscriptionMapper.activate(subscription.getId(), provider, transactionId, now, expiresAt);
        userMapper.updateSubscriptionStatus(userId, UserSubscriptionStatus.ACTIVE, expiresAt);

        subscription.setStatus(SubscriptionStatus.COMPLETED);
        subscription.setProvider(provider);
        subscription.setTransactionId(transactionId);
        subscription.setStartsAt(now);
        subscription.setExpiresAt(expiresAt);
        log.info("Subscription activated. userId={}, subscriptionId={}, expiresAt={}", userId, subscription.getId(), expiresAt);
        return subscription;
    }

    @Transactional
    public Subscription cancel(String userId) {
        Subscription subscription = subscriptionMapper.selectByUserIdForUpdate(userId)
                .orElseThrow(() -> new BizException(404, "订阅不存在"));
        if (subscription.getStatus() == SubscriptionStatus.CANCELLED) {
            throw new BizException(409, "订阅已取消");
        }
        LocalDateTime now = LocalDateTime.now(clock);
        subscriptionMapper.cancel(subscription.getId(), now);
        userMapper.updateSubscriptionStatus(userId, UserSubscriptionStatus.CANCELLED, null);

        subscription.setStatus(SubscriptionStatus.CANCELLED);
        subscription.setCancelledAt(now);
        log.info("Subscription cancelled. userId={}, subscriptionId={}", userId, subscription.getId());
        return subscription;
    }

    /**
     * 订阅行保持 COMPLETED（收益池按有效期统计），仅把用户状态置为 EXPIRED。
     */
    @Transactional
    public int expire(LocalDateTime now) {
        List<String> userIds = subscriptionMapper.findExpiredUserIds(now);
        if (userIds == null || userIds.isEmpty()) {
            return 0;
        }
        userMapper.updateSubscriptionStatusByIds(userIds, UserSubscriptionStatus.EXPIRED);
        return userIds.size();
    }
}
