package com.eduhub.learning_backend.modules.subscription.service;

import com.eduhub.learning_backend.common.exception.BizException;
import com.eduhub.learning_backend.modules.course.dto.ContentSummary;
import com.eduhub.learning_backend.modules.course.mapper.CourseContentMapper;
import com.eduhub.learning_backend.modules.earnings.config.RevenueProperties;
import com.eduhub.learning_backend.modules.subscription.entity.Subscription;
import com.eduhub.learning_backend.modules.subscription.enums.AccessType;
import com.eduhub.learning_backend.modules.subscription.enums.SubscriptionStatus;
import com.eduhub.learning_backend.modules.subscription.mapper.SubscriptionMapper;
import com.eduhub.learning_backend.modules.subscription.port.AccessGrantingPort;
import com.eduhub.learning_backend.modules.subscription.vo.SubscriptionStatusVo;
import com.eduhub.learning_backend.modules.users.entity.User;
import com.eduhub.learning_backend.modules.users.enums.UserSubscriptionStatus;
import com.eduhub.learning_backend.modules.users.mapper.UserMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
@Slf4j
public class SubscriptionService {

    private final SubscriptionMapper subscriptionMapper;
    private final SubscriptionTxService txService;
    private final UserMapper userMapper;
    private final CourseContentMapper courseContentMapper;
    private final AccessGrantingPort accessGrantingPort;
    private final RevenueProperties revenueProperties;
    private final Clock clock;

    public SubscriptionService(SubscriptionMapper subscriptionMapper,
                               SubscriptionTxService txService,
                               UserMapper userMapper,
                               CourseContentMapper courseContentMapper,
                               AccessGrantingPort accessGrantingPort,
                               RevenueProperties revenueProperties,
                               Clock clock) {
        this.subscriptionMapper = subscriptionMapper;
        this.txService = txService;
        this.userMapper = userMapper;
        this.courseContentMapper = courseContentMapper;
        this.accessGrantingPort = accessGrantingPort;
        this.revenueProperties = revenueProperties;
        this.clock = clock;
    }

    /**
     * 创建待支付订阅（每个用户仅一条）。
     */
    public Subscription createSubscription(String userId, String provider, String transactionId) {
        if (!StringUtils.hasText(userId)) {
            throw new BizException("userId 不能为空");
        }
        LocalDateTime now = LocalDateTime.now(clock);
        Subscription subscription = new Subscription();
        subscription.setId(UUID.randomUUID().toString());
        subscription.setUserId(userId);
        subscription.setAmount(revenueProperties.getSubscriptionFee());
        subscription.setCurrency(revenueProperties.getCurrency());
        subscription.setStatus(SubscriptionStatus.PENDING);
        subscription.setProvider(provider);
        subscription.setTransactionId(transactionId);
        subscription.setExpiresAt(now.plusDays(revenueProperties.getSubscriptionDurationDays()));
        try {
            subscriptionMapper.insert(subscription);
        } catch (DuplicateKeyException e) {
            throw new BizException(409, "该用户已存在订阅记录");
        }
        return subscription;
    }

    /**
     * 支付确认后激活订阅；事务提交后再为订阅内容授权，授权失败只记录日志。
     */
    public Subscription activateSubscription(String userId, String provider, String transactionId) {
        Subscription activated = txService.activate(userId, provider, transactionId);
        grantSubscriptionContent(userId, activated.getExpiresAt());
        return activated;
    }

    public SubscriptionStatusVo getSubscriptionStatus(String userId) {
        Optional<Subscription> subscriptionOpt = subscriptionMapper.selectByUserId(userId);
        Optional<User> userOpt = userMapper.selectById(userId);
        if (subscriptionOpt.isEmpty() || userOpt.isEmpty()) {
            return SubscriptionStatusVo.inactive();
        }
        Subscription subscription = subscriptionOpt.get();
        User user = userOpt.get();
        LocalDateTime now = LocalDateTime.now(clock);
        boolean active = subscription.getStatus() == SubscriptionStatus.COMPLETED
                && subscription.getExpiresAt() != null
                && subscription.getExpiresAt().isAfter(now)
                && user.getSubscriptionStatus() == UserSubscriptionStatus.ACTIVE;

        SubscriptionStatusVo vo = new SubscriptionStatusVo();
        vo.setActive(active);
        vo.setStatus(active ? "ACTIVE" : subscription.getStatus().name());
        vo.setExpiresAt(subscription.getExpiresAt());
        vo.setSubscription(subscription);
        return vo;
    }

    public boolean hasActiveSubscription(String userId) {
        return getSubscriptionStatus(userId).isActive();
    }

    public Subscription cancelSubscription(String userId) {
        return txService.cancel(userId);
    }

    public BigDecimal getSubscriptionFee() {
        return revenueProperties.getSubscriptionFee();
    }

    /**
     * 把已过期订阅的用户状态置为 EXPIRED。
     *
     * @return 受影响的用户数
     */
    public int checkExpiredSubscriptions() {
        int expired = txService.expire(LocalDateTime.now(clock));
        if (expired > 0) {
            log.info("Expired subscriptions processed. users={}", expired);
        }
        return expired;
    }

    private void grantSubscriptionContent(String userId, LocalDateTime expiresAt) {
        List<ContentSummary> contents;
        try {
            contents = courseContentMapper.selectSubscriptionContent();
        } catch (RuntimeException e) {
            log.warn("Failed to load subscription content, access not granted. userId={}", userId, e);
            return;
        }
        int granted = 0;
        for (ContentSummary content : contents) {
            try {
                accessGrantingPort.grantAccess(userId, content.getContentType(), content.getId(),
                        AccessType.SUBSCRIPTION, expiresAt);
                granted++;
            } catch (RuntimeException e) {
                log.warn("Failed to grant subscription access. userId={}, contentType={}, contentId={}",
                        userId, content.getContentType(), content.getId(), e);
            }
        }
        log.info("Subscription access granted. userId={}, granted={}, total={}", userId, granted, contents.size());
    }
}
