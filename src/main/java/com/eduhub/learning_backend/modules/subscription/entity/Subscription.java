package com.eduhub.learning_backend.modules.subscription.entity;

import com.eduhub.learning_backend.modules.subscription.enums.SubscriptionStatus;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 用户订阅（每个用户一行，user_id 唯一）。
 */
@Data
public class Subscription {
    private String id;
    private String userId;
    private BigDecimal amount;
    private String currency;
    private SubscriptionStatus status;
    private String provider;
    private String transactionId;
    private LocalDateTime startsAt;
    private LocalDateTime expiresAt;
    private LocalDateTime cancelledAt;
    private LocalDateTime createdTime;
    private LocalDateTime updatedTime;
}
