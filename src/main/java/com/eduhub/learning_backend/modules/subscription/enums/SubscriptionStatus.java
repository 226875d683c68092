package com.eduhub.learning_backend.modules.subscription.enums;

/**
 * 订阅支付状态。COMPLETED 表示已支付并生效。
 */
public enum SubscriptionStatus {
    PENDING,
    COMPLETED,
    FAILED,
    CANCELLED
}
