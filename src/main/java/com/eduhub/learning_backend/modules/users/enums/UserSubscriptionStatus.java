package com.eduhub.learning_backend.modules.users.enums;

/**
 * users.subscription_status 取值。
 */
public enum UserSubscriptionStatus {
    INACTIVE,
    ACTIVE,
    CANCELLED,
    EXPIRED
}
