package com.eduhub.learning_backend.modules.subscription.enums;

public enum AccessType {
    SUBSCRIPTION,
    TRIAL,
    PROMOTIONAL
}
