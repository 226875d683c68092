package com.eduhub.learning_backend.modules.course.enums;

public enum MonetizationType {
    FREE,
    PREMIUM,
    SUBSCRIPTION
}
