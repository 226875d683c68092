package com.eduhub.learning_backend.modules.earnings.enums;

public enum EarningsStatus {
    PENDING,
    AVAILABLE,
    PAID
}
