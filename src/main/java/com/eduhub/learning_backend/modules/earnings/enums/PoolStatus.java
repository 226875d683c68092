package com.eduhub.learning_backend.modules.earnings.enums;

/**
 * 收益池状态：CALCULATING 可被重新计算，DISTRIBUTED 为终态。
 */
public enum PoolStatus {
    CALCULATING,
    DISTRIBUTED
}
