package com.eduhub.learning_backend.modules.earnings.enums;

public enum RevenueSource {
    /** 付费 program 销售 */
    COLLECTION,
    /** 月度订阅收益池分配 */
    SUBSCRIPTION,
    LIVE_WORKSHOP,
    /** 付费 module 销售 */
    LESSON
}
