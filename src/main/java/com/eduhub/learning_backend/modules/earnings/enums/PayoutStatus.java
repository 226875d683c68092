package com.eduhub.learning_backend.modules.earnings.enums;

/**
 * 单个讲师在一次分配中的写入结果。
 */
public enum PayoutStatus {
    CREATED,
    /** 唯一键冲突，已存在同账期记录（重试场景） */
    DUPLICATE,
    FAILED
}
