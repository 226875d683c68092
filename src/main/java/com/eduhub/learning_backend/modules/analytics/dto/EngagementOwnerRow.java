package com.eduhub.learning_backend.modules.analytics.dto;

import lombok.Data;

/**
 * 学习记录与内容归属讲师的联表结果（收益聚合用）。
 */
@Data
public class EngagementOwnerRow {
    private Long engagementId;
    private String programId;
    private String moduleId;
    private String programTeacherId;
    private String moduleTeacherId;
    private Integer watchTimeMinutes;
    private Boolean completed;
}
