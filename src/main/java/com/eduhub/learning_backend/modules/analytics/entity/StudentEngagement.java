package com.eduhub.learning_backend.modules.analytics.entity;

import lombok.Data;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * 对应表：student_engagement
 * 每个 (学生, 内容, 账期) 一行；program_id 与 module_id 有且仅有一个非空。
 */
@Data
public class StudentEngagement implements Serializable {
    private static final long serialVersionUID = 1L;

    private Long id;
    private String studentId;
    private String programId;
    private String moduleId;
    /** PROGRAM:<id> / MODULE:<id> */
    private String contentKey;
    /** 账期 YYYY-MM */
    private String period;
    private Integer watchTimeMinutes;
    private Integer completionPercent;
    private Boolean completed;
    private LocalDateTime lastWatchedAt;
    private LocalDateTime completedAt;
    private LocalDateTime createdTime;
    private LocalDateTime updatedTime;
}
