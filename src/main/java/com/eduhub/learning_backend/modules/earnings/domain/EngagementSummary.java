package com.eduhub.learning_backend.modules.earnings.domain;

import java.util.Map;

/**
 * 一个账期的学习行为汇总。
 * totalWatchTime / totalCompleted 覆盖全部记录；按讲师的统计只包含能解析到讲师的记录。
 */
public record EngagementSummary(long totalWatchTime,
                                int totalCompleted,
                                Map<String, Long> perTeacherWatchTime,
                                Map<String, Integer> perTeacherCompletedCount,
                                int unresolvedRecords) {

    public EngagementSummary {
        perTeacherWatchTime = perTeacherWatchTime == null ? Map.of() : Map.copyOf(perTeacherWatchTime);
        perTeacherCompletedCount = perTeacherCompletedCount == null ? Map.of() : Map.copyOf(perTeacherCompletedCount);
    }

    public static EngagementSummary empty() {
        return new EngagementSummary(0L, 0, Map.of(), Map.of(), 0);
    }

    public long watchTimeOf(String teacherId) {
        return perTeacherWatchTime.getOrDefault(teacherId, 0L);
    }

    public int completedCountOf(String teacherId) {
        return perTeacherCompletedCount.getOrDefault(teacherId, 0);
    }
}
