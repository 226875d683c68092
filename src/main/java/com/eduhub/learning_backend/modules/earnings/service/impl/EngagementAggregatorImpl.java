package com.eduhub.learning_backend.modules.earnings.service.impl;

import com.eduhub.learning_backend.modules.analytics.dto.EngagementOwnerRow;
import com.eduhub.learning_backend.modules.analytics.mapper.StudentEngagementMapper;
import com.eduhub.learning_backend.modules.earnings.domain.EngagementSummary;
import com.eduhub.learning_backend.modules.earnings.domain.Period;
import com.eduhub.learning_backend.modules.earnings.service.EngagementAggregator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
public class EngagementAggregatorImpl implements EngagementAggregator {

    private final StudentEngagementMapper engagementMapper;

    public EngagementAggregatorImpl(StudentEngagementMapper engagementMapper) {
        this.engagementMapper = engagementMapper;
    }

    @Override
    public EngagementSummary aggregate(Period period) {
        List<EngagementOwnerRow> rows = engagementMapper.findByPeriodWithOwner(period.key());
        if (rows == null || rows.isEmpty()) {
            return EngagementSummary.empty();
        }
        long totalWatchTime = 0L;
        int totalCompleted = 0;
        int unresolved = 0;
        Map<String, Long> watchByTeacher = new HashMap<>();
        Map<String, Integer> completedByTeacher = new HashMap<>();

        for (EngagementOwnerRow row : rows) {
            if (row == null) {
                continue;
            }
            long minutes = row.getWatchTimeMinutes() == null ? 0L : Math.max(0, row.getWatchTimeMinutes());
            boolean completed = Boolean.TRUE.equals(row.getCompleted());
            totalWatchTime += minutes;
            if (completed) {
                totalCompleted++;
            }

            String teacherId = resolveTeacher(row, period);
            if (teacherId == null) {
                unresolved++;
                continue;
            }
            watchByTeacher.merge(teacherId, minutes, Long::sum);
            if (completed) {
                completedByTeacher.merge(teacherId, 1, Integer::sum);
            }
        }
        if (unresolved > 0) {
            log.warn("Engagement records without owning teacher skipped. period={}, unresolved={}, total={}",
                    period, unresolved, rows.size());
        }
        return new EngagementSummary(totalWatchTime, totalCompleted, watchByTeacher, completedByTeacher, unresolved);
    }

    private String resolveTeacher(EngagementOwnerRow row, Period period) {
        boolean hasProgram = StringUtils.hasText(row.getProgramId());
        boolean hasModule = StringUtils.hasText(row.getModuleId());
        if (hasProgram && hasModule) {
            log.warn("Engagement references both program and module, attributed to program owner. period={}, engagementId={}",
                    period, row.getEngagementId());
        }
        if (hasProgram) {
            if (StringUtils.hasText(row.getProgramTeacherId())) {
                return row.getProgramTeacherId();
            }
            log.warn("Program engagement has no owning teacher, falling back to module owner. period={}, engagementId={}, programId={}",
                    period, row.getEngagementId(), row.getProgramId());
        }
        if (hasModule && StringUtils.hasText(row.getModuleTeacherId())) {
            return row.getModuleTeacherId();
        }
        log.warn("Engagement has no owning teacher. period={}, engagementId={}, moduleId={}",
                period, row.getEngagementId(), row.getModuleId());
        return null;
    }
}
