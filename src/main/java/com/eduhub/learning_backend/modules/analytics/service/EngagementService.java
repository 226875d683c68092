package com.eduhub.learning_backend.modules.analytics.service;

import com.eduhub.learning_backend.common.exception.BizException;
import com.eduhub.learning_backend.modules.analytics.entity.StudentEngagement;
import com.eduhub.learning_backend.modules.analytics.mapper.StudentEngagementMapper;
import com.eduhub.learning_backend.modules.course.enums.ContentType;
import com.eduhub.learning_backend.modules.earnings.domain.Period;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 学生学习行为记录：观看时长、完成状态、完成百分比。
 * 所有写入都落在“当前 UTC 账期”，是月度订阅收益分配的数据来源。
 */
@Service
@Slf4j
public class EngagementService {

    private final StudentEngagementMapper engagementMapper;
    private final Clock clock;

    public EngagementService(StudentEngagementMapper engagementMapper, Clock clock) {
        this.engagementMapper = engagementMapper;
        this.clock = clock;
    }

    public StudentEngagement trackWatchTime(String studentId, String contentId, ContentType contentType, int minutes) {
        if (minutes <= 0) {
            throw new BizException("minutes 必须大于0");
        }
        LocalDateTime now = LocalDateTime.now(clock);
        StudentEngagement engagement = newRow(studentId, contentId, contentType);
        engagement.setWatchTimeMinutes(minutes);
        engagement.setCompletionPercent(0);
        engagement.setCompleted(false);
        engagement.setLastWatchedAt(now);
        engagementMapper.upsertWatchTime(engagement);
        return reload(engagement);
    }

    public StudentEngagement markCompleted(String studentId, String contentId, ContentType contentType) {
        LocalDateTime now = LocalDateTime.now(clock);
        StudentEngagement engagement = newRow(studentId, contentId, contentType);
        engagement.setWatchTimeMinutes(0);
        engagement.setCompletionPercent(100);
        engagement.setCompleted(true);
        engagement.setCompletedAt(now);
        engagementMapper.upsertCompleted(engagement);
        return reload(engagement);
    }

    public StudentEngagement updateCompletionPercent(String studentId, String contentId, ContentType contentType, int percent) {
        int clamped = Math.min(100, Math.max(0, percent));
        boolean completed = clamped >= 100;
        StudentEngagement engagement = newRow(studentId, contentId, contentType);
        engagement.setWatchTimeMinutes(0);
        engagement.setCompletionPercent(clamped);
        engagement.setCompleted(completed);
        engagement.setCompletedAt(completed ? LocalDateTime.now(clock) : null);
        engagementMapper.upsertCompletionPercent(engagement);
        return reload(engagement);
    }

    public List<StudentEngagement> getStudentEngagement(String studentId, String period) {
        String periodKey = StringUtils.hasText(period) ? Period.parse(period).key() : null;
        return engagementMapper.findByStudent(studentId, periodKey);
    }

    private StudentEngagement newRow(String studentId, String contentId, ContentType contentType) {
        if (!StringUtils.hasText(studentId) || !StringUtils.hasText(contentId) || contentType == null) {
            throw new BizException("studentId / contentId / contentType 不能为空");
        }
        StudentEngagement engagement = new StudentEngagement();
        engagement.setStudentId(studentId);
        if (contentType == ContentType.PROGRAM) {
            engagement.setProgramId(contentId);
        } else {
            engagement.setModuleId(contentId);
        }
        engagement.setContentKey(contentType.contentKey(contentId));
        engagement.setPeriod(Period.current(clock).key());
        return engagement;
    }

    private StudentEngagement reload(StudentEngagement written) {
        return engagementMapper.selectByContentKey(written.getStudentId(), written.getPeriod(), written.getContentKey())
                .orElseThrow(() -> new IllegalStateException("engagement row missing after upsert: studentId="
                        + written.getStudentId() + ", contentKey=" + written.getContentKey()));
    }
}
