package com.eduhub.learning_backend.modules.analytics.mapper;

import com.eduhub.learning_backend.modules.analytics.dto.EngagementOwnerRow;
import com.eduhub.learning_backend.modules.analytics.entity.StudentEngagement;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;
import java.util.Optional;

@Mapper
public interface StudentEngagementMapper {

    /**
     * 累加观看时长：命中唯一键 (student_id, period, content_key) 时递增，否则插入。
     */
    int upsertWatchTime(StudentEngagement engagement);

    /**
     * 标记完成（completion_percent=100）。
     */
    int upsertCompleted(StudentEngagement engagement);

    /**
     * 覆盖完成百分比；completed / completedAt 由调用方按百分比计算。
     */
    int upsertCompletionPercent(StudentEngagement engagement);

    Optional<StudentEngagement> selectByContentKey(@Param("studentId") String studentId,
                                                   @Param("period") String period,
                                                   @Param("contentKey") String contentKey);

    /**
     * @param period 为空时返回全部账期
     */
    List<StudentEngagement> findByStudent(@Param("studentId") String studentId,
                                          @Param("period") String period);

    /**
     * 指定账期的全部学习记录，并关联 program / module 的归属讲师。
     */
    List<EngagementOwnerRow> findByPeriodWithOwner(@Param("period") String period);
}
