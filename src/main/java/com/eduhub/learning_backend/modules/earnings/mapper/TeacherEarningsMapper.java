package com.eduhub.learning_backend.modules.earnings.mapper;

import com.eduhub.learning_backend.modules.earnings.entity.TeacherEarnings;
import com.eduhub.learning_backend.modules.earnings.enums.EarningsStatus;
import com.eduhub.learning_backend.modules.earnings.enums.RevenueSource;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * MyBatis mapper：teacher_earnings 流水表。
 */
@Mapper
public interface TeacherEarningsMapper {

    /**
     * 幂等插入：命中唯一键 (teacher_id, revenue_source, source_id) 时忽略并返回 0。
     */
    int insertIgnore(TeacherEarnings earnings);

    List<TeacherEarnings> findBySourceId(@Param("revenueSource") RevenueSource revenueSource,
                                         @Param("sourceId") String sourceId);

    /**
     * @param source 为空时不过滤来源
     * @param period 为空时不过滤账期
     */
    List<TeacherEarnings> findByTeacher(@Param("teacherId") String teacherId,
                                        @Param("source") RevenueSource source,
                                        @Param("period") String period);

    List<TeacherEarnings> findByTeacherAndStatus(@Param("teacherId") String teacherId,
                                                 @Param("status") EarningsStatus status);

    List<TeacherEarnings> findRecentByTeacher(@Param("teacherId") String teacherId,
                                              @Param("limit") int limit);
}
