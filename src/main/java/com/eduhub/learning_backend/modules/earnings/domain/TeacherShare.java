package com.eduhub.learning_backend.modules.earnings.domain;

import java.math.BigDecimal;

/**
 * 单个讲师在收益池中的分成。
 */
public record TeacherShare(String teacherId,
                           long watchTimeMinutes,
                           int engagedStudents,
                           BigDecimal ratio,
                           BigDecimal amount,
                           BigDecimal platformFeeAmount,
                           BigDecimal netAmount) {
}
