package com.eduhub.learning_backend.modules.earnings.entity;

import com.eduhub.learning_backend.modules.earnings.enums.EarningsStatus;
import com.eduhub.learning_backend.modules.earnings.enums.RevenueSource;
import lombok.Data;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 讲师收益流水（只追加，不原地修改）。
 * 唯一键 (teacher_id, revenue_source, source_id)：订阅分配以账期为 source_id，内容销售以支付单号为 source_id。
 */
@Data
public class TeacherEarnings implements Serializable {
    private static final long serialVersionUID = 1L;

    private String id;
    private String teacherId;
    private RevenueSource revenueSource;
    private String sourceId;
    private String period;
    /** 内容销售对应的 program / module id，订阅分配为空 */
    private String contentId;
    private String description;
    private BigDecimal amount;
    private BigDecimal platformFeeAmount;
    private BigDecimal netAmount;
    private Long watchTimeMinutes;
    private Integer engagedStudents;
    private String revenuePoolId;
    private String currency;
    private EarningsStatus status;
    private LocalDateTime createdTime;
}
