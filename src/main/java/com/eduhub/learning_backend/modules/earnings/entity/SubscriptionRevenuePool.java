package com.eduhub.learning_backend.modules.earnings.entity;

import com.eduhub.learning_backend.modules.earnings.enums.PoolStatus;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 月度订阅收益池，每个账期一行。
 */
@Data
public class SubscriptionRevenuePool {
    private String id;
    private String period;
    private LocalDateTime periodStart;
    private LocalDateTime periodEnd;
    private BigDecimal totalRevenue;
    private BigDecimal platformFee;
    private BigDecimal teacherPool;
    private BigDecimal feeRate;
    private Long totalWatchTime;
    private Integer totalEngagements;
    private PoolStatus status;
    /** 乐观锁版本号，状态迁移使用 CAS */
    private Integer version;
    private LocalDateTime distributedAt;
    private LocalDateTime createdTime;
    private LocalDateTime updatedTime;

    public boolean isDistributed() {
        return status == PoolStatus.DISTRIBUTED;
    }
}
