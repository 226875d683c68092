package com.eduhub.learning_backend.modules.admin.vo;

import com.eduhub.learning_backend.modules.earnings.enums.PoolStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Schema(description = "最近一次订阅收益分配 / Last distribution status")
public class DistributionStatusVo {

    @Schema(description = "最近已分配账期，从未分配时为空")
    private String lastDistributedPeriod;

    private LocalDateTime distributedAt;

    private PoolStatus status;

    private BigDecimal teacherPool;

    @Schema(description = "定时任务是否启用 / Whether the monthly job is enabled")
    private boolean schedulerEnabled;
}
