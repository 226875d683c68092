package com.eduhub.learning_backend.modules.earnings.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Data
@Schema(description = "月度订阅收益分配结果 / Monthly subscription revenue distribution result")
public class DistributionResult {

    @Schema(description = "账期 / Period", example = "2025-03")
    private String period;

    @Schema(description = "收益池ID / Pool id")
    private String poolId;

    @Schema(description = "本次新建的流水条数 / Entries created in this run")
    private int distributed;

    @Schema(description = "新建流水的分成总额 / Sum of created amounts")
    private BigDecimal totalAmount = BigDecimal.ZERO;

    @Schema(description = "写入失败的讲师数 / Failed teachers")
    private int failed;

    @Schema(description = "收益池是否已置为 DISTRIBUTED；false 表示状态切换失败，需重新执行或对账 / Whether the pool was closed by this run")
    private boolean poolClosed;

    @Schema(description = "逐个讲师的结果 / Per-teacher outcomes")
    private List<PayoutOutcome> outcomes = new ArrayList<>();

    public static DistributionResult empty(String period, String poolId) {
        DistributionResult result = new DistributionResult();
        result.setPeriod(period);
        result.setPoolId(poolId);
        return result;
    }
}
