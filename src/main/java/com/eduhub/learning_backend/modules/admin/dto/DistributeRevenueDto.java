package com.eduhub.learning_backend.modules.admin.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

@Data
@Schema(description = "手动触发订阅收益分配 / Trigger subscription revenue distribution")
public class DistributeRevenueDto {

    @Schema(description = "账期 YYYY-MM，不传默认上一个自然月（UTC）", example = "2025-03")
    private String period;
}
