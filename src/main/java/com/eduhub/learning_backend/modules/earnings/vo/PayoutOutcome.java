package com.eduhub.learning_backend.modules.earnings.vo;

import com.eduhub.learning_backend.modules.earnings.enums.PayoutStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "单个讲师的分配结果 / Per-teacher payout outcome")
public class PayoutOutcome {

    @Schema(description = "讲师ID / Teacher id")
    private String teacherId;

    @Schema(description = "观看分钟数 / Watch minutes")
    private Long watchTimeMinutes;

    @Schema(description = "分成金额（毛额） / Gross share")
    private BigDecimal amount;

    @Schema(description = "写入结果 / Outcome", example = "CREATED")
    private PayoutStatus status;

    @Schema(description = "失败原因 / Failure reason")
    private String reason;
}
