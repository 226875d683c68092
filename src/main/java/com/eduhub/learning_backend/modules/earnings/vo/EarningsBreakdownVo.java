package com.eduhub.learning_backend.modules.earnings.vo;

import com.eduhub.learning_backend.modules.earnings.entity.TeacherEarnings;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.io.Serializable;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Data
@Schema(description = "讲师收益构成（按来源的净额） / Teacher earnings breakdown by source (net)")
public class EarningsBreakdownVo implements Serializable {
    private static final long serialVersionUID = 1L;

    @Schema(description = "账期，空表示全部 / Period, null for all time")
    private String period;

    @Schema(description = "付费 program 销售 / Premium program sales")
    private BigDecimal premium = BigDecimal.ZERO;

    @Schema(description = "订阅分成 / Subscription pool")
    private BigDecimal subscription = BigDecimal.ZERO;

    @Schema(description = "直播工作坊 / Live workshops")
    private BigDecimal workshops = BigDecimal.ZERO;

    @Schema(description = "付费 module 销售 / Lesson sales")
    private BigDecimal lessons = BigDecimal.ZERO;

    @Schema(description = "合计 / Total")
    private BigDecimal total = BigDecimal.ZERO;

    private List<TeacherEarnings> entries = new ArrayList<>();
}
