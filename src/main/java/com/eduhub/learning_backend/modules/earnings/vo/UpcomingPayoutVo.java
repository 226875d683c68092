package com.eduhub.learning_backend.modules.earnings.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@Schema(description = "待结算收益 / Upcoming payout")
public class UpcomingPayoutVo implements Serializable {
    private static final long serialVersionUID = 1L;

    @Schema(description = "可结算净额 / Available net amount")
    private BigDecimal amount = BigDecimal.ZERO;

    @Schema(description = "可结算流水条数 / Available entries")
    private int entryCount;

    @Schema(description = "币种 / Currency", example = "USD")
    private String currency;

    @Schema(description = "下次结算日（UTC 次月1日） / Next payout date")
    private LocalDate nextPayoutDate;
}
