package com.eduhub.learning_backend.modules.earnings.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Data
@Schema(description = "订阅收益对账报告 / Subscription revenue reconcile report")
public class ReconcileReport {

    @Schema(description = "账期 / Period")
    private String period;

    @Schema(description = "按学习行为应有流水的讲师数 / Teachers expected to have an entry")
    private int expectedTeachers;

    @Schema(description = "对账前已存在的流水数 / Entries present before reconcile")
    private int existingEntries;

    @Schema(description = "本次补写的流水数 / Entries repaired")
    private int repaired;

    @Schema(description = "补写后仍缺失的讲师 / Teachers still missing")
    private List<String> stillMissing = new ArrayList<>();

    @Schema(description = "流水分成合计 / Ledger amount after reconcile")
    private BigDecimal ledgerAmount = BigDecimal.ZERO;

    @Schema(description = "收益池讲师部分 / Pool teacher share")
    private BigDecimal teacherPool = BigDecimal.ZERO;

    @Schema(description = "teacherPool - ledgerAmount")
    private BigDecimal amountDiff = BigDecimal.ZERO;
}
