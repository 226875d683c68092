package com.eduhub.learning_backend.modules.earnings.controller;

import com.eduhub.learning_backend.common.api.ApiResponse;
import com.eduhub.learning_backend.common.security.CustomUserDetails;
import com.eduhub.learning_backend.modules.earnings.dto.RecordContentSaleDto;
import com.eduhub.learning_backend.modules.earnings.entity.TeacherEarnings;
import com.eduhub.learning_backend.modules.earnings.enums.RevenueSource;
import com.eduhub.learning_backend.modules.earnings.service.TeacherEarningsService;
import com.eduhub.learning_backend.modules.earnings.vo.EarningsBreakdownVo;
import com.eduhub.learning_backend.modules.earnings.vo.UpcomingPayoutVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/earnings")
@PreAuthorize("hasRole('TEACHER')")
@Tag(name = "讲师端/收益", description = "讲师收益构成、待结算金额与收益流水")
public class EarningsController {

    private final TeacherEarningsService earningsService;

    public EarningsController(TeacherEarningsService earningsService) {
        this.earningsService = earningsService;
    }

    @GetMapping("/breakdown")
    @Operation(
            summary = "收益构成",
            description = """
                    按来源汇总净收益：premium（program 销售）、subscription（订阅分成）、workshops、lessons。
                    示例请求 (cURL):
                    curl -X GET "http://localhost:8080/api/v1/earnings/breakdown?period=2025-03" \
                      -H "Authorization: Bearer <token>"
                    """
    )
    public ApiResponse<EarningsBreakdownVo> breakdown(
            @Parameter(description = "账期（YYYY-MM），不传为全部", example = "2025-03")
            @RequestParam(required = false) String period,
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        return ApiResponse.ok(earningsService.getEarningsBreakdown(userDetails.getUserId(), period));
    }

    @GetMapping("/upcoming-payout")
    @Operation(summary = "待结算收益", description = "AVAILABLE 状态流水的净额合计，下次结算日为 UTC 次月 1 日。")
    public ApiResponse<UpcomingPayoutVo> upcomingPayout(@AuthenticationPrincipal CustomUserDetails userDetails) {
        return ApiResponse.ok(earningsService.getUpcomingPayout(userDetails.getUserId()));
    }

    @GetMapping("/source/{source}")
    @Operation(summary = "按来源查询收益流水")
    public ApiResponse<List<TeacherEarnings>> bySource(@PathVariable RevenueSource source,
                                                       @RequestParam(required = false) String period,
                                                       @AuthenticationPrincipal CustomUserDetails userDetails) {
        return ApiResponse.ok(earningsService.getEarningsBySource(userDetails.getUserId(), source, period));
    }

    @GetMapping("/history")
    @Operation(summary = "最近收益流水")
    public ApiResponse<List<TeacherEarnings>> history(
            @Parameter(description = "条数，默认 50，最大 200", example = "50")
            @RequestParam(required = false) Integer limit,
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        return ApiResponse.ok(earningsService.getEarningsHistory(userDetails.getUserId(), limit));
    }

    @PostMapping("/sales")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "付费内容销售入账（支付回调 / 管理员补录）", description = "以支付单号幂等入账。")
    public ApiResponse<TeacherEarnings> recordSale(@Valid @RequestBody RecordContentSaleDto dto) {
        return ApiResponse.ok(earningsService.recordContentSale(dto.getContentType(), dto.getContentId(), dto.getPaymentId()));
    }
}
