package com.eduhub.learning_backend.modules.admin.controller;

import com.eduhub.learning_backend.common.api.ApiResponse;
import com.eduhub.learning_backend.common.security.CustomUserDetails;
import com.eduhub.learning_backend.common.vo.PageVo;
import com.eduhub.learning_backend.modules.admin.dto.DistributeRevenueDto;
import com.eduhub.learning_backend.modules.admin.dto.ReconcileRevenueDto;
import com.eduhub.learning_backend.modules.admin.service.AdminRevenueService;
import com.eduhub.learning_backend.modules.admin.vo.DistributionStatusVo;
import com.eduhub.learning_backend.modules.earnings.entity.SubscriptionRevenuePool;
import com.eduhub.learning_backend.modules.earnings.vo.DistributionResult;
import com.eduhub.learning_backend.modules.earnings.vo.ReconcileReport;
import com.eduhub.learning_backend.modules.subscription.service.SubscriptionAccessService;
import com.eduhub.learning_backend.modules.subscription.service.SubscriptionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/admin/jobs")
@PreAuthorize("hasRole('ADMIN')")
@Tag(name = "管理员/任务", description = "手动触发订阅收益分配、对账与订阅到期任务")
public class AdminJobsController {

    private final AdminRevenueService adminRevenueService;
    private final SubscriptionService subscriptionService;
    private final SubscriptionAccessService accessService;

    public AdminJobsController(AdminRevenueService adminRevenueService,
                               SubscriptionService subscriptionService,
                               SubscriptionAccessService accessService) {
        this.adminRevenueService = adminRevenueService;
        this.subscriptionService = subscriptionService;
        this.accessService = accessService;
    }

    @PostMapping("/distribute-revenue")
    @Operation(
            summary = "分配订阅收益",
            description = """
                    按观看时长把账期收益池分给讲师。period 不传时默认上一个自然月（UTC）。
                    已分配或正在分配的账期返回 409。
                    示例请求 (cURL):
                    curl -X POST "http://localhost:8080/api/v1/admin/jobs/distribute-revenue" \
                      -H "Authorization: Bearer <token>" -H "Content-Type: application/json" \
                      -d '{"period":"2025-03"}'
                    """
    )
    public ApiResponse<DistributionResult> distributeRevenue(@RequestBody(required = false) DistributeRevenueDto dto,
                                                             @AuthenticationPrincipal CustomUserDetails userDetails) {
        String period = dto != null ? dto.getPeriod() : null;
        return ApiResponse.ok(adminRevenueService.distribute(period, operatorId(userDetails)));
    }

    @GetMapping("/status")
    @Operation(summary = "最近一次分配状态")
    public ApiResponse<DistributionStatusVo> status() {
        return ApiResponse.ok(adminRevenueService.getStatus());
    }

    @GetMapping("/revenue-pools")
    @Operation(summary = "分页查询收益池")
    public ApiResponse<PageVo<SubscriptionRevenuePool>> revenuePools(@RequestParam(defaultValue = "1") int page,
                                                                     @RequestParam(defaultValue = "20") int size) {
        return ApiResponse.ok(adminRevenueService.listPools(page, size));
    }

    @PostMapping("/reconcile-revenue")
    @Operation(summary = "订阅收益对账", description = "比对应有分成与流水，补写缺失的讲师记录（可重复执行）。")
    public ApiResponse<ReconcileReport> reconcileRevenue(@Valid @RequestBody ReconcileRevenueDto dto,
                                                         @AuthenticationPrincipal CustomUserDetails userDetails) {
        return ApiResponse.ok(adminRevenueService.reconcile(dto.getPeriod(), operatorId(userDetails)));
    }

    @PostMapping("/check-expired-subscriptions")
    @Operation(summary = "处理到期订阅")
    public ApiResponse<Map<String, Integer>> checkExpiredSubscriptions() {
        return ApiResponse.ok(Map.of("expired", subscriptionService.checkExpiredSubscriptions()));
    }

    @PostMapping("/revoke-expired-access")
    @Operation(summary = "回收到期订阅的内容授权")
    public ApiResponse<Map<String, Integer>> revokeExpiredAccess() {
        return ApiResponse.ok(Map.of("revoked", accessService.revokeExpiredAccess()));
    }

    private String operatorId(CustomUserDetails userDetails) {
        return userDetails != null ? userDetails.getUserId() : null;
    }
}
