package com.eduhub.learning_backend.modules.subscription.controller;

import com.eduhub.learning_backend.common.api.ApiResponse;
import com.eduhub.learning_backend.common.security.CustomUserDetails;
import com.eduhub.learning_backend.modules.course.enums.ContentType;
import com.eduhub.learning_backend.modules.subscription.dto.CreateSubscriptionDto;
import com.eduhub.learning_backend.modules.subscription.entity.Subscription;
import com.eduhub.learning_backend.modules.subscription.service.SubscriptionAccessService;
import com.eduhub.learning_backend.modules.subscription.service.SubscriptionService;
import com.eduhub.learning_backend.modules.subscription.vo.AccessibleContentVo;
import com.eduhub.learning_backend.modules.subscription.vo.SubscriptionStatusVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/subscriptions")
@Tag(name = "用户端/订阅", description = "月度订阅的创建、激活、取消与内容授权查询")
public class SubscriptionController {

    private final SubscriptionService subscriptionService;
    private final SubscriptionAccessService accessService;

    public SubscriptionController(SubscriptionService subscriptionService,
                                  SubscriptionAccessService accessService) {
        this.subscriptionService = subscriptionService;
        this.accessService = accessService;
    }

    @GetMapping("/fee")
    @Operation(summary = "查询订阅价格")
    public ApiResponse<Map<String, BigDecimal>> fee() {
        return ApiResponse.ok(Map.of("fee", subscriptionService.getSubscriptionFee()));
    }

    @PostMapping
    @Operation(summary = "创建待支付订阅")
    public ApiResponse<Subscription> create(@Valid @RequestBody CreateSubscriptionDto dto,
                                            @AuthenticationPrincipal CustomUserDetails userDetails) {
        return ApiResponse.ok(subscriptionService.createSubscription(
                userDetails.getUserId(), dto.getProvider(), dto.getTransactionId()));
    }

    @PostMapping("/activate")
    @Operation(summary = "支付确认后激活订阅", description = "激活成功后为全部订阅内容授权；授权失败不影响激活结果。")
    public ApiResponse<Subscription> activate(@Valid @RequestBody CreateSubscriptionDto dto,
                                              @AuthenticationPrincipal CustomUserDetails userDetails) {
        return ApiResponse.ok(subscriptionService.activateSubscription(
                userDetails.getUserId(), dto.getProvider(), dto.getTransactionId()));
    }

    @GetMapping("/status")
    @Operation(summary = "查询我的订阅状态")
    public ApiResponse<SubscriptionStatusVo> status(@AuthenticationPrincipal CustomUserDetails userDetails) {
        return ApiResponse.ok(subscriptionService.getSubscriptionStatus(userDetails.getUserId()));
    }

    @PostMapping("/cancel")
    @Operation(summary = "取消订阅")
    public ApiResponse<Subscription> cancel(@AuthenticationPrincipal CustomUserDetails userDetails) {
        return ApiResponse.ok(subscriptionService.cancelSubscription(userDetails.getUserId()));
    }

    @GetMapping("/access")
    @Operation(summary = "查询我可访问的订阅内容")
    public ApiResponse<List<AccessibleContentVo>> accessibleContent(@AuthenticationPrincipal CustomUserDetails userDetails) {
        return ApiResponse.ok(accessService.getAccessibleContent(userDetails.getUserId()));
    }

    @GetMapping("/access/{contentType}/{contentId}")
    @Operation(summary = "检查是否可访问某个内容")
    public ApiResponse<Map<String, Boolean>> hasAccess(@PathVariable ContentType contentType,
                                                       @PathVariable String contentId,
                                                       @AuthenticationPrincipal CustomUserDetails userDetails) {
        boolean allowed = accessService.hasAccess(userDetails.getUserId(), contentType, contentId);
        return ApiResponse.ok(Map.of("hasAccess", allowed));
    }
}
