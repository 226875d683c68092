package com.eduhub.learning_backend.modules.earnings.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * 订阅收益分配相关配置。
 */
@Component
@ConfigurationProperties(prefix = "app.revenue")
@Data
public class RevenueProperties {

    /**
     * 平台抽成比例，teacherPool = totalRevenue * (1 - platformFeeRate)。
     */
    private BigDecimal platformFeeRate = new BigDecimal("0.30");

    /**
     * 月度订阅价格。
     */
    private BigDecimal subscriptionFee = new BigDecimal("6.00");

    private int subscriptionDurationDays = 30;

    private String currency = "USD";

    /**
     * 是否启用每月自动分配任务；关闭时仍可由管理员手动触发。
     */
    private boolean distributionEnabled = false;

    private String distributionCron = "0 0 2 1 * ?";

    /**
     * 分配租约（Redis 锁）的过期时间，需大于单次分配的最长耗时。
     */
    private Duration distributionLockTtl = Duration.ofMinutes(30);
}
