package com.eduhub.learning_backend.modules.earnings.service;

import com.eduhub.learning_backend.modules.earnings.config.RevenueProperties;
import com.eduhub.learning_backend.modules.earnings.domain.Period;
import com.eduhub.learning_backend.modules.earnings.vo.DistributionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 每月 1 日（UTC）分配上一个自然月的订阅收益。
 */
@Component
@Slf4j
public class RevenueDistributionScheduler {

    private final SubscriptionRevenueService revenueService;
    private final RevenueProperties revenueProperties;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public RevenueDistributionScheduler(SubscriptionRevenueService revenueService,
                                        RevenueProperties revenueProperties,
                                        Clock clock) {
        this.revenueService = revenueService;
        this.revenueProperties = revenueProperties;
        this.clock = clock;
    }

    @Scheduled(cron = "${app.revenue.distribution-cron:0 0 2 1 * ?}", zone = "UTC")
    public void distributePreviousMonth() {
        if (!revenueProperties.isDistributionEnabled()) {
            return;
        }
        if (!running.compareAndSet(false, true)) {
            log.warn("Revenue distribution is still running, skip this tick");
            return;
        }
        Period period = Period.previous(clock);
        try {
            if (revenueService.isDistributed(period)) {
                log.info("Revenue already distributed, skip. period={}", period);
                return;
            }
            DistributionResult result = revenueService.distributeRevenue(period);
            log.info("Scheduled revenue distribution finished. period={}, created={}, failed={}, totalAmount={}",
                    period, result.getDistributed(), result.getFailed(), result.getTotalAmount());
        } catch (Exception e) {
            log.error("Scheduled revenue distribution failed, will retry on next tick. period={}", period, e);
        } finally {
            running.set(false);
        }
    }
}
