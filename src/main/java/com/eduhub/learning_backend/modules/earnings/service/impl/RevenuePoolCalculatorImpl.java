package com.eduhub.learning_backend.modules.earnings.service.impl;

import com.eduhub.learning_backend.modules.earnings.config.RevenueProperties;
import com.eduhub.learning_backend.modules.earnings.domain.EngagementSummary;
import com.eduhub.learning_backend.modules.earnings.domain.Period;
import com.eduhub.learning_backend.modules.earnings.entity.SubscriptionRevenuePool;
import com.eduhub.learning_backend.modules.earnings.enums.PoolStatus;
import com.eduhub.learning_backend.modules.earnings.exception.DoubleDistributionException;
import com.eduhub.learning_backend.modules.earnings.mapper.SubscriptionRevenuePoolMapper;
import com.eduhub.learning_backend.modules.earnings.service.EngagementAggregator;
import com.eduhub.learning_backend.modules.earnings.service.RevenuePoolCalculator;
import com.eduhub.learning_backend.modules.subscription.mapper.SubscriptionMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

@Service
@Slf4j
public class RevenuePoolCalculatorImpl implements RevenuePoolCalculator {

    static final int MONEY_SCALE = 8;

    private final SubscriptionMapper subscriptionMapper;
    private final SubscriptionRevenuePoolMapper poolMapper;
    private final EngagementAggregator engagementAggregator;
    private final RevenueProperties revenueProperties;
    private final Clock clock;

    public RevenuePoolCalculatorImpl(SubscriptionMapper subscriptionMapper,
                                     SubscriptionRevenuePoolMapper poolMapper,
                                     EngagementAggregator engagementAggregator,
                                     RevenueProperties revenueProperties,
                                     Clock clock) {
        this.subscriptionMapper = subscriptionMapper;
        this.poolMapper = poolMapper;
        this.engagementAggregator = engagementAggregator;
        this.revenueProperties = revenueProperties;
        this.clock = clock;
    }

    @Override
    public SubscriptionRevenuePool calculatePool(Period period) {
        SubscriptionRevenuePool existing = poolMapper.selectByPeriod(period.key()).orElse(null);
        if (existing != null && existing.isDistributed()) {
            throw new DoubleDistributionException(period.key());
        }

        BigDecimal totalRevenue = subscriptionMapper.sumCompletedAmountOverlapping(period.periodStart(), period.periodEnd());
        if (totalRevenue == null) {
            totalRevenue = BigDecimal.ZERO;
        }
        totalRevenue = totalRevenue.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
        BigDecimal feeRate = revenueProperties.getPlatformFeeRate();
        BigDecimal platformFee = totalRevenue.multiply(feeRate).setScale(MONEY_SCALE, RoundingMode.HALF_UP);
        BigDecimal teacherPool = totalRevenue.subtract(platformFee);

        EngagementSummary summary = engagementAggregator.aggregate(period);

        LocalDateTime now = LocalDateTime.now(clock);
        SubscriptionRevenuePool pool = new SubscriptionRevenuePool();
        pool.setId(existing != null ? existing.getId() : UUID.randomUUID().toString());
        pool.setPeriod(period.key());
        pool.setPeriodStart(period.periodStart());
        pool.setPeriodEnd(period.periodEnd());
        pool.setTotalRevenue(totalRevenue);
        pool.setPlatformFee(platformFee);
        pool.setTeacherPool(teacherPool);
        pool.setFeeRate(feeRate);
        pool.setTotalWatchTime(summary.totalWatchTime());
        pool.setTotalEngagements(summary.totalCompleted());
        pool.setStatus(PoolStatus.CALCULATING);
        pool.setCreatedTime(now);
        pool.setUpdatedTime(now);

        int affected = poolMapper.upsertCalculating(pool);
        // 读回：拿到数据库中的 id / version；并发下另一方可能已完成分配
        SubscriptionRevenuePool stored = poolMapper.selectByPeriod(period.key())
                .orElseThrow(() -> new IllegalStateException("revenue pool missing after upsert: period=" + period));
        if (stored.isDistributed()) {
            throw new DoubleDistributionException(period.key());
        }
        log.info("Revenue pool calculated. period={}, poolId={}, totalRevenue={}, teacherPool={}, totalWatchTime={}, completed={}, affected={}",
                period, stored.getId(), stored.getTotalRevenue(), stored.getTeacherPool(),
                stored.getTotalWatchTime(), stored.getTotalEngagements(), affected);
        return stored;
    }
}
