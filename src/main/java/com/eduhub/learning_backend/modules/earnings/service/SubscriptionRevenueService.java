package com.eduhub.learning_backend.modules.earnings.service;

import com.eduhub.learning_backend.common.service.RedisService;
import com.eduhub.learning_backend.modules.earnings.config.RevenueProperties;
import com.eduhub.learning_backend.modules.earnings.domain.EngagementSummary;
import com.eduhub.learning_backend.modules.earnings.domain.Period;
import com.eduhub.learning_backend.modules.earnings.domain.TeacherShare;
import com.eduhub.learning_backend.modules.earnings.entity.SubscriptionRevenuePool;
import com.eduhub.learning_backend.modules.earnings.enums.PayoutStatus;
import com.eduhub.learning_backend.modules.earnings.exception.DistributionInProgressException;
import com.eduhub.learning_backend.modules.earnings.exception.DoubleDistributionException;
import com.eduhub.learning_backend.modules.earnings.mapper.SubscriptionRevenuePoolMapper;
import com.eduhub.learning_backend.modules.earnings.vo.DistributionResult;
import com.eduhub.learning_backend.modules.earnings.vo.PayoutOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * 月度订阅收益分配。
 * <p>
 * 流程：获取账期租约 → 检查是否已分配 → 重新计算收益池 → 按观看时长切分 →
 * 逐个讲师幂等写入流水（单个失败不影响其他讲师）→ CAS 置为 DISTRIBUTED。
 * 同一账期只允许分配一次；重复调用返回 409。
 */
@Service
@Slf4j
public class SubscriptionRevenueService {

    static final String LEASE_KEY_PREFIX = "revenue:distribution:lease:";

    private final RevenuePoolCalculator poolCalculator;
    private final EngagementAggregator engagementAggregator;
    private final RevenueShareAllocator shareAllocator;
    private final TeacherEarningsLedgerService ledgerService;
    private final SubscriptionRevenuePoolMapper poolMapper;
    private final RedisService redisService;
    private final RevenueProperties revenueProperties;
    private final Clock clock;

    public SubscriptionRevenueService(RevenuePoolCalculator poolCalculator,
                                      EngagementAggregator engagementAggregator,
                                      RevenueShareAllocator shareAllocator,
                                      TeacherEarningsLedgerService ledgerService,
                                      SubscriptionRevenuePoolMapper poolMapper,
                                      RedisService redisService,
                                      RevenueProperties revenueProperties,
                                      Clock clock) {
        this.poolCalculator = poolCalculator;
        this.engagementAggregator = engagementAggregator;
        this.shareAllocator = shareAllocator;
        this.ledgerService = ledgerService;
        this.poolMapper = poolMapper;
        this.redisService = redisService;
        this.revenueProperties = revenueProperties;
        this.clock = clock;
    }

    @CacheEvict(cacheNames = "teacherEarnings", allEntries = true)
    public DistributionResult distributeRevenue(Period period) {
        String leaseKey = LEASE_KEY_PREFIX + period.key();
        String token = UUID.randomUUID().toString();
        if (!redisService.tryAcquireLease(leaseKey, token, revenueProperties.getDistributionLockTtl())) {
            throw new DistributionInProgressException(period.key());
        }
        try {
            return distributeUnderLease(period);
        } finally {
            if (!redisService.releaseLease(leaseKey, token)) {
                log.warn("Distribution lease already expired or taken over on release. period={}", period);
            }
        }
    }

    public boolean isDistributed(Period period) {
        return poolMapper.selectByPeriod(period.key())
                .map(SubscriptionRevenuePool::isDistributed)
                .orElse(false);
    }

    private DistributionResult distributeUnderLease(Period period) {
        if (isDistributed(period)) {
            throw new DoubleDistributionException(period.key());
        }
        SubscriptionRevenuePool pool = poolCalculator.calculatePool(period);
        DistributionResult result = DistributionResult.empty(period.key(), pool.getId());

        if (pool.getTotalWatchTime() == null || pool.getTotalWatchTime() <= 0) {
            int updated = poolMapper.markDistributed(pool.getId(), pool.getVersion(), LocalDateTime.now(clock));
            if (updated == 0) {
                throw new DoubleDistributionException(period.key());
            }
            result.setPoolClosed(true);
            log.info("No engagement in period, pool closed without entries. period={}, poolId={}", period, pool.getId());
            return result;
        }

        EngagementSummary summary = engagementAggregator.aggregate(period);
        List<TeacherShare> shares = shareAllocator.allocate(pool.getTeacherPool(), pool.getFeeRate(), summary);
        BigDecimal totalAmount = BigDecimal.ZERO;
        for (TeacherShare share : shares) {
            PayoutOutcome outcome = new PayoutOutcome(share.teacherId(), share.watchTimeMinutes(), share.amount(), null, null);
            try {
                if (ledgerService.recordSubscriptionShare(pool, share)) {
                    outcome.setStatus(PayoutStatus.CREATED);
                    result.setDistributed(result.getDistributed() + 1);
                    totalAmount = totalAmount.add(share.amount());
                } else {
                    outcome.setStatus(PayoutStatus.DUPLICATE);
                    log.warn("Subscription earnings already recorded, skipped. period={}, teacherId={}", period, share.teacherId());
                }
            } catch (RuntimeException e) {
                outcome.setStatus(PayoutStatus.FAILED);
                outcome.setReason(e.getMessage());
                result.setFailed(result.getFailed() + 1);
                log.error("Failed to record subscription earnings. period={}, teacherId={}, amount={}",
                        period, share.teacherId(), share.amount(), e);
            }
            result.getOutcomes().add(outcome);
        }
        result.setTotalAmount(totalAmount);

        int updated = poolMapper.markDistributed(pool.getId(), pool.getVersion(), LocalDateTime.now(clock));
        result.setPoolClosed(updated > 0);
        if (updated == 0) {
            log.warn("Pool status CAS lost after entries were written. period={}, poolId={}, version={}",
                    period, pool.getId(), pool.getVersion());
        }
        log.info("Subscription revenue distributed. period={}, poolId={}, teachers={}, created={}, failed={}, totalAmount={}, teacherPool={}",
                period, pool.getId(), shares.size(), result.getDistributed(), result.getFailed(), totalAmount, pool.getTeacherPool());
        return result;
    }
}
