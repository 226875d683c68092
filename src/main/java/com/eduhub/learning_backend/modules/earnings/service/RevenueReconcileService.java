package com.eduhub.learning_backend.modules.earnings.service;

import com.eduhub.learning_backend.common.exception.BizException;
import com.eduhub.learning_backend.modules.earnings.domain.EngagementSummary;
import com.eduhub.learning_backend.modules.earnings.domain.Period;
import com.eduhub.learning_backend.modules.earnings.domain.TeacherShare;
import com.eduhub.learning_backend.modules.earnings.entity.SubscriptionRevenuePool;
import com.eduhub.learning_backend.modules.earnings.entity.TeacherEarnings;
import com.eduhub.learning_backend.modules.earnings.enums.RevenueSource;
import com.eduhub.learning_backend.modules.earnings.mapper.SubscriptionRevenuePoolMapper;
import com.eduhub.learning_backend.modules.earnings.mapper.TeacherEarningsMapper;
import com.eduhub.learning_backend.modules.earnings.vo.ReconcileReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 订阅收益对账：用学习行为重新推导应有分成，与流水比对，补写缺失的讲师记录。
 * 补写沿用同一唯一键，可重复执行。
 */
@Service
@Slf4j
public class RevenueReconcileService {

    private final SubscriptionRevenuePoolMapper poolMapper;
    private final TeacherEarningsMapper earningsMapper;
    private final EngagementAggregator engagementAggregator;
    private final RevenueShareAllocator shareAllocator;
    private final TeacherEarningsLedgerService ledgerService;

    public RevenueReconcileService(SubscriptionRevenuePoolMapper poolMapper,
                                   TeacherEarningsMapper earningsMapper,
                                   EngagementAggregator engagementAggregator,
                                   RevenueShareAllocator shareAllocator,
                                   TeacherEarningsLedgerService ledgerService) {
        this.poolMapper = poolMapper;
        this.earningsMapper = earningsMapper;
        this.engagementAggregator = engagementAggregator;
        this.shareAllocator = shareAllocator;
        this.ledgerService = ledgerService;
    }

    @CacheEvict(cacheNames = "teacherEarnings", allEntries = true)
    public ReconcileReport reconcile(Period period) {
        SubscriptionRevenuePool pool = poolMapper.selectByPeriod(period.key())
                .orElseThrow(() -> new BizException(404, "账期 " + period + " 尚未计算收益池"));
        if (!pool.isDistributed()) {
            throw new BizException(409, "账期 " + period + " 尚未完成分配，不能对账");
        }

        EngagementSummary summary = engagementAggregator.aggregate(period);
        List<TeacherShare> expected = shareAllocator.allocate(pool.getTeacherPool(), pool.getFeeRate(), summary);
        List<TeacherEarnings> existing = earningsMapper.findBySourceId(RevenueSource.SUBSCRIPTION, period.key());
        Set<String> recorded = existing.stream()
                .map(TeacherEarnings::getTeacherId)
                .collect(Collectors.toSet());

        ReconcileReport report = new ReconcileReport();
        report.setPeriod(period.key());
        report.setExpectedTeachers(expected.size());
        report.setExistingEntries(existing.size());
        report.setTeacherPool(pool.getTeacherPool());

        for (TeacherShare share : expected) {
            if (recorded.contains(share.teacherId())) {
                continue;
            }
            try {
                if (ledgerService.recordSubscriptionShare(pool, share)) {
                    report.setRepaired(report.getRepaired() + 1);
                    log.info("Missing subscription earnings repaired. period={}, teacherId={}, amount={}",
                            period, share.teacherId(), share.amount());
                }
            } catch (RuntimeException e) {
                report.getStillMissing().add(share.teacherId());
                log.error("Failed to repair subscription earnings. period={}, teacherId={}", period, share.teacherId(), e);
            }
        }

        BigDecimal ledgerAmount = earningsMapper.findBySourceId(RevenueSource.SUBSCRIPTION, period.key()).stream()
                .map(TeacherEarnings::getAmount)
                .filter(Objects::nonNull)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        report.setLedgerAmount(ledgerAmount);
        report.setAmountDiff(pool.getTeacherPool().subtract(ledgerAmount));
        if (!report.getStillMissing().isEmpty() || report.getAmountDiff().signum() != 0) {
            log.warn("Subscription revenue reconcile mismatch. period={}, teacherPool={}, ledgerAmount={}, diff={}, stillMissing={}",
                    period, pool.getTeacherPool(), ledgerAmount, report.getAmountDiff(), report.getStillMissing());
        }
        return report;
    }
}
