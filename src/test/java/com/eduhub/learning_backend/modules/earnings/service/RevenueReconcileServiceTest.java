package com.eduhub.learning_backend.modules.earnings.service;

import com.eduhub.learning_backend.common.exception.BizException;
import com.eduhub.learning_backend.modules.earnings.domain.EngagementSummary;
import com.eduhub.learning_backend.modules.earnings.domain.Period;
import com.eduhub.learning_backend.modules.earnings.domain.TeacherShare;
import com.eduhub.learning_backend.modules.earnings.entity.SubscriptionRevenuePool;
import com.eduhub.learning_backend.modules.earnings.entity.TeacherEarnings;
import com.eduhub.learning_backend.modules.earnings.enums.PoolStatus;
import com.eduhub.learning_backend.modules.earnings.enums.RevenueSource;
import com.eduhub.learning_backend.modules.earnings.mapper.SubscriptionRevenuePoolMapper;
import com.eduhub.learning_backend.modules.earnings.mapper.TeacherEarningsMapper;
import com.eduhub.learning_backend.modules.earnings.vo.ReconcileReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RevenueReconcileServiceTest {

    private static final Period MARCH = Period.parse("2025-03");

    @Mock
    private SubscriptionRevenuePoolMapper poolMapper;
    @Mock
    private TeacherEarningsMapper earningsMapper;
    @Mock
    private EngagementAggregator engagementAggregator;
    @Mock
    private TeacherEarningsLedgerService ledgerService;

    private RevenueReconcileService service;

    @BeforeEach
    void setup() {
        service = new RevenueReconcileService(poolMapper, earningsMapper, engagementAggregator,
                new RevenueShareAllocator(), ledgerService);
    }

    @Test
    void missingTeacherEntryIsRepaired() {
        SubscriptionRevenuePool pool = pool(PoolStatus.DISTRIBUTED);
        when(poolMapper.selectByPeriod("2025-03")).thenReturn(Optional.of(pool));
        when(engagementAggregator.aggregate(MARCH)).thenReturn(new EngagementSummary(40L, 0,
                Map.of("teacher-a", 30L, "teacher-b", 10L), Map.of(), 0));
        when(earningsMapper.findBySourceId(RevenueSource.SUBSCRIPTION, "2025-03"))
                .thenReturn(List.of(entry("teacher-a", "6.3")), List.of(entry("teacher-a", "6.3"), entry("teacher-b", "2.1")));
        when(ledgerService.recordSubscriptionShare(eq(pool), any())).thenReturn(true);

        ReconcileReport report = service.reconcile(MARCH);

        ArgumentCaptor<TeacherShare> captor = ArgumentCaptor.forClass(TeacherShare.class);
        verify(ledgerService).recordSubscriptionShare(eq(pool), captor.capture());
        assertThat(captor.getValue().teacherId()).isEqualTo("teacher-b");
        assertThat(captor.getValue().amount()).isEqualByComparingTo("2.1");
        assertThat(report.getExpectedTeachers()).isEqualTo(2);
        assertThat(report.getExistingEntries()).isEqualTo(1);
        assertThat(report.getRepaired()).isEqualTo(1);
        assertThat(report.getStillMissing()).isEmpty();
        assertThat(report.getLedgerAmount()).isEqualByComparingTo("8.4");
        assertThat(report.getAmountDiff()).isEqualByComparingTo("0");
    }

    @Test
    void failedRepairIsReportedAsStillMissing() {
        SubscriptionRevenuePool pool = pool(PoolStatus.DISTRIBUTED);
        when(poolMapper.selectByPeriod("2025-03")).thenReturn(Optional.of(pool));
        when(engagementAggregator.aggregate(MARCH)).thenReturn(new EngagementSummary(10L, 0,
                Map.of("teacher-a", 10L), Map.of(), 0));
        when(earningsMapper.findBySourceId(RevenueSource.SUBSCRIPTION, "2025-03")).thenReturn(List.of());
        when(ledgerService.recordSubscriptionShare(eq(pool), any())).thenThrow(new IllegalStateException("db"));

        ReconcileReport report = service.reconcile(MARCH);

        assertThat(report.getStillMissing()).containsExactly("teacher-a");
        assertThat(report.getAmountDiff()).isEqualByComparingTo("8.4");
    }

    @Test
    void undistributedPoolCannotBeReconciled() {
        when(poolMapper.selectByPeriod("2025-03")).thenReturn(Optional.of(pool(PoolStatus.CALCULATING)));

        assertThatThrownBy(() -> service.reconcile(MARCH))
                .isInstanceOf(BizException.class)
                .satisfies(e -> assertThat(((BizException) e).getCode()).isEqualTo(409));
        verify(ledgerService, never()).recordSubscriptionShare(any(), any());
    }

    @Test
    void unknownPeriodIsNotFound() {
        when(poolMapper.selectByPeriod("2025-03")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.reconcile(MARCH))
                .isInstanceOf(BizException.class)
                .satisfies(e -> assertThat(((BizException) e).getCode()).isEqualTo(404));
    }

    private static SubscriptionRevenuePool pool(PoolStatus status) {
        SubscriptionRevenuePool pool = new SubscriptionRevenuePool();
        pool.setId("pool-1");
        pool.setPeriod("2025-03");
        pool.setTeacherPool(new BigDecimal("8.40000000"));
        pool.setFeeRate(new BigDecimal("0.30"));
        pool.setStatus(status);
        return pool;
    }

    private static TeacherEarnings entry(String teacherId, String amount) {
        TeacherEarnings entry = new TeacherEarnings();
        entry.setTeacherId(teacherId);
        entry.setRevenueSource(RevenueSource.SUBSCRIPTION);
        entry.setSourceId("2025-03");
        entry.setAmount(new BigDecimal(amount));
        return entry;
    }
}
