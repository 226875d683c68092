package com.eduhub.learning_backend.modules.earnings.service.impl;

import com.eduhub.learning_backend.modules.earnings.config.RevenueProperties;
import com.eduhub.learning_backend.modules.earnings.domain.EngagementSummary;
import com.eduhub.learning_backend.modules.earnings.domain.Period;
import com.eduhub.learning_backend.modules.earnings.entity.SubscriptionRevenuePool;
import com.eduhub.learning_backend.modules.earnings.enums.PoolStatus;
import com.eduhub.learning_backend.modules.earnings.exception.DoubleDistributionException;
import com.eduhub.learning_backend.modules.earnings.mapper.SubscriptionRevenuePoolMapper;
import com.eduhub.learning_backend.modules.earnings.service.EngagementAggregator;
import com.eduhub.learning_backend.modules.subscription.mapper.SubscriptionMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RevenuePoolCalculatorImplTest {

    private static final Period MARCH = Period.parse("2025-03");

    @Mock
    private SubscriptionMapper subscriptionMapper;
    @Mock
    private SubscriptionRevenuePoolMapper poolMapper;
    @Mock
    private EngagementAggregator engagementAggregator;

    @Captor
    private ArgumentCaptor<SubscriptionRevenuePool> poolCaptor;

    private RevenuePoolCalculatorImpl calculator;

    @BeforeEach
    void setup() {
        Clock clock = Clock.fixed(Instant.parse("2025-04-01T02:00:00Z"), ZoneOffset.UTC);
        calculator = new RevenuePoolCalculatorImpl(subscriptionMapper, poolMapper, engagementAggregator,
                new RevenueProperties(), clock);
    }

    @Test
    void shouldSplitRevenueAndPersistCalculatingPool() {
        when(subscriptionMapper.sumCompletedAmountOverlapping(
                LocalDateTime.of(2025, 3, 1, 0, 0, 0), LocalDateTime.of(2025, 3, 31, 23, 59, 59)))
                .thenReturn(new BigDecimal("12.00"));
        when(engagementAggregator.aggregate(MARCH))
                .thenReturn(new EngagementSummary(40L, 2, Map.of("a", 30L, "b", 10L), Map.of(), 0));
        when(poolMapper.selectByPeriod("2025-03")).thenReturn(Optional.empty(), Optional.of(stored(PoolStatus.CALCULATING)));

        SubscriptionRevenuePool pool = calculator.calculatePool(MARCH);

        verify(poolMapper).upsertCalculating(poolCaptor.capture());
        SubscriptionRevenuePool written = poolCaptor.getValue();
        assertThat(written.getTotalRevenue()).isEqualByComparingTo("12");
        assertThat(written.getPlatformFee()).isEqualByComparingTo("3.6");
        assertThat(written.getTeacherPool()).isEqualByComparingTo("8.4");
        assertThat(written.getPlatformFee().add(written.getTeacherPool())).isEqualByComparingTo(written.getTotalRevenue());
        assertThat(written.getTotalWatchTime()).isEqualTo(40L);
        assertThat(written.getTotalEngagements()).isEqualTo(2);
        assertThat(written.getStatus()).isEqualTo(PoolStatus.CALCULATING);
        assertThat(written.getPeriodStart()).isEqualTo(LocalDateTime.of(2025, 3, 1, 0, 0));
        assertThat(pool.getVersion()).isEqualTo(3);
    }

    @Test
    void recomputingCalculatingPoolReusesItsId() {
        SubscriptionRevenuePool existing = stored(PoolStatus.CALCULATING);
        when(poolMapper.selectByPeriod("2025-03")).thenReturn(Optional.of(existing));
        when(subscriptionMapper.sumCompletedAmountOverlapping(any(), any())).thenReturn(null);
        when(engagementAggregator.aggregate(MARCH)).thenReturn(EngagementSummary.empty());

        calculator.calculatePool(MARCH);

        verify(poolMapper).upsertCalculating(poolCaptor.capture());
        assertThat(poolCaptor.getValue().getId()).isEqualTo("pool-1");
        assertThat(poolCaptor.getValue().getTotalRevenue()).isEqualByComparingTo("0");
    }

    @Test
    void repeatedCalculationOnSameDataIsStable() {
        when(poolMapper.selectByPeriod("2025-03")).thenReturn(Optional.of(stored(PoolStatus.CALCULATING)));
        when(subscriptionMapper.sumCompletedAmountOverlapping(any(), any())).thenReturn(new BigDecimal("12.00"));
        when(engagementAggregator.aggregate(MARCH))
                .thenReturn(new EngagementSummary(40L, 2, Map.of("a", 30L, "b", 10L), Map.of(), 0));

        calculator.calculatePool(MARCH);
        calculator.calculatePool(MARCH);

        verify(poolMapper, times(2)).upsertCalculating(poolCaptor.capture());
        SubscriptionRevenuePool first = poolCaptor.getAllValues().get(0);
        SubscriptionRevenuePool second = poolCaptor.getAllValues().get(1);
        assertThat(second.getId()).isEqualTo(first.getId()).isEqualTo("pool-1");
        assertThat(second.getTotalRevenue()).isEqualByComparingTo(first.getTotalRevenue());
        assertThat(second.getPlatformFee()).isEqualByComparingTo(first.getPlatformFee());
        assertThat(second.getTeacherPool()).isEqualByComparingTo(first.getTeacherPool());
        assertThat(second.getTotalWatchTime()).isEqualTo(first.getTotalWatchTime());
        assertThat(second.getTotalEngagements()).isEqualTo(first.getTotalEngagements());
    }

    @Test
    void distributedPoolMustNotBeRecalculated() {
        when(poolMapper.selectByPeriod("2025-03")).thenReturn(Optional.of(stored(PoolStatus.DISTRIBUTED)));

        assertThatThrownBy(() -> calculator.calculatePool(MARCH))
                .isInstanceOf(DoubleDistributionException.class)
                .satisfies(e -> assertThat(((DoubleDistributionException) e).getCode()).isEqualTo(409));
        verify(poolMapper, never()).upsertCalculating(any());
        verifyNoInteractions(subscriptionMapper, engagementAggregator);
    }

    @Test
    void concurrentDistributionDetectedOnReadBack() {
        when(poolMapper.selectByPeriod("2025-03"))
                .thenReturn(Optional.of(stored(PoolStatus.CALCULATING)), Optional.of(stored(PoolStatus.DISTRIBUTED)));
        when(subscriptionMapper.sumCompletedAmountOverlapping(any(), any())).thenReturn(BigDecimal.TEN);
        when(engagementAggregator.aggregate(MARCH)).thenReturn(EngagementSummary.empty());

        assertThatThrownBy(() -> calculator.calculatePool(MARCH)).isInstanceOf(DoubleDistributionException.class);
        verify(poolMapper, times(1)).upsertCalculating(any());
    }

    @Test
    void persistenceFailurePropagates() {
        when(poolMapper.selectByPeriod("2025-03")).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThatThrownBy(() -> calculator.calculatePool(MARCH)).isInstanceOf(DataAccessResourceFailureException.class);
    }

    private static SubscriptionRevenuePool stored(PoolStatus status) {
        SubscriptionRevenuePool pool = new SubscriptionRevenuePool();
        pool.setId("pool-1");
        pool.setPeriod("2025-03");
        pool.setTotalRevenue(new BigDecimal("12.00000000"));
        pool.setPlatformFee(new BigDecimal("3.60000000"));
        pool.setTeacherPool(new BigDecimal("8.40000000"));
        pool.setFeeRate(new BigDecimal("0.30"));
        pool.setTotalWatchTime(40L);
        pool.setTotalEngagements(2);
        pool.setStatus(status);
        pool.setVersion(3);
        return pool;
    }
}
