package com.eduhub.learning_backend.modules.earnings.service;

import com.eduhub.learning_backend.modules.earnings.domain.EngagementSummary;
import com.eduhub.learning_backend.modules.earnings.domain.TeacherShare;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RevenueShareAllocatorTest {

    private static final BigDecimal FEE_RATE = new BigDecimal("0.30");

    private final RevenueShareAllocator allocator = new RevenueShareAllocator();

    @Test
    void sharesShouldBeProportionalToWatchTime() {
        EngagementSummary summary = new EngagementSummary(40L, 3,
                Map.of("teacher-a", 30L, "teacher-b", 10L),
                Map.of("teacher-a", 2, "teacher-b", 1), 0);

        List<TeacherShare> shares = allocator.allocate(new BigDecimal("8.4"), FEE_RATE, summary);

        assertThat(shares).hasSize(2);
        TeacherShare a = shares.get(0);
        TeacherShare b = shares.get(1);
        assertThat(a.teacherId()).isEqualTo("teacher-a");
        assertThat(a.amount()).isEqualByComparingTo("6.3");
        assertThat(a.engagedStudents()).isEqualTo(2);
        assertThat(b.teacherId()).isEqualTo("teacher-b");
        assertThat(b.amount()).isEqualByComparingTo("2.1");
    }

    @Test
    void roundingResidueShouldBeFoldedIntoLastTeacher() {
        Map<String, Long> watch = new LinkedHashMap<>();
        watch.put("t1", 1L);
        watch.put("t2", 1L);
        watch.put("t3", 1L);
        EngagementSummary summary = new EngagementSummary(3L, 0, watch, Map.of(), 0);

        List<TeacherShare> shares = allocator.allocate(new BigDecimal("10"), FEE_RATE, summary);

        BigDecimal sum = shares.stream().map(TeacherShare::amount).reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(sum).isEqualByComparingTo("10");
        assertThat(shares.get(0).amount()).isEqualByComparingTo("3.33333333");
        assertThat(shares.get(2).amount()).isEqualByComparingTo("3.33333334");
    }

    @Test
    void netAndFeeShouldSplitEveryShare() {
        EngagementSummary summary = new EngagementSummary(7L, 0, Map.of("t1", 3L, "t2", 4L), Map.of(), 0);

        for (TeacherShare share : allocator.allocate(new BigDecimal("12.34"), FEE_RATE, summary)) {
            assertThat(share.platformFeeAmount().add(share.netAmount())).isEqualByComparingTo(share.amount());
            assertThat(share.netAmount().subtract(share.amount().multiply(new BigDecimal("0.70"))).abs())
                    .isLessThanOrEqualTo(new BigDecimal("0.000001"));
        }
    }

    @Test
    void teachersWithoutWatchTimeGetNoShare() {
        EngagementSummary summary = new EngagementSummary(20L, 1, Map.of("t1", 20L, "t2", 0L), Map.of("t2", 1), 0);

        List<TeacherShare> shares = allocator.allocate(new BigDecimal("5"), FEE_RATE, summary);

        assertThat(shares).extracting(TeacherShare::teacherId).containsExactly("t1");
        assertThat(shares.get(0).amount()).isEqualByComparingTo("5");
    }

    @Test
    void unresolvedWatchTimeIsNotRedistributed() {
        // 总时长 40 中有 10 分钟无法归属讲师，这部分收益不分给其他讲师
        EngagementSummary summary = new EngagementSummary(40L, 0, Map.of("t1", 30L), Map.of(), 1);

        List<TeacherShare> shares = allocator.allocate(new BigDecimal("8.4"), FEE_RATE, summary);

        assertThat(shares).hasSize(1);
        assertThat(shares.get(0).amount()).isEqualByComparingTo("6.3");
    }

    @Test
    void emptyPoolOrNoWatchTimeYieldsNothing() {
        EngagementSummary summary = new EngagementSummary(10L, 0, Map.of("t1", 10L), Map.of(), 0);

        assertThat(allocator.allocate(BigDecimal.ZERO, FEE_RATE, summary)).isEmpty();
        assertThat(allocator.allocate(new BigDecimal("5"), FEE_RATE, EngagementSummary.empty())).isEmpty();
    }
}
