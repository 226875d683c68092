package com.eduhub.learning_backend.modules.earnings.service.impl;

import com.eduhub.learning_backend.modules.analytics.dto.EngagementOwnerRow;
import com.eduhub.learning_backend.modules.analytics.mapper.StudentEngagementMapper;
import com.eduhub.learning_backend.modules.earnings.domain.EngagementSummary;
import com.eduhub.learning_backend.modules.earnings.domain.Period;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EngagementAggregatorImplTest {

    @Mock
    private StudentEngagementMapper engagementMapper;

    @InjectMocks
    private EngagementAggregatorImpl aggregator;

    @Test
    void shouldAccumulatePerTeacherAcrossProgramAndModuleContent() {
        when(engagementMapper.findByPeriodWithOwner("2025-03")).thenReturn(List.of(
                programRow(1L, "p1", "teacher-a", 20, false),
                moduleRow(2L, "m1", "teacher-a", 10, true),
                moduleRow(3L, "m2", "teacher-b", 10, false)
        ));

        EngagementSummary summary = aggregator.aggregate(Period.parse("2025-03"));

        assertThat(summary.totalWatchTime()).isEqualTo(40L);
        assertThat(summary.totalCompleted()).isEqualTo(1);
        assertThat(summary.watchTimeOf("teacher-a")).isEqualTo(30L);
        assertThat(summary.watchTimeOf("teacher-b")).isEqualTo(10L);
        assertThat(summary.completedCountOf("teacher-a")).isEqualTo(1);
        assertThat(summary.completedCountOf("teacher-b")).isZero();
        assertThat(summary.perTeacherWatchTime()).hasSize(2);
    }

    @Test
    void zeroMinuteCompletedRecordCountsOnlyTowardCompletion() {
        when(engagementMapper.findByPeriodWithOwner("2025-03")).thenReturn(List.of(
                programRow(1L, "p1", "teacher-a", 0, true)
        ));

        EngagementSummary summary = aggregator.aggregate(Period.parse("2025-03"));

        assertThat(summary.totalWatchTime()).isZero();
        assertThat(summary.totalCompleted()).isEqualTo(1);
        assertThat(summary.completedCountOf("teacher-a")).isEqualTo(1);
    }

    @Test
    void unresolvedRecordsAreSkippedButStillInTotals() {
        EngagementOwnerRow orphan = programRow(9L, "p-deleted", null, 15, true);
        when(engagementMapper.findByPeriodWithOwner("2025-03")).thenReturn(List.of(
                orphan,
                moduleRow(2L, "m1", "teacher-b", 5, false)
        ));

        EngagementSummary summary = aggregator.aggregate(Period.parse("2025-03"));

        assertThat(summary.unresolvedRecords()).isEqualTo(1);
        assertThat(summary.totalWatchTime()).isEqualTo(20L);
        assertThat(summary.totalCompleted()).isEqualTo(1);
        assertThat(summary.perTeacherWatchTime()).containsOnlyKeys("teacher-b");
    }

    @Test
    void recordWithBothReferencesIsAttributedToProgramOwner() {
        EngagementOwnerRow both = programRow(1L, "p1", "teacher-a", 12, false);
        both.setModuleId("m1");
        both.setModuleTeacherId("teacher-b");
        when(engagementMapper.findByPeriodWithOwner("2025-03")).thenReturn(List.of(both));

        EngagementSummary summary = aggregator.aggregate(Period.parse("2025-03"));

        assertThat(summary.perTeacherWatchTime()).containsOnlyKeys("teacher-a");
    }

    @Test
    void programWithoutOwnerFallsBackToModuleOwner() {
        EngagementOwnerRow row = programRow(4L, "p1", null, 25, true);
        row.setModuleId("m1");
        row.setModuleTeacherId("teacher-b");
        when(engagementMapper.findByPeriodWithOwner("2025-03")).thenReturn(List.of(row));

        EngagementSummary summary = aggregator.aggregate(Period.parse("2025-03"));

        assertThat(summary.perTeacherWatchTime()).containsEntry("teacher-b", 25L);
        assertThat(summary.completedCountOf("teacher-b")).isEqualTo(1);
        assertThat(summary.unresolvedRecords()).isZero();
    }

    @Test
    void emptyPeriodYieldsEmptySummary() {
        when(engagementMapper.findByPeriodWithOwner("2025-03")).thenReturn(List.of());

        EngagementSummary summary = aggregator.aggregate(Period.parse("2025-03"));

        assertThat(summary.totalWatchTime()).isZero();
        assertThat(summary.perTeacherWatchTime()).isEmpty();
    }

    private static EngagementOwnerRow programRow(Long id, String programId, String teacherId, int minutes, boolean completed) {
        EngagementOwnerRow row = new EngagementOwnerRow();
        row.setEngagementId(id);
        row.setProgramId(programId);
        row.setProgramTeacherId(teacherId);
        row.setWatchTimeMinutes(minutes);
        row.setCompleted(completed);
        return row;
    }

    private static EngagementOwnerRow moduleRow(Long id, String moduleId, String teacherId, int minutes, boolean completed) {
        EngagementOwnerRow row = new EngagementOwnerRow();
        row.setEngagementId(id);
        row.setModuleId(moduleId);
        row.setModuleTeacherId(teacherId);
        row.setWatchTimeMinutes(minutes);
        row.setCompleted(completed);
        return row;
    }
}
