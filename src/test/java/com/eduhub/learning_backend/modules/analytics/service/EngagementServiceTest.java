package com.eduhub.learning_backend.modules.analytics.service;

import com.eduhub.learning_backend.common.exception.BizException;
import com.eduhub.learning_backend.modules.analytics.entity.StudentEngagement;
import com.eduhub.learning_backend.modules.analytics.mapper.StudentEngagementMapper;
import com.eduhub.learning_backend.modules.course.enums.ContentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EngagementServiceTest {

    @Mock
    private StudentEngagementMapper engagementMapper;

    private EngagementService service;

    @BeforeEach
    void setup() {
        // 月末最后一秒，仍属于 2025-03
        Clock clock = Clock.fixed(Instant.parse("2025-03-31T23:59:59Z"), ZoneOffset.UTC);
        service = new EngagementService(engagementMapper, clock);
    }

    @Test
    void watchTimeIsWrittenToCurrentUtcPeriod() {
        when(engagementMapper.selectByContentKey("student-1", "2025-03", "PROGRAM:prog-1"))
                .thenReturn(Optional.of(new StudentEngagement()));

        service.trackWatchTime("student-1", "prog-1", ContentType.PROGRAM, 15);

        ArgumentCaptor<StudentEngagement> captor = ArgumentCaptor.forClass(StudentEngagement.class);
        verify(engagementMapper).upsertWatchTime(captor.capture());
        StudentEngagement row = captor.getValue();
        assertThat(row.getPeriod()).isEqualTo("2025-03");
        assertThat(row.getProgramId()).isEqualTo("prog-1");
        assertThat(row.getModuleId()).isNull();
        assertThat(row.getWatchTimeMinutes()).isEqualTo(15);
    }

    @Test
    void nonPositiveWatchTimeIsRejected() {
        assertThatThrownBy(() -> service.trackWatchTime("student-1", "prog-1", ContentType.PROGRAM, 0))
                .isInstanceOf(BizException.class);
        verifyNoInteractions(engagementMapper);
    }

    @Test
    void completionPercentIsClampedAndMarksCompletedAtHundred() {
        when(engagementMapper.selectByContentKey(anyString(), anyString(), anyString()))
                .thenReturn(Optional.of(new StudentEngagement()));

        service.updateCompletionPercent("student-1", "mod-1", ContentType.MODULE, 140);

        ArgumentCaptor<StudentEngagement> captor = ArgumentCaptor.forClass(StudentEngagement.class);
        verify(engagementMapper).upsertCompletionPercent(captor.capture());
        StudentEngagement row = captor.getValue();
        assertThat(row.getModuleId()).isEqualTo("mod-1");
        assertThat(row.getContentKey()).isEqualTo("MODULE:mod-1");
        assertThat(row.getCompletionPercent()).isEqualTo(100);
        assertThat(row.getCompleted()).isTrue();
        assertThat(row.getCompletedAt()).isNotNull();
    }

    @Test
    void negativeCompletionPercentIsClampedToZero() {
        when(engagementMapper.selectByContentKey(anyString(), anyString(), anyString()))
                .thenReturn(Optional.of(new StudentEngagement()));

        service.updateCompletionPercent("student-1", "mod-1", ContentType.MODULE, -5);

        ArgumentCaptor<StudentEngagement> captor = ArgumentCaptor.forClass(StudentEngagement.class);
        verify(engagementMapper).upsertCompletionPercent(captor.capture());
        assertThat(captor.getValue().getCompletionPercent()).isZero();
        assertThat(captor.getValue().getCompleted()).isFalse();
    }

    @Test
    void missingRowAfterUpsertFails() {
        when(engagementMapper.selectByContentKey(anyString(), anyString(), anyString())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.markCompleted("student-1", "prog-1", ContentType.PROGRAM))
                .isInstanceOf(IllegalStateException.class);
        verify(engagementMapper).upsertCompleted(any());
    }
}
