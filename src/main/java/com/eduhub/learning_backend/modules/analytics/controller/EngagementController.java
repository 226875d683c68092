package com.eduhub.learning_backend.modules.analytics.controller;

import com.eduhub.learning_backend.common.api.ApiResponse;
import com.eduhub.learning_backend.common.security.CustomUserDetails;
import com.eduhub.learning_backend.modules.analytics.dto.ContentProgressDto;
import com.eduhub.learning_backend.modules.analytics.dto.ContentRefDto;
import com.eduhub.learning_backend.modules.analytics.dto.TrackWatchTimeDto;
import com.eduhub.learning_backend.modules.analytics.entity.StudentEngagement;
import com.eduhub.learning_backend.modules.analytics.service.EngagementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/engagement")
@Tag(name = "学生端/学习记录", description = "上报观看时长与完成进度，作为订阅收益分配的依据")
public class EngagementController {

    private final EngagementService engagementService;

    public EngagementController(EngagementService engagementService) {
        this.engagementService = engagementService;
    }

    @PostMapping("/watch-time")
    @Operation(summary = "上报观看时长", description = "在当前账期内累加观看分钟数；同一内容同一账期只保留一行记录。")
    public ApiResponse<StudentEngagement> trackWatchTime(@Valid @RequestBody TrackWatchTimeDto dto,
                                                         @AuthenticationPrincipal CustomUserDetails userDetails) {
        return ApiResponse.ok(engagementService.trackWatchTime(
                userDetails.getUserId(), dto.getContentId(), dto.getContentType(), dto.getMinutes()));
    }

    @PostMapping("/complete")
    @Operation(summary = "标记内容已完成")
    public ApiResponse<StudentEngagement> markCompleted(@Valid @RequestBody ContentRefDto dto,
                                                        @AuthenticationPrincipal CustomUserDetails userDetails) {
        return ApiResponse.ok(engagementService.markCompleted(
                userDetails.getUserId(), dto.getContentId(), dto.getContentType()));
    }

    @PostMapping("/progress")
    @Operation(summary = "上报完成百分比", description = "百分比截断到 [0,100]；达到 100 时视为完成。")
    public ApiResponse<StudentEngagement> updateProgress(@Valid @RequestBody ContentProgressDto dto,
                                                         @AuthenticationPrincipal CustomUserDetails userDetails) {
        return ApiResponse.ok(engagementService.updateCompletionPercent(
                userDetails.getUserId(), dto.getContentId(), dto.getContentType(), dto.getPercent()));
    }

    @GetMapping("/me")
    @Operation(summary = "查询我的学习记录")
    public ApiResponse<List<StudentEngagement>> myEngagement(
            @Parameter(description = "账期（YYYY-MM），不传返回全部", example = "2025-03")
            @RequestParam(required = false) String period,
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        return ApiResponse.ok(engagementService.getStudentEngagement(userDetails.getUserId(), period));
    }
}
