package com.eduhub.learning_backend.modules.analytics.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
@Schema(description = "上报观看时长 / Watch time report")
public class TrackWatchTimeDto extends ContentRefDto {

    @NotNull(message = "minutes 不能为空")
    @Min(value = 1, message = "minutes 必须大于0")
    @Max(value = 1440, message = "单次上报不超过 1440 分钟")
    @Schema(description = "本次新增观看分钟数 / Minutes watched since the last report", example = "12")
    private Integer minutes;
}
