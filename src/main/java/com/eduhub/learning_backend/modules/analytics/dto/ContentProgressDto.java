package com.eduhub.learning_backend.modules.analytics.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
@Schema(description = "上报完成进度 / Completion progress report")
public class ContentProgressDto extends ContentRefDto {

    @NotNull(message = "percent 不能为空")
    @Schema(description = "完成百分比，超出 [0,100] 会被截断 / Completion percent, clamped to [0,100]", example = "80")
    private Integer percent;
}
