package com.eduhub.learning_backend.modules.analytics.dto;

import com.eduhub.learning_backend.modules.course.enums.ContentType;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
@Schema(description = "内容引用 / Content reference")
public class ContentRefDto {

    @NotBlank(message = "contentId 不能为空")
    @Schema(description = "内容 ID / Program or module id", example = "clx0p9prog0001")
    private String contentId;

    @NotNull(message = "contentType 不能为空")
    @Schema(description = "内容类型 / Content type", example = "PROGRAM", allowableValues = {"PROGRAM", "MODULE"})
    private ContentType contentType;
}
