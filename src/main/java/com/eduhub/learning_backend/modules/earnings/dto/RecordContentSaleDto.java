package com.eduhub.learning_backend.modules.earnings.dto;

import com.eduhub.learning_backend.modules.course.enums.ContentType;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
@Schema(description = "付费内容销售入账 / Record a paid content sale")
public class RecordContentSaleDto {

    @NotNull
    @Schema(description = "内容类型 / Content type", example = "PROGRAM")
    private ContentType contentType;

    @NotBlank
    private String contentId;

    @NotBlank
    @Schema(description = "支付单号，用于幂等 / Payment id, idempotency key")
    private String paymentId;
}
