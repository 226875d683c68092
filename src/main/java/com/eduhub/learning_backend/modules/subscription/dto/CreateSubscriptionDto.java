package com.eduhub.learning_backend.modules.subscription.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
@Schema(description = "创建 / 激活订阅请求 / Create or activate subscription request")
public class CreateSubscriptionDto {

    @NotBlank
    @Size(max = 32)
    @Schema(description = "支付渠道 / Payment provider", example = "STRIPE")
    private String provider;

    @NotBlank
    @Size(max = 128)
    @Schema(description = "支付流水号 / Provider transaction id")
    private String transactionId;
}
