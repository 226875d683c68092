package com.eduhub.learning_backend.modules.subscription.vo;

import com.eduhub.learning_backend.modules.subscription.entity.Subscription;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@Schema(description = "订阅状态 / Subscription status")
public class SubscriptionStatusVo {

    @Schema(description = "是否生效 / Whether the subscription is active")
    private boolean active;

    @Schema(description = "状态：ACTIVE / INACTIVE / 订阅记录状态", example = "ACTIVE")
    private String status;

    private LocalDateTime expiresAt;

    private Subscription subscription;

    public static SubscriptionStatusVo inactive() {
        SubscriptionStatusVo vo = new SubscriptionStatusVo();
        vo.setActive(false);
        vo.setStatus("INACTIVE");
        return vo;
    }
}
