package com.eduhub.learning_backend.modules.subscription.vo;

import com.eduhub.learning_backend.modules.course.enums.ContentType;
import com.eduhub.learning_backend.modules.subscription.enums.AccessType;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@Schema(description = "可访问的订阅内容 / Content accessible through the subscription")
public class AccessibleContentVo {
    private ContentType contentType;
    private String contentId;
    private String title;
    private String thumbnailUrl;
    private AccessType accessType;
    private LocalDateTime grantedAt;
    private LocalDateTime expiresAt;
}
