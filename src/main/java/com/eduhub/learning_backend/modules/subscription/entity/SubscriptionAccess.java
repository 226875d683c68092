package com.eduhub.learning_backend.modules.subscription.entity;

import com.eduhub.learning_backend.modules.course.enums.ContentType;
import com.eduhub.learning_backend.modules.subscription.enums.AccessType;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 订阅内容访问授权，唯一键 (user_id, content_type, content_id)。
 */
@Data
public class SubscriptionAccess {
    private String id;
    private String userId;
    private ContentType contentType;
    private String contentId;
    private AccessType accessType;
    private LocalDateTime grantedAt;
    /** 为空表示不过期 */
    private LocalDateTime expiresAt;
}
