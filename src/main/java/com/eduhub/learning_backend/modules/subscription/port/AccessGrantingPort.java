package com.eduhub.learning_backend.modules.subscription.port;

import com.eduhub.learning_backend.modules.course.enums.ContentType;
import com.eduhub.learning_backend.modules.subscription.enums.AccessType;

import java.time.LocalDateTime;

/**
 * 内容访问授权端口。订阅激活只依赖该接口，具体实现由容器注入。
 */
public interface AccessGrantingPort {

    /**
     * 授予（或刷新）用户对某个内容的访问权。
     *
     * @param expiresAt 为空时沿用订阅到期时间
     */
    void grantAccess(String userId, ContentType contentType, String contentId,
                     AccessType accessType, LocalDateTime expiresAt);
}
