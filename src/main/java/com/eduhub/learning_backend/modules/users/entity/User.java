package com.eduhub.learning_backend.modules.users.entity;

import com.eduhub.learning_backend.modules.users.enums.UserSubscriptionStatus;
import lombok.Data;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * 对应表：users
 * 账号注册与登录由外部认证服务负责，本服务只读取角色、状态并维护订阅状态字段。
 */
@Data
public class User implements Serializable {

    private static final long serialVersionUID = 1L;

    private String id;
    private String username;
    private String email;

    /**
     * STUDENT / TEACHER / ADMIN
     */
    private String role;

    /**
     * 1=正常 0=禁用
     */
    private Integer status;

    private UserSubscriptionStatus subscriptionStatus;
    private LocalDateTime subscriptionExpiresAt;
    private LocalDateTime createdTime;

    public boolean isActive() {
        return status == null || status == 1;
    }
}
