package com.eduhub.learning_backend.modules.users.mapper;

import com.eduhub.learning_backend.modules.users.entity.User;
import com.eduhub.learning_backend.modules.users.enums.UserSubscriptionStatus;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Mapper
public interface UserMapper {

    /**
     * 根据ID查找用户
     *
     * @param id 用户ID
     * @return Optional<User>
     */
    Optional<User> selectById(@Param("id") String id);

    /**
     * 更新单个用户的订阅状态；expiresAt 为 null 时保留原值。
     */
    int updateSubscriptionStatus(@Param("id") String id,
                                 @Param("status") UserSubscriptionStatus status,
                                 @Param("expiresAt") LocalDateTime expiresAt);

    /**
     * 批量更新订阅状态（到期扫描用）。
     */
    int updateSubscriptionStatusByIds(@Param("ids") List<String> ids,
                                      @Param("status") UserSubscriptionStatus status);
}
