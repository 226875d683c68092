package com.eduhub.learning_backend.modules.subscription.mapper;

import com.eduhub.learning_backend.modules.course.enums.ContentType;
import com.eduhub.learning_backend.modules.subscription.entity.SubscriptionAccess;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Mapper
public interface SubscriptionAccessMapper {

    /**
     * 命中唯一键时刷新 access_type / expires_at。
     */
    int upsert(SubscriptionAccess access);

    Optional<SubscriptionAccess> selectOne(@Param("userId") String userId,
                                           @Param("contentType") ContentType contentType,
                                           @Param("contentId") String contentId);

    /**
     * 删除指定用户中已过期或未设置过期时间的授权。
     */
    int deleteExpired(@Param("userIds") List<String> userIds, @Param("now") LocalDateTime now);

    List<SubscriptionAccess> findActiveByUser(@Param("userId") String userId, @Param("now") LocalDateTime now);
}
