package com.eduhub.learning_backend.modules.subscription.mapper;

import com.eduhub.learning_backend.modules.subscription.entity.Subscription;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Mapper
public interface SubscriptionMapper {

    int insert(Subscription subscription);

    Optional<Subscription> selectByUserId(@Param("userId") String userId);

    /**
     * 加行锁读取，供事务内的状态迁移使用。
     */
    Optional<Subscription> selectByUserIdForUpdate(@Param("userId") String userId);

    int activate(@Param("id") String id,
                 @Param("provider") String provider,
                 @Param("transactionId") String transactionId,
                 @Param("startsAt") LocalDateTime startsAt,
                 @Param("expiresAt") LocalDateTime expiresAt);

    int cancel(@Param("id") String id, @Param("cancelledAt") LocalDateTime cancelledAt);

    /**
     * 已生效（COMPLETED）且有效期与 [periodStart, periodEnd] 有交集的订阅金额合计：
     * starts_at &lt;= periodEnd AND expires_at &gt;= periodStart。无记录时返回 0。
     */
    BigDecimal sumCompletedAmountOverlapping(@Param("periodStart") LocalDateTime periodStart,
                                             @Param("periodEnd") LocalDateTime periodEnd);

    /**
     * 已过期（expires_at &lt;= now）但仍为 COMPLETED 的订阅所属用户。
     */
    List<String> findExpiredUserIds(@Param("now") LocalDateTime now);
}
