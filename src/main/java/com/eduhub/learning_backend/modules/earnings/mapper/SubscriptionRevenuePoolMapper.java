package com.eduhub.learning_backend.modules.earnings.mapper;

import com.eduhub.learning_backend.modules.earnings.entity.SubscriptionRevenuePool;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * MyBatis mapper：subscription_revenue_pool 表。
 */
@Mapper
public interface SubscriptionRevenuePoolMapper {

    Optional<SubscriptionRevenuePool> selectByPeriod(@Param("period") String period);

    /**
     * 按 period 唯一键写入计算结果（status=CALCULATING）。
     * 已是 DISTRIBUTED 的行不会被改写：此时返回的影响行数为 0。
     */
    int upsertCalculating(SubscriptionRevenuePool pool);

    /**
     * CAS：仅当 status=CALCULATING 且 version 匹配时置为 DISTRIBUTED。
     *
     * @return 1 表示本次完成状态迁移，0 表示并发下已被他人迁移或版本变化
     */
    int markDistributed(@Param("id") String id,
                        @Param("version") Integer version,
                        @Param("distributedAt") LocalDateTime distributedAt);

    Optional<SubscriptionRevenuePool> selectLastDistributed();

    long countAll();

    List<SubscriptionRevenuePool> findPaginated(@Param("offset") long offset, @Param("size") int size);
}
