package com.eduhub.learning_backend.modules.earnings.service;

import com.eduhub.learning_backend.modules.earnings.domain.Period;
import com.eduhub.learning_backend.modules.earnings.entity.SubscriptionRevenuePool;

public interface RevenuePoolCalculator {

    /**
     * 计算并持久化账期收益池（status=CALCULATING）。
     *
     * @throws com.eduhub.learning_backend.modules.earnings.exception.DoubleDistributionException 账期已分配
     */
    SubscriptionRevenuePool calculatePool(Period period);
}
