package com.eduhub.learning_backend.modules.earnings.exception;

import com.eduhub.learning_backend.common.exception.BizException;

/**
 * 账期收益池已是 DISTRIBUTED，拒绝重新计算或再次分配。
 */
public class DoubleDistributionException extends BizException {

    private final String period;

    public DoubleDistributionException(String period) {
        super(409, "账期 " + period + " 的订阅收益已分配，不能重复分配");
        this.period = period;
    }

    public String getPeriod() {
        return period;
    }
}
