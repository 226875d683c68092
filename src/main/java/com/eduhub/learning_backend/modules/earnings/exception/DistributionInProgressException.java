package com.eduhub.learning_backend.modules.earnings.exception;

import com.eduhub.learning_backend.common.exception.BizException;

public class DistributionInProgressException extends BizException {

    private final String period;

    public DistributionInProgressException(String period) {
        super(409, "账期 " + period + " 的订阅收益正在分配中，请稍后再试");
        this.period = period;
    }

    public String getPeriod() {
        return period;
    }
}
