package com.eduhub.learning_backend.modules.earnings.service;

import com.eduhub.learning_backend.modules.earnings.domain.EngagementSummary;
import com.eduhub.learning_backend.modules.earnings.domain.Period;

/**
 * 汇总一个账期的学习行为（只读）。
 */
public interface EngagementAggregator {

    EngagementSummary aggregate(Period period);
}
