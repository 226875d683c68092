package com.eduhub.learning_backend.modules.earnings.service;

import com.eduhub.learning_backend.modules.earnings.config.RevenueProperties;
import com.eduhub.learning_backend.modules.earnings.domain.TeacherShare;
import com.eduhub.learning_backend.modules.earnings.entity.SubscriptionRevenuePool;
import com.eduhub.learning_backend.modules.earnings.entity.TeacherEarnings;
import com.eduhub.learning_backend.modules.earnings.enums.EarningsStatus;
import com.eduhub.learning_backend.modules.earnings.enums.RevenueSource;
import com.eduhub.learning_backend.modules.earnings.mapper.TeacherEarningsMapper;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 讲师收益流水写入。所有写入均为幂等插入，依赖唯一键 (teacher_id, revenue_source, source_id)。
 */
@Service
public class TeacherEarningsLedgerService {

    private final TeacherEarningsMapper earningsMapper;
    private final RevenueProperties revenueProperties;
    private final Clock clock;

    public TeacherEarningsLedgerService(TeacherEarningsMapper earningsMapper,
                                        RevenueProperties revenueProperties,
                                        Clock clock) {
        this.earningsMapper = earningsMapper;
        this.revenueProperties = revenueProperties;
        this.clock = clock;
    }

    /**
     * 记录订阅收益池分成（source_id = 账期）。
     *
     * @return true 表示新写入，false 表示该讲师该账期已有记录
     */
    public boolean recordSubscriptionShare(SubscriptionRevenuePool pool, TeacherShare share) {
        TeacherEarnings entry = newEntry(share.teacherId(), RevenueSource.SUBSCRIPTION, pool.getPeriod());
        entry.setPeriod(pool.getPeriod());
        entry.setDescription("Subscription revenue share for " + pool.getPeriod());
        entry.setAmount(share.amount());
        entry.setPlatformFeeAmount(share.platformFeeAmount());
        entry.setNetAmount(share.netAmount());
        entry.setWatchTimeMinutes(share.watchTimeMinutes());
        entry.setEngagedStudents(share.engagedStudents());
        entry.setRevenuePoolId(pool.getId());
        return earningsMapper.insertIgnore(entry) > 0;
    }

    /**
     * 记录付费内容销售（source_id = 支付单号）。
     *
     * @return true 表示新写入，false 表示该支付单已入账
     */
    public boolean recordContentSale(TeacherEarnings entry) {
        return earningsMapper.insertIgnore(entry) > 0;
    }

    public TeacherEarnings newEntry(String teacherId, RevenueSource source, String sourceId) {
        TeacherEarnings entry = new TeacherEarnings();
        entry.setId(UUID.randomUUID().toString());
        entry.setTeacherId(teacherId);
        entry.setRevenueSource(source);
        entry.setSourceId(sourceId);
        entry.setCurrency(revenueProperties.getCurrency());
        entry.setStatus(EarningsStatus.AVAILABLE);
        entry.setCreatedTime(LocalDateTime.now(clock));
        entry.setWatchTimeMinutes(0L);
        entry.setEngagedStudents(0);
        entry.setPlatformFeeAmount(BigDecimal.ZERO);
        return entry;
    }
}
