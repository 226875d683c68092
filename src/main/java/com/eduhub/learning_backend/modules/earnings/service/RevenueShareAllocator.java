package com.eduhub.learning_backend.modules.earnings.service;

import com.eduhub.learning_backend.modules.earnings.domain.EngagementSummary;
import com.eduhub.learning_backend.modules.earnings.domain.TeacherShare;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 按观看时长比例切分讲师收益池。
 * <p>
 * share_i = teacherPool * watch_i / totalWatchTime。讲师按 teacherId 排序处理，
 * 舍入误差补到最后一位讲师，使 sum(amount) 等于已解析讲师应得的总额
 * （全部记录都能解析到讲师时即等于 teacherPool）。
 */
@Component
public class RevenueShareAllocator {

    static final int MONEY_SCALE = 8;
    static final int RATIO_SCALE = 18;

    public List<TeacherShare> allocate(BigDecimal teacherPool, BigDecimal feeRate, EngagementSummary summary) {
        if (teacherPool == null || teacherPool.signum() <= 0 || summary == null || summary.totalWatchTime() <= 0) {
            return Collections.emptyList();
        }
        BigDecimal totalWatch = BigDecimal.valueOf(summary.totalWatchTime());
        List<Map.Entry<String, Long>> ordered = new ArrayList<>(summary.perTeacherWatchTime().entrySet());
        ordered.sort(Map.Entry.comparingByKey());

        long resolvedWatch = 0L;
        List<Map.Entry<String, Long>> eligible = new ArrayList<>();
        for (Map.Entry<String, Long> entry : ordered) {
            if (entry.getValue() == null || entry.getValue() <= 0) {
                continue;
            }
            resolvedWatch += entry.getValue();
            eligible.add(entry);
        }
        if (eligible.isEmpty()) {
            return Collections.emptyList();
        }
        BigDecimal target = teacherPool.multiply(BigDecimal.valueOf(resolvedWatch))
                .divide(totalWatch, MONEY_SCALE, RoundingMode.HALF_UP);

        List<BigDecimal> amounts = new ArrayList<>(eligible.size());
        List<BigDecimal> ratios = new ArrayList<>(eligible.size());
        BigDecimal allocated = BigDecimal.ZERO;
        for (Map.Entry<String, Long> entry : eligible) {
            BigDecimal ratio = BigDecimal.valueOf(entry.getValue()).divide(totalWatch, RATIO_SCALE, RoundingMode.HALF_UP);
            BigDecimal amount = teacherPool.multiply(ratio).setScale(MONEY_SCALE, RoundingMode.HALF_UP);
            ratios.add(ratio);
            amounts.add(amount);
            allocated = allocated.add(amount);
        }
        BigDecimal diff = target.subtract(allocated);
        if (diff.signum() != 0) {
            int tail = amounts.size() - 1;
            amounts.set(tail, amounts.get(tail).add(diff));
        }

        List<TeacherShare> shares = new ArrayList<>(eligible.size());
        for (int i = 0; i < eligible.size(); i++) {
            BigDecimal amount = amounts.get(i);
            if (amount.signum() <= 0) {
                continue;
            }
            String teacherId = eligible.get(i).getKey();
            BigDecimal fee = amount.multiply(feeRate).setScale(MONEY_SCALE, RoundingMode.HALF_UP);
            shares.add(new TeacherShare(teacherId,
                    eligible.get(i).getValue(),
                    summary.completedCountOf(teacherId),
                    ratios.get(i),
                    amount,
                    fee,
                    amount.subtract(fee)));
        }
        return shares;
    }
}
