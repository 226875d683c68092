package com.eduhub.learning_backend.modules.earnings.service;

import com.eduhub.learning_backend.common.exception.BizException;
import com.eduhub.learning_backend.modules.course.dto.ContentSaleInfo;
import com.eduhub.learning_backend.modules.course.enums.ContentType;
import com.eduhub.learning_backend.modules.course.mapper.CourseContentMapper;
import com.eduhub.learning_backend.modules.earnings.config.RevenueProperties;
import com.eduhub.learning_backend.modules.earnings.domain.Period;
import com.eduhub.learning_backend.modules.earnings.entity.TeacherEarnings;
import com.eduhub.learning_backend.modules.earnings.enums.EarningsStatus;
import com.eduhub.learning_backend.modules.earnings.enums.RevenueSource;
import com.eduhub.learning_backend.modules.earnings.mapper.TeacherEarningsMapper;
import com.eduhub.learning_backend.modules.earnings.vo.EarningsBreakdownVo;
import com.eduhub.learning_backend.modules.earnings.vo.UpcomingPayoutVo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.List;
import java.util.Objects;

@Service
@Slf4j
public class TeacherEarningsService {

    static final int DEFAULT_HISTORY_LIMIT = 50;
    static final int MAX_HISTORY_LIMIT = 200;
    private static final int MONEY_SCALE = 8;

    private final TeacherEarningsMapper earningsMapper;
    private final TeacherEarningsLedgerService ledgerService;
    private final CourseContentMapper courseContentMapper;
    private final RevenueProperties revenueProperties;
    private final Clock clock;

    public TeacherEarningsService(TeacherEarningsMapper earningsMapper,
                                  TeacherEarningsLedgerService ledgerService,
                                  CourseContentMapper courseContentMapper,
                                  RevenueProperties revenueProperties,
                                  Clock clock) {
        this.earningsMapper = earningsMapper;
        this.ledgerService = ledgerService;
        this.courseContentMapper = courseContentMapper;
        this.revenueProperties = revenueProperties;
        this.clock = clock;
    }

    /**
     * 付费内容销售入账：program 计为 COLLECTION，module 计为 LESSON。
     * 同一支付单重复调用只入账一次。
     */
    @CacheEvict(cacheNames = "teacherEarnings", allEntries = true)
    public TeacherEarnings recordContentSale(ContentType contentType, String contentId, String paymentId) {
        if (contentType == null || !StringUtils.hasText(contentId) || !StringUtils.hasText(paymentId)) {
            throw new BizException("contentType / contentId / paymentId 不能为空");
        }
        ContentSaleInfo sale = courseContentMapper.selectSaleInfo(contentType, contentId)
                .orElseThrow(() -> new BizException(404, "内容不存在: " + contentId));
        if (!StringUtils.hasText(sale.getTeacherId())) {
            throw new BizException(409, "内容没有归属讲师: " + contentId);
        }
        BigDecimal amount = sale.getPrice() == null ? BigDecimal.ZERO : sale.getPrice().setScale(MONEY_SCALE, RoundingMode.HALF_UP);
        BigDecimal fee = amount.multiply(revenueProperties.getPlatformFeeRate()).setScale(MONEY_SCALE, RoundingMode.HALF_UP);

        RevenueSource source = contentType == ContentType.PROGRAM ? RevenueSource.COLLECTION : RevenueSource.LESSON;
        TeacherEarnings entry = ledgerService.newEntry(sale.getTeacherId(), source, paymentId);
        entry.setPeriod(Period.current(clock).key());
        entry.setContentId(contentId);
        entry.setDescription((source == RevenueSource.COLLECTION ? "Program sale: " : "Lesson sale: ") + sale.getTitle());
        entry.setAmount(amount);
        entry.setPlatformFeeAmount(fee);
        entry.setNetAmount(amount.subtract(fee));
        if (ledgerService.recordContentSale(entry)) {
            log.info("Content sale recorded. teacherId={}, source={}, contentId={}, paymentId={}, amount={}",
                    sale.getTeacherId(), source, contentId, paymentId, amount);
        } else {
            log.info("Content sale already recorded, skipped. paymentId={}, source={}", paymentId, source);
        }
        return entry;
    }

    @Cacheable(cacheNames = "teacherEarnings",
            key = "'breakdown:' + #teacherId + ':' + (#period == null ? 'all' : #period)",
            sync = true)
    public EarningsBreakdownVo getEarningsBreakdown(String teacherId, String period) {
        String periodKey = normalizePeriod(period);
        List<TeacherEarnings> entries = earningsMapper.findByTeacher(teacherId, null, periodKey);

        EarningsBreakdownVo vo = new EarningsBreakdownVo();
        vo.setPeriod(periodKey);
        vo.setEntries(entries);
        for (TeacherEarnings entry : entries) {
            BigDecimal net = entry.getNetAmount() == null ? BigDecimal.ZERO : entry.getNetAmount();
            if (entry.getRevenueSource() == null) {
                continue;
            }
            switch (entry.getRevenueSource()) {
                case COLLECTION -> vo.setPremium(vo.getPremium().add(net));
                case SUBSCRIPTION -> vo.setSubscription(vo.getSubscription().add(net));
                case LIVE_WORKSHOP -> vo.setWorkshops(vo.getWorkshops().add(net));
                case LESSON -> vo.setLessons(vo.getLessons().add(net));
            }
            vo.setTotal(vo.getTotal().add(net));
        }
        return vo;
    }

    @Cacheable(cacheNames = "teacherEarnings", key = "'payout:' + #teacherId", sync = true)
    public UpcomingPayoutVo getUpcomingPayout(String teacherId) {
        List<TeacherEarnings> available = earningsMapper.findByTeacherAndStatus(teacherId, EarningsStatus.AVAILABLE);
        UpcomingPayoutVo vo = new UpcomingPayoutVo();
        vo.setAmount(available.stream()
                .map(TeacherEarnings::getNetAmount)
                .filter(Objects::nonNull)
                .reduce(BigDecimal.ZERO, BigDecimal::add));
        vo.setEntryCount(available.size());
        vo.setCurrency(revenueProperties.getCurrency());
        vo.setNextPayoutDate(Period.current(clock).plusMonths(1).yearMonth().atDay(1));
        return vo;
    }

    public List<TeacherEarnings> getEarningsBySource(String teacherId, RevenueSource source, String period) {
        if (source == null) {
            throw new BizException("source 不能为空");
        }
        return earningsMapper.findByTeacher(teacherId, source, normalizePeriod(period));
    }

    public List<TeacherEarnings> getEarningsHistory(String teacherId, Integer limit) {
        int effective = limit == null ? DEFAULT_HISTORY_LIMIT : limit;
        if (effective < 1 || effective > MAX_HISTORY_LIMIT) {
            throw new BizException("limit 取值范围为 1-" + MAX_HISTORY_LIMIT);
        }
        return earningsMapper.findRecentByTeacher(teacherId, effective);
    }

    private String normalizePeriod(String period) {
        return StringUtils.hasText(period) ? Period.parse(period).key() : null;
    }
}
