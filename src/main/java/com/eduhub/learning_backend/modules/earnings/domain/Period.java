package com.eduhub.learning_backend.modules.earnings.domain;

import com.eduhub.learning_backend.common.exception.BizException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 自然月账期，格式 YYYY-MM，边界按 UTC 计算。
 * periodStart 为当月 1 日 00:00:00，periodEnd 为当月最后一天 23:59:59。
 */
public final class Period {

    private static final Pattern FORMAT = Pattern.compile("^(\\d{4})-(0[1-9]|1[0-2])$");

    private final YearMonth yearMonth;

    private Period(YearMonth yearMonth) {
        this.yearMonth = yearMonth;
    }

    public static Period parse(String value) {
        if (value == null) {
            throw new BizException(400, "period 不能为空，格式应为 YYYY-MM");
        }
        Matcher matcher = FORMAT.matcher(value.trim());
        if (!matcher.matches()) {
            throw new BizException(400, "period 格式错误，应为 YYYY-MM: " + value);
        }
        return new Period(YearMonth.of(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2))));
    }

    public static Period of(YearMonth yearMonth) {
        return new Period(Objects.requireNonNull(yearMonth, "yearMonth"));
    }

    public static Period current(Clock clock) {
        return new Period(YearMonth.now(clock.withZone(ZoneOffset.UTC)));
    }

    /**
     * 上一个自然月，月度分配任务的默认目标。
     */
    public static Period previous(Clock clock) {
        return current(clock).minusMonths(1);
    }

    public Period minusMonths(long months) {
        return new Period(yearMonth.minusMonths(months));
    }

    public Period plusMonths(long months) {
        return new Period(yearMonth.plusMonths(months));
    }

    public String key() {
        return yearMonth.toString();
    }

    public YearMonth yearMonth() {
        return yearMonth;
    }

    public LocalDateTime periodStart() {
        return yearMonth.atDay(1).atStartOfDay();
    }

    public LocalDateTime periodEnd() {
        return yearMonth.atEndOfMonth().atTime(LocalTime.of(23, 59, 59));
    }

    /**
     * 下一账期起点（不含），用于半开区间查询。
     */
    public LocalDateTime nextPeriodStart() {
        return yearMonth.plusMonths(1).atDay(1).atStartOfDay();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Period other)) {
            return false;
        }
        return yearMonth.equals(other.yearMonth);
    }

    @Override
    public int hashCode() {
        return yearMonth.hashCode();
    }

    @Override
    public String toString() {
        return key();
    }
}
