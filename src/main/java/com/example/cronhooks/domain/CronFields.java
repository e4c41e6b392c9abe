package com.example.cronhooks.domain;

import com.example.cronhooks.error.InvalidCronException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.springframework.scheduling.support.CronExpression;

import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * The five standard cron fields: minute, hour, day-of-month, month, day-of-week.
 * No seconds field and no macros ({@code @daily} etc.).
 */
@Getter
@EqualsAndHashCode
public final class CronFields {
    private final String minute;
    private final String hour;
    private final String dayOfMonth;
    private final String month;
    private final String dayOfWeek;

    @EqualsAndHashCode.Exclude
    private final CronExpression expression;

    public CronFields(String minute, String hour, String dayOfMonth, String month, String dayOfWeek) {
        this.minute = minute;
        this.hour = hour;
        this.dayOfMonth = dayOfMonth;
        this.month = month;
        this.dayOfWeek = dayOfWeek;
        this.expression = compile(toString());
    }

    public static CronFields parse(String expression) {
        String expr = expression == null ? "" : expression.trim();
        if (expr.isEmpty()) {
            throw new InvalidCronException(String.valueOf(expression), "expression is required");
        }
        String[] parts = expr.split("\\s+");
        if (parts.length != 5) {
            throw new InvalidCronException(expr, "expected 5 fields (minute hour day-of-month month day-of-week), got " + parts.length);
        }
        for (String p : parts) {
            if (p.startsWith("@")) {
                throw new InvalidCronException(expr, "macros are not supported");
            }
        }
        return new CronFields(parts[0], parts[1], parts[2], parts[3], parts[4]);
    }

    /**
     * Next matching wall-clock time strictly after {@code after}, evaluated in {@code zone}. Null if none.
     */
    public ZonedDateTime next(ZonedDateTime after, ZoneId zone) {
        return expression.next(after.withZoneSameInstant(zone));
    }

    @Override
    public String toString() {
        return minute + " " + hour + " " + dayOfMonth + " " + month + " " + dayOfWeek;
    }

    private static CronExpression compile(String fiveFields) {
        try {
            // Spring 的 CronExpression 是 6 段（带秒），秒固定为 0
            return CronExpression.parse("0 " + fiveFields);
        } catch (IllegalArgumentException e) {
            throw new InvalidCronException(fiveFields, e);
        }
    }
}
