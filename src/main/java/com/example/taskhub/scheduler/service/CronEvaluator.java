package com.example.taskhub.scheduler.service;

import com.example.taskhub.scheduler.exception.InvalidCronExpressionException;
import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Standard 5-field cron ({@code minute hour day-of-month month day-of-week}) evaluated in a fixed zone.
 * Syntax is checked here (numbers only, ranges, lists, steps, {@code *}); matching is delegated to
 * Spring's {@link CronExpression} with the seconds field pinned to 0.
 * <p>
 * Day fields are combined with AND: when both day-of-month and day-of-week are restricted, a time
 * must satisfy both. This differs from Vixie/POSIX cron, which fires when either matches, so
 * {@code 0 12 13 * 5} here means "Friday the 13th at noon", not "every 13th and every Friday".
 */
public class CronEvaluator {

    private static final String[] FIELD_NAMES = {"minute", "hour", "day-of-month", "month", "day-of-week"};
    private static final int[] MIN = {0, 0, 1, 1, 0};
    private static final int[] MAX = {59, 23, 31, 12, 6};
    private static final int[] DAYS_IN_MONTH = {0, 31, 29, 31, 30, 31, 30, 31, 31, 30, 31, 30, 31};
    private static final String[] MONTH_NAMES = {"", "January", "February", "March", "April", "May", "June",
            "July", "August", "September", "October", "November", "December"};
    private static final String[] DAY_NAMES = {"Sunday", "Monday", "Tuesday", "Wednesday", "Thursday", "Friday", "Saturday"};

    // a | a-b | * , 可带 /step
    private static final Pattern ITEM = Pattern.compile("(\\*|\\d+(?:-\\d+)?)(?:/(\\d+))?");

    private final ZoneId zone;

    public CronEvaluator(ZoneId zone) {
        this.zone = zone;
    }

    public ZoneId getZone() {
        return zone;
    }

    /**
     * Earliest matching minute strictly after {@code after}.
     */
    public Instant nextFireTime(String cronExpr, Instant after) {
        CronExpression cron = parse(cronExpr);
        ZonedDateTime next = cron.next(after.atZone(zone));
        if (next == null) {
            throw new InvalidCronExpressionException(cronExpr, "expression never fires");
        }
        return next.toInstant();
    }

    public List<Instant> nextFireTimes(String cronExpr, Instant after, int count) {
        if (count <= 0) return Collections.emptyList();
        List<Instant> out = new ArrayList<>(count);
        Instant cursor = after;
        for (int i = 0; i < count; i++) {
            cursor = nextFireTime(cronExpr, cursor);
            out.add(cursor);
        }
        return out;
    }

    /**
     * Checks syntax, ranges and that the expression fires at least once from {@code reference}.
     */
    public void validate(String cronExpr, Instant reference) {
        nextFireTime(cronExpr, reference);
    }

    public String describe(String cronExpr) {
        String[] f = split(cronExpr);
        List<String> parts = new ArrayList<>();

        if ("*".equals(f[0])) parts.add("every minute");
        else if ("0".equals(f[0])) parts.add("at the top of the hour");
        else if (f[0].startsWith("*/")) parts.add("every " + f[0].substring(2) + " minutes");
        else parts.add("at minute " + f[0]);

        if ("*".equals(f[1])) parts.add("of every hour");
        else if ("0".equals(f[1])) parts.add("at midnight");
        else if ("12".equals(f[1])) parts.add("at noon");
        else parts.add("at hour " + f[1]);

        if (!"*".equals(f[2])) parts.add("on day " + f[2]);
        if (!"*".equals(f[3])) parts.add("in " + (isSingle(f[3]) ? MONTH_NAMES[Integer.parseInt(f[3])] : "month " + f[3]));
        if (!"*".equals(f[4])) parts.add("on " + (isSingle(f[4]) ? DAY_NAMES[Integer.parseInt(f[4])] : "day-of-week " + f[4]));
        return String.join(" ", parts);
    }

    CronExpression parse(String cronExpr) {
        String[] fields = split(cronExpr);
        fields[4] = closeOpenSteps(fields[4]);
        try {
            return CronExpression.parse("0 " + String.join(" ", fields));
        } catch (IllegalArgumentException e) {
            throw new InvalidCronExpressionException(cronExpr, e.getMessage());
        }
    }

    private String[] split(String cronExpr) {
        if (cronExpr == null || cronExpr.trim().isEmpty()) {
            throw new InvalidCronExpressionException(String.valueOf(cronExpr), "expression is empty");
        }
        String[] fields = cronExpr.trim().split("\\s+");
        if (fields.length != 5) {
            throw new InvalidCronExpressionException(cronExpr, "expected 5 fields but found " + fields.length);
        }
        for (int i = 0; i < fields.length; i++) {
            checkField(cronExpr, i, fields[i]);
        }
        checkFixedDate(cronExpr, fields[2], fields[3]);
        return fields;
    }

    private static void checkField(String expr, int index, String field) {
        for (String item : field.split(",", -1)) {
            Matcher m = ITEM.matcher(item);
            if (!m.matches()) {
                throw new InvalidCronExpressionException(expr, "invalid " + FIELD_NAMES[index] + " field '" + field + "'");
            }
            String range = m.group(1);
            if (!"*".equals(range)) {
                String[] bounds = range.split("-");
                int lo = parseBounded(expr, index, bounds[0]);
                int hi = bounds.length > 1 ? parseBounded(expr, index, bounds[1]) : lo;
                if (lo > hi) {
                    throw new InvalidCronExpressionException(expr, "invalid range " + range + " in " + FIELD_NAMES[index] + " field");
                }
            }
            if (m.group(2) != null) {
                long step = Long.parseLong(m.group(2));
                if (step < 1 || step > MAX[index] + 1) {
                    throw new InvalidCronExpressionException(expr, "invalid step " + step + " in " + FIELD_NAMES[index] + " field");
                }
            }
        }
    }

    private static int parseBounded(String expr, int index, String text) {
        long v;
        try {
            v = Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new InvalidCronExpressionException(expr, "invalid value '" + text + "' in " + FIELD_NAMES[index] + " field");
        }
        if (v < MIN[index] || v > MAX[index]) {
            throw new InvalidCronExpressionException(expr, "value " + v + " out of range " + MIN[index] + "-" + MAX[index]
                    + " for " + FIELD_NAMES[index] + " field");
        }
        return (int) v;
    }

    // Spring 的 day-of-week 上限是 7（周日），"*/n"、"a/n" 需要显式收在 0-6 内
    private static String closeOpenSteps(String dayOfWeek) {
        List<String> items = new ArrayList<>();
        for (String item : dayOfWeek.split(",")) {
            Matcher m = ITEM.matcher(item);
            if (m.matches() && m.group(2) != null && !m.group(1).contains("-")) {
                String start = "*".equals(m.group(1)) ? "0" : m.group(1);
                items.add(start + "-6/" + m.group(2));
            } else {
                items.add(item);
            }
        }
        return String.join(",", items);
    }

    // 固定的 月+日 组合（如 2 月 30 日）永远不会触发
    private static void checkFixedDate(String expr, String day, String month) {
        if (!isSingle(day) || !isSingle(month)) return;
        int d = Integer.parseInt(day);
        int mo = Integer.parseInt(month);
        if (d > DAYS_IN_MONTH[mo]) {
            throw new InvalidCronExpressionException(expr, MONTH_NAMES[mo] + " has at most " + DAYS_IN_MONTH[mo] + " days");
        }
    }

    private static boolean isSingle(String field) {
        return field.matches("\\d+");
    }
}
