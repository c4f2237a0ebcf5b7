package com.example.automation.service.cron;

import com.example.automation.config.AutomationProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Parses 5-field cron expressions ({@code minute hour day-of-month month day-of-week})
 * and projects the next fire time.
 * <p>
 * Supported shapes:
 * <ul>
 *     <li>{@code * * * * *} and {@code *}{@code /N * * * *} (every minute, every N minutes)</li>
 *     <li>{@code M * * * *} (hourly at minute M)</li>
 *     <li>{@code M H dom month dow}, each of the last three either {@code *} or a single value</li>
 * </ul>
 * The projection is advisory: live timers are driven by Spring's {@link CronExpression}.
 * When both day-of-month and day-of-week are fixed only the day-of-week is matched,
 * whereas cron fires when either matches.
 */
@Slf4j
@Component
public class CronExpressionEvaluator {

    private static final String ANY = "*";
    private static final String STEP_PREFIX = "*/";
    private static final int ANY_VALUE = -1;
    private static final int MAX_LOOKAHEAD_DAYS = 366 * 5;

    private final ZoneId zoneId;

    @Autowired
    public CronExpressionEvaluator(AutomationProperties properties) {
        this(properties.getZoneId());
    }

    public CronExpressionEvaluator(ZoneId zoneId) {
        this.zoneId = zoneId;
    }

    public ZoneId getZoneId() {
        return zoneId;
    }

    /**
     * Check that the expression is understood both by this evaluator and by the live timer
     */
    public boolean isValid(String expression) {
        if (parse(expression) == null) {
            return false;
        }
        return CronExpression.isValidExpression(toSpringExpression(expression));
    }

    /**
     * Convert to Spring's 6-field form (seconds first)
     */
    public String toSpringExpression(String expression) {
        return "0 " + expression.trim();
    }

    /**
     * Next instant strictly after {@code from} matching the expression.
     *
     * @return the next fire time, or {@code null} if the expression is malformed or never fires
     */
    public Instant nextRun(String expression, Instant from) {
        var cron = parse(expression);
        if (cron == null) {
            log.debug("Cannot project next run for unsupported expression '{}'", expression);
            return null;
        }

        var now = from.atZone(zoneId);
        if (cron.getShape() == Shape.EVERY_MINUTE) {
            return now.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1).toInstant();
        }
        if (cron.getShape() == Shape.MINUTE_STEP) {
            return nextStep(now, cron.getMinute());
        }
        if (cron.getShape() == Shape.HOURLY) {
            return nextHourly(now, cron.getMinute());
        }
        return nextDaily(now, cron);
    }

    private Instant nextStep(ZonedDateTime now, int step) {
        var hourStart = now.truncatedTo(ChronoUnit.HOURS);
        var nextMinute = (now.getMinute() / step + 1) * step;
        if (nextMinute > 59) {
            return hourStart.plusHours(1).toInstant();
        }
        return hourStart.plusMinutes(nextMinute).toInstant();
    }

    private Instant nextHourly(ZonedDateTime now, int minute) {
        var candidate = now.truncatedTo(ChronoUnit.HOURS).plusMinutes(minute);
        if (!candidate.isAfter(now)) {
            candidate = candidate.plusHours(1);
        }
        return candidate.toInstant();
    }

    private Instant nextDaily(ZonedDateTime now, ParsedCron cron) {
        var time = LocalTime.of(cron.getHour(), cron.getMinute());
        var date = now.toLocalDate();

        for (var i = 0; i <= MAX_LOOKAHEAD_DAYS; i++, date = date.plusDays(1)) {
            if (!matchesDay(date, cron)) {
                continue;
            }
            var candidate = ZonedDateTime.of(date, time, zoneId);
            if (candidate.isAfter(now)) {
                return candidate.toInstant();
            }
        }
        return null;
    }

    private boolean matchesDay(LocalDate date, ParsedCron cron) {
        if (cron.getMonth() != null && date.getMonthValue() != cron.getMonth()) {
            return false;
        }
        if (cron.getDayOfWeek() != null) {
            // cron counts Sunday as 0 (or 7)
            return date.getDayOfWeek().getValue() % 7 == cron.getDayOfWeek() % 7;
        }
        return cron.getDayOfMonth() == null || date.getDayOfMonth() == cron.getDayOfMonth();
    }

    // === Parsing ===

    ParsedCron parse(String expression) {
        if (expression == null || expression.isBlank()) {
            return null;
        }
        var fields = expression.trim().split("\\s+");
        if (fields.length != 5) {
            return null;
        }

        var dayOfMonth = parseField(fields[2], 1, 31);
        var month = parseField(fields[3], 1, 12);
        var dayOfWeek = parseField(fields[4], 0, 7);
        if (dayOfMonth == null || month == null || dayOfWeek == null) {
            return null;
        }
        var daysUnconstrained = dayOfMonth == ANY_VALUE && month == ANY_VALUE && dayOfWeek == ANY_VALUE;

        var minuteField = fields[0];
        var hourField = fields[1];

        if (ANY.equals(minuteField) || minuteField.startsWith(STEP_PREFIX)) {
            if (!ANY.equals(hourField) || !daysUnconstrained) {
                return null;
            }
            if (ANY.equals(minuteField)) {
                return ParsedCron.builder().shape(Shape.EVERY_MINUTE).minute(1).build();
            }
            var step = parseValue(minuteField.substring(STEP_PREFIX.length()), 1, 59);
            return step == null ? null : ParsedCron.builder().shape(Shape.MINUTE_STEP).minute(step).build();
        }

        var minute = parseValue(minuteField, 0, 59);
        if (minute == null) {
            return null;
        }
        if (ANY.equals(hourField)) {
            return daysUnconstrained ? ParsedCron.builder().shape(Shape.HOURLY).minute(minute).build() : null;
        }
        var hour = parseValue(hourField, 0, 23);
        if (hour == null) {
            return null;
        }
        return ParsedCron.builder()
                .shape(Shape.DAILY)
                .minute(minute)
                .hour(hour)
                .dayOfMonth(dayOfMonth == ANY_VALUE ? null : dayOfMonth)
                .month(month == ANY_VALUE ? null : month)
                .dayOfWeek(dayOfWeek == ANY_VALUE ? null : dayOfWeek)
                .build();
    }

    /**
     * {@link #ANY_VALUE} for "*", the value when in range, {@code null} when malformed
     */
    private static Integer parseField(String field, int min, int max) {
        if (ANY.equals(field)) {
            return ANY_VALUE;
        }
        return parseValue(field, min, max);
    }

    private static Integer parseValue(String field, int min, int max) {
        if (field.isEmpty() || field.length() > 2 || !field.chars().allMatch(Character::isDigit)) {
            return null;
        }
        var value = Integer.parseInt(field);
        return value < min || value > max ? null : value;
    }

    enum Shape {
        EVERY_MINUTE,
        MINUTE_STEP,
        HOURLY,
        DAILY
    }

    /**
     * Parsed form of a supported expression; {@code null} day fields mean "*"
     */
    @Value
    @Builder
    static class ParsedCron {
        Shape shape;
        int minute;
        Integer hour;
        Integer dayOfMonth;
        Integer month;
        Integer dayOfWeek;
    }
}
