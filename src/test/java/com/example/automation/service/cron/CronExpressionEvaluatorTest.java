package com.example.automation.service.cron;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CronExpressionEvaluator Tests")
class CronExpressionEvaluatorTest {

    /**
     * Wednesday
     */
    private static final Instant NOW = Instant.parse("2024-01-10T10:15:30Z");

    private final CronExpressionEvaluator evaluator = new CronExpressionEvaluator(ZoneOffset.UTC);

    @Nested
    @DisplayName("Minute steps")
    class MinuteStepTests {

        @Test
        @DisplayName("Should move to the next multiple of the step")
        void shouldMoveToNextMultiple() {
            assertThat(evaluator.nextRun("*/15 * * * *", NOW)).isEqualTo(Instant.parse("2024-01-10T10:30:00Z"));
        }

        @Test
        @DisplayName("Should roll into the next hour when the step overflows")
        void shouldRollIntoNextHour() {
            assertThat(evaluator.nextRun("*/30 * * * *", Instant.parse("2024-01-10T10:45:00Z")))
                    .isEqualTo(Instant.parse("2024-01-10T11:00:00Z"));
            assertThat(evaluator.nextRun("*/7 * * * *", Instant.parse("2024-01-10T10:57:10Z")))
                    .isEqualTo(Instant.parse("2024-01-10T11:00:00Z"));
        }

        @Test
        @DisplayName("Should never return the reference instant itself")
        void shouldBeStrictlyAfterReference() {
            assertThat(evaluator.nextRun("*/15 * * * *", Instant.parse("2024-01-10T10:30:00Z")))
                    .isEqualTo(Instant.parse("2024-01-10T10:45:00Z"));
        }

        @Test
        @DisplayName("Star minute should fire on the next minute")
        void starMinuteShouldFireNextMinute() {
            assertThat(evaluator.nextRun("* * * * *", NOW)).isEqualTo(Instant.parse("2024-01-10T10:16:00Z"));
        }
    }

    @Nested
    @DisplayName("Hourly")
    class HourlyTests {

        @Test
        @DisplayName("Should fire later this hour when the minute is ahead")
        void shouldFireLaterThisHour() {
            assertThat(evaluator.nextRun("20 * * * *", NOW)).isEqualTo(Instant.parse("2024-01-10T10:20:00Z"));
        }

        @Test
        @DisplayName("Should fire next hour when the minute has passed")
        void shouldFireNextHour() {
            assertThat(evaluator.nextRun("5 * * * *", NOW)).isEqualTo(Instant.parse("2024-01-10T11:05:00Z"));
            assertThat(evaluator.nextRun("15 * * * *", NOW)).isEqualTo(Instant.parse("2024-01-10T11:15:00Z"));
        }
    }

    @Nested
    @DisplayName("Fixed time of day")
    class FixedTimeTests {

        @Test
        @DisplayName("Should fire today when the time is still ahead")
        void shouldFireToday() {
            assertThat(evaluator.nextRun("0 20 * * *", NOW)).isEqualTo(Instant.parse("2024-01-10T20:00:00Z"));
        }

        @Test
        @DisplayName("Should roll to tomorrow when the time has passed")
        void shouldRollToTomorrow() {
            assertThat(evaluator.nextRun("0 7 * * *", NOW)).isEqualTo(Instant.parse("2024-01-11T07:00:00Z"));
            assertThat(evaluator.nextRun("15 10 * * *", NOW)).isEqualTo(Instant.parse("2024-01-11T10:15:00Z"));
        }

        @Test
        @DisplayName("Should roll to the next matching weekday")
        void shouldRollToNextWeekday() {
            assertThat(evaluator.nextRun("0 8 * * 1", NOW)).isEqualTo(Instant.parse("2024-01-15T08:00:00Z"));
            assertThat(evaluator.nextRun("0 8 * * 3", NOW)).isEqualTo(Instant.parse("2024-01-17T08:00:00Z"));
            assertThat(evaluator.nextRun("0 12 * * 3", NOW)).isEqualTo(Instant.parse("2024-01-10T12:00:00Z"));
        }

        @Test
        @DisplayName("Sunday can be written as 0 or 7")
        void sundayAsZeroOrSeven() {
            var expected = Instant.parse("2024-01-14T08:00:00Z");

            assertThat(evaluator.nextRun("0 8 * * 0", NOW)).isEqualTo(expected);
            assertThat(evaluator.nextRun("0 8 * * 7", NOW)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Should roll to the same day of month next month")
        void shouldRollToNextMonth() {
            assertThat(evaluator.nextRun("0 6 1 * *", NOW)).isEqualTo(Instant.parse("2024-02-01T06:00:00Z"));
        }

        @Test
        @DisplayName("Should skip months without the requested day")
        void shouldSkipShortMonths() {
            assertThat(evaluator.nextRun("0 7 31 * *", Instant.parse("2024-02-01T10:00:00Z")))
                    .isEqualTo(Instant.parse("2024-03-31T07:00:00Z"));
        }

        @Test
        @DisplayName("Should honour a fixed month")
        void shouldHonourFixedMonth() {
            assertThat(evaluator.nextRun("0 0 1 1 *", NOW)).isEqualTo(Instant.parse("2025-01-01T00:00:00Z"));
        }

        @Test
        @DisplayName("Day of week wins over day of month when both are fixed")
        void dayOfWeekWinsOverDayOfMonth() {
            assertThat(evaluator.nextRun("0 9 20 * 1", NOW)).isEqualTo(Instant.parse("2024-01-15T09:00:00Z"));
        }

        @Test
        @DisplayName("Should return null for a date that never occurs")
        void shouldReturnNullForImpossibleDate() {
            assertThat(evaluator.nextRun("0 0 30 2 *", NOW)).isNull();
        }

        @Test
        @DisplayName("Should evaluate in the configured zone")
        void shouldEvaluateInConfiguredZone() {
            var jerusalem = new CronExpressionEvaluator(ZoneId.of("Asia/Jerusalem"));

            // 12:15 local time, UTC+2 in winter
            assertThat(jerusalem.nextRun("0 7 * * *", NOW)).isEqualTo(Instant.parse("2024-01-11T05:00:00Z"));
            assertThat(jerusalem.nextRun("0 20 * * *", NOW)).isEqualTo(Instant.parse("2024-01-10T18:00:00Z"));
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("Should accept the supported shapes")
        void shouldAcceptSupportedShapes() {
            assertThat(evaluator.isValid("0 7 * * *")).isTrue();
            assertThat(evaluator.isValid("30 8 * * *")).isTrue();
            assertThat(evaluator.isValid("0 8 * * 1")).isTrue();
            assertThat(evaluator.isValid("0 6 1 * *")).isTrue();
            assertThat(evaluator.isValid("*/30 * * * *")).isTrue();
            assertThat(evaluator.isValid("5 * * * *")).isTrue();
            assertThat(evaluator.isValid("  0   7 * * *  ")).isTrue();
        }

        @Test
        @DisplayName("Malformed expressions are invalid and have no next run")
        void malformedExpressionsAreInvalid() {
            var malformed = new String[]{
                    null, "", "not-a-cron", "0 7 * *", "0 7 * * * *", "60 * * * *", "0 24 * * *",
                    "*/0 * * * *", "*/15 3 * * *", "1-5 * * * *", "0 7 32 * *", "0 7 * 13 *",
                    "0 7 * * 8", "5 * 1 * *", "-1 7 * * *", "0 7 0 * *"
            };

            for (var expression : malformed) {
                assertThat(evaluator.isValid(expression)).as("isValid(%s)", expression).isFalse();
                assertThat(evaluator.nextRun(expression, NOW)).as("nextRun(%s)", expression).isNull();
            }
        }

        @Test
        @DisplayName("Should convert to Spring's six-field form")
        void shouldConvertToSpringForm() {
            assertThat(evaluator.toSpringExpression("0 7 * * *")).isEqualTo("0 0 7 * * *");
            assertThat(evaluator.toSpringExpression(" */30 * * * * ")).isEqualTo("0 */30 * * * *");
        }
    }
}
