package net.cronkeeper.core.schedule;

import net.cronkeeper.core.support.StepCron;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ScheduleCalculatorTest {

    private static final Instant T = Instant.parse("2024-03-01T12:00:30Z");

    private final ScheduleCalculator calc = new ScheduleCalculator(new StepCron(), ZoneOffset.UTC);

    @Test
    @DisplayName("매분 스케줄, 하한 now-90s → 가장 최근 분 경계가 missed, 다음 분이 next")
    void minutelyWithBoundNinetySecondsAgo() throws Exception {
        ScheduleResult r = calc.compute(StepCron.EVERY_MINUTE, T.minusSeconds(90), null, T);

        assertEquals(Instant.parse("2024-03-01T12:00:00Z"), r.missedRun());
        assertEquals(Instant.parse("2024-03-01T12:01:00Z"), r.nextRun());
        assertEquals(Duration.ofSeconds(30), r.untilNext(T));
    }

    @Test
    void noMissedRunWhenBoundIsInTheFuture() throws Exception {
        ScheduleResult r = calc.compute(StepCron.EVERY_MINUTE, T.plusSeconds(600), null, T);

        assertTrue(r.missed().isEmpty());
        assertEquals(Instant.parse("2024-03-01T12:01:00Z"), r.nextRun());
    }

    @Test
    void noMissedRunWhenNoOccurrenceSinceBound() throws Exception {
        ScheduleResult r = calc.compute(StepCron.EVERY_MINUTE, Instant.parse("2024-03-01T12:00:00Z"), null, T);

        assertNull(r.missedRun());
        assertTrue(r.nextRun().isAfter(T));
    }

    @Test
    @DisplayName("500주기 전 하한 → 열거하지 않고 TooManyMissedRuns")
    void fiveHundredPeriodsBehindFailsFast() {
        Instant bound = T.minus(Duration.ofMinutes(500));
        assertThrows(TooManyMissedRunsException.class,
                () -> calc.compute(StepCron.EVERY_MINUTE, bound, null, T));
    }

    @Test
    void exactlyOneHundredMissedRunsIsStillAccepted() throws Exception {
        Instant now = Instant.parse("2024-03-01T12:00:00Z");
        Instant bound = now.minus(Duration.ofMinutes(100));

        ScheduleResult r = calc.compute(StepCron.EVERY_MINUTE, bound, null, now);

        assertEquals(now, r.missedRun());
    }

    @Test
    @DisplayName("데드라인이 있으면 하한이 now-deadline 으로 당겨져 긴 공백도 허용된다")
    void deadlineNarrowsTheWindow() throws Exception {
        Instant bound = T.minus(Duration.ofDays(30));

        ScheduleResult r = calc.compute(StepCron.EVERY_MINUTE, bound, 200L, T);

        assertEquals(Instant.parse("2024-03-01T12:00:00Z"), r.missedRun());
    }

    @Test
    void deadlineNeverWidensTheWindowBeforeTheBound() throws Exception {
        Instant bound = T.minusSeconds(20);

        ScheduleResult r = calc.compute(StepCron.EVERY_MINUTE, bound, 3600L, T);

        assertNull(r.missedRun());
    }

    @Test
    void missedRunIsNeverEarlierThanBoundAndNextIsAlwaysAfterNow() throws Exception {
        for (int offset = 0; offset < 6000; offset += 37) {
            Instant bound = T.minusSeconds(offset);
            ScheduleResult r = calc.compute(StepCron.EVERY_MINUTE, bound, null, T);
            assertThat(r.nextRun()).isAfter(T);
            r.missed().ifPresent(m -> assertThat(m).isAfter(bound).isBeforeOrEqualTo(T));
        }
    }

    @Test
    void malformedExpressionIsAParseError() {
        ScheduleParseException e = assertThrows(ScheduleParseException.class,
                () -> calc.compute("every minute please", T.minusSeconds(90), null, T));
        assertEquals("every minute please", e.expression());
    }
}
