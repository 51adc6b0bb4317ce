package net.cronkeeper.core.schedule;

import net.cronkeeper.core.spi.CronCalculator;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;

/**
 * (cron, 하한 시각, 데드라인, now) → (놓친 슬롯, 다음 슬롯).
 * 스토어 의존 없는 순수 계산. 놓친 슬롯 열거는 {@link #MAX_MISSED_RUNS} 에서 끊는다.
 */
public final class ScheduleCalculator {
    public static final int MAX_MISSED_RUNS = 100;

    private final CronCalculator cron;
    private final ZoneId zone;

    public ScheduleCalculator(CronCalculator cron, ZoneId zone) {
        this.cron = Objects.requireNonNull(cron);
        this.zone = Objects.requireNonNull(zone);
    }

    /**
     * @param boundTime               lastScheduleTime, 없으면 객체 생성 시각
     * @param startingDeadlineSeconds null 이면 데드라인 없음
     */
    public ScheduleResult compute(String cronExpr, Instant boundTime, Long startingDeadlineSeconds, Instant now)
            throws ScheduleException {
        Objects.requireNonNull(boundTime, "boundTime");
        Objects.requireNonNull(now, "now");

        Instant earliest = boundTime;
        if (startingDeadlineSeconds != null) {
            // 데드라인보다 오래된 슬롯은 어차피 못 돌린다
            Instant schedulingDeadline = now.minusSeconds(startingDeadlineSeconds);
            if (schedulingDeadline.isAfter(earliest)) earliest = schedulingDeadline;
        }
        if (earliest.isAfter(now)) {
            return new ScheduleResult(null, cron.next(now, cronExpr, zone));
        }

        Instant lastMissed = null;
        int starts = 0;
        for (Instant t = cron.next(earliest, cronExpr, zone); !t.isAfter(now); t = cron.next(t, cronExpr, zone)) {
            lastMissed = t;
            // 컨트롤러가 오래 멈췄거나 시계가 틀어졌으면 수십 년치가 될 수 있음. 전부 세지 않는다.
            starts++;
            if (starts > MAX_MISSED_RUNS) {
                throw new TooManyMissedRunsException(MAX_MISSED_RUNS);
            }
        }
        return new ScheduleResult(lastMissed, cron.next(now, cronExpr, zone));
    }
}
