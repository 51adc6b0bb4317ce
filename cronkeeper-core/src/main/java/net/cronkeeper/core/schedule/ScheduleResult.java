package net.cronkeeper.core.schedule;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * @param missedRun 아직 처리 안 된 가장 최근 슬롯 (없으면 null)
 * @param nextRun   now 이후 첫 슬롯
 */
public record ScheduleResult(Instant missedRun, Instant nextRun) {
    public ScheduleResult {
        Objects.requireNonNull(nextRun, "nextRun");
    }

    public Optional<Instant> missed() { return Optional.ofNullable(missedRun); }

    public Duration untilNext(Instant now) { return Duration.between(now, nextRun); }
}
