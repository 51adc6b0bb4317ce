package net.cronkeeper.core.model;

import java.time.Instant;
import java.util.List;

public record ScheduledJobStatus(List<ObjectRef> active, Instant lastScheduleTime) {
    public ScheduledJobStatus {
        active = active == null ? List.of() : List.copyOf(active);
    }

    public static ScheduledJobStatus empty() {
        return new ScheduledJobStatus(List.of(), null);
    }
}
