package net.cronkeeper.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * 선언형 ScheduledJob 객체.
 * resourceVersion 은 status 갱신 시 낙관적 잠금에 쓰인다.
 */
public record ScheduledJob(
        ObjectKey key,
        String uid,
        Instant createdAt,
        long resourceVersion,
        ScheduledJobSpec spec,
        ScheduledJobStatus status
) {
    public ScheduledJob {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(spec, "spec");
        if (status == null) status = ScheduledJobStatus.empty();
    }

    public ScheduledJob withStatus(ScheduledJobStatus newStatus) {
        return new ScheduledJob(key, uid, createdAt, resourceVersion, spec, newStatus);
    }

    public String name() { return key.name(); }
    public String namespace() { return key.namespace(); }
}
