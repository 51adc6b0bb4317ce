package net.cronkeeper.core.support;

import net.cronkeeper.core.model.ChildJob;
import net.cronkeeper.core.model.JobCondition;
import net.cronkeeper.core.model.ObjectKey;
import net.cronkeeper.core.model.OwnerRef;
import net.cronkeeper.core.model.ScheduledJob;
import net.cronkeeper.core.service.ReconcilerConfig;
import net.cronkeeper.core.service.ScheduledTimeAnnotation;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** 테스트용 자식 Job 팩토리 */
public final class Jobs {
    private Jobs() {}

    public static ChildJob running(ScheduledJob owner, Instant scheduled, Instant start) {
        return child(owner, scheduled, start, List.of());
    }

    public static ChildJob succeeded(ScheduledJob owner, Instant scheduled, Instant start) {
        return child(owner, scheduled, start, List.of(JobCondition.complete()));
    }

    public static ChildJob failed(ScheduledJob owner, Instant scheduled, Instant start) {
        return child(owner, scheduled, start, List.of(JobCondition.failed("BackoffLimitExceeded")));
    }

    public static ChildJob child(ScheduledJob owner, Instant scheduled, Instant start, List<JobCondition> conditions) {
        ReconcilerConfig cfg = ReconcilerConfig.defaults();
        return new ChildJob(
                ObjectKey.of(owner.namespace(), owner.name() + "-" + scheduled.getEpochSecond()),
                UUID.randomUUID().toString(),
                Map.of(),
                Map.of(cfg.scheduledAtAnnotation(), ScheduledTimeAnnotation.format(scheduled)),
                null,
                new OwnerRef(cfg.ownerApiGroup(), cfg.ownerKind(), owner.name(), owner.uid(), true),
                conditions,
                start,
                start,
                null);
    }
}
