package net.cronkeeper.core.model;

import java.util.Objects;

public record ScheduledJobSpec(
        String schedule,
        Long startingDeadlineSeconds,       // null = 데드라인 없음
        ConcurrencyPolicy concurrencyPolicy,
        boolean suspend,
        JobTemplate jobTemplate,
        Integer successfulJobsHistoryLimit, // null = 무제한
        Integer failedJobsHistoryLimit      // null = 무제한
) {
    public ScheduledJobSpec {
        Objects.requireNonNull(schedule, "schedule");
        if (startingDeadlineSeconds != null && startingDeadlineSeconds < 0)
            throw new IllegalArgumentException("startingDeadlineSeconds must be >= 0");
        if (successfulJobsHistoryLimit != null && successfulJobsHistoryLimit < 0)
            throw new IllegalArgumentException("successfulJobsHistoryLimit must be >= 0");
        if (failedJobsHistoryLimit != null && failedJobsHistoryLimit < 0)
            throw new IllegalArgumentException("failedJobsHistoryLimit must be >= 0");
        if (concurrencyPolicy == null) concurrencyPolicy = ConcurrencyPolicy.ALLOW;
        if (jobTemplate == null) jobTemplate = JobTemplate.empty();
    }

    public static ScheduledJobSpec of(String schedule) {
        return new ScheduledJobSpec(schedule, null, ConcurrencyPolicy.ALLOW, false, JobTemplate.empty(), null, null);
    }

    public ScheduledJobSpec withStartingDeadlineSeconds(Long seconds) {
        return new ScheduledJobSpec(schedule, seconds, concurrencyPolicy, suspend, jobTemplate,
                successfulJobsHistoryLimit, failedJobsHistoryLimit);
    }

    public ScheduledJobSpec withConcurrencyPolicy(ConcurrencyPolicy policy) {
        return new ScheduledJobSpec(schedule, startingDeadlineSeconds, policy, suspend, jobTemplate,
                successfulJobsHistoryLimit, failedJobsHistoryLimit);
    }

    public ScheduledJobSpec withSuspend(boolean suspend) {
        return new ScheduledJobSpec(schedule, startingDeadlineSeconds, concurrencyPolicy, suspend, jobTemplate,
                successfulJobsHistoryLimit, failedJobsHistoryLimit);
    }

    public ScheduledJobSpec withJobTemplate(JobTemplate template) {
        return new ScheduledJobSpec(schedule, startingDeadlineSeconds, concurrencyPolicy, suspend, template,
                successfulJobsHistoryLimit, failedJobsHistoryLimit);
    }

    public ScheduledJobSpec withHistoryLimits(Integer successful, Integer failed) {
        return new ScheduledJobSpec(schedule, startingDeadlineSeconds, concurrencyPolicy, suspend, jobTemplate,
                successful, failed);
    }
}
