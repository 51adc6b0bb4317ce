package net.cronkeeper.core.service;

import net.cronkeeper.core.model.ChildJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/** 자식 Job 을 active / succeeded / failed 로 나누고 가장 최근 슬롯 시각을 복원한다 */
public final class JobClassifier {
    private static final Logger log = LoggerFactory.getLogger(JobClassifier.class);

    private final String scheduledAtAnnotation;

    public JobClassifier(String scheduledAtAnnotation) {
        this.scheduledAtAnnotation = scheduledAtAnnotation;
    }

    public Classification classify(Collection<ChildJob> jobs) {
        List<ChildJob> active = new ArrayList<>();
        List<ChildJob> succeeded = new ArrayList<>();
        List<ChildJob> failed = new ArrayList<>();
        Instant mostRecent = null;

        for (ChildJob job : jobs) {
            switch (job.finishState()) {
                case RUNNING -> active.add(job);
                case SUCCEEDED -> succeeded.add(job);
                case FAILED -> failed.add(job);
            }

            // 분류는 하되, 어노테이션이 깨진 Job 은 최근 시각 계산에서만 뺀다
            Optional<Instant> scheduled;
            try {
                scheduled = scheduledTimeOf(job);
            } catch (DateTimeParseException e) {
                log.error("unable to parse schedule time for child job job={} value='{}'",
                        job.key(), e.getParsedString(), e);
                continue;
            }
            if (scheduled.isPresent() && (mostRecent == null || mostRecent.isBefore(scheduled.get()))) {
                mostRecent = scheduled.get();
            }
        }
        return new Classification(active, succeeded, failed, mostRecent);
    }

    /** 어노테이션이 없으면 empty, 있는데 깨졌으면 DateTimeParseException */
    public Optional<Instant> scheduledTimeOf(ChildJob job) {
        Optional<String> raw = job.annotation(scheduledAtAnnotation);
        if (raw.isEmpty()) return Optional.empty();
        return Optional.of(ScheduledTimeAnnotation.parse(raw.get()));
    }

    public record Classification(
            List<ChildJob> active,
            List<ChildJob> succeeded,
            List<ChildJob> failed,
            Instant mostRecentScheduleTime
    ) {
        public Classification {
            active = List.copyOf(active);
            succeeded = List.copyOf(succeeded);
            failed = List.copyOf(failed);
        }

        public Optional<Instant> mostRecent() { return Optional.ofNullable(mostRecentScheduleTime); }
    }
}
