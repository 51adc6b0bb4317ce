package net.cronkeeper.core.service;

import net.cronkeeper.core.model.ChildJob;
import net.cronkeeper.core.model.ObjectKey;
import net.cronkeeper.core.model.ObjectRef;
import net.cronkeeper.core.model.ScheduledJob;
import net.cronkeeper.core.model.ScheduledJobSpec;
import net.cronkeeper.core.model.ScheduledJobStatus;
import net.cronkeeper.core.schedule.ScheduleCalculator;
import net.cronkeeper.core.schedule.ScheduleException;
import net.cronkeeper.core.schedule.ScheduleResult;
import net.cronkeeper.core.spi.AlreadyExistsException;
import net.cronkeeper.core.spi.Clock;
import net.cronkeeper.core.spi.CronCalculator;
import net.cronkeeper.core.spi.ScheduledJobStore;
import net.cronkeeper.core.spi.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * ScheduledJob 재조정 루프 (level-triggered).
 * 매 호출마다 스토어 상태에서 처음부터 다시 계산하므로 몇 번을 다시 돌려도 안전하다.
 * 같은 객체에 대한 호출은 전달 계층이 직렬화한다고 가정한다 (내부 잠금 없음).
 *
 * <p>결과: {@link ReconcileResult} (RequeueAfter / NoRequeue), 재시도가 필요한 실패는 {@link StoreException}.
 */
public final class ScheduledJobReconciler {
    private static final Logger log = LoggerFactory.getLogger(ScheduledJobReconciler.class);

    private final ScheduledJobStore store;
    private final Clock clock;
    private final ReconcilerConfig config;

    private final JobClassifier classifier;
    private final HistoryPruner pruner;
    private final ScheduleCalculator calculator;
    private final ConcurrencyPolicyEnforcer enforcer;
    private final JobConstructor constructor;

    public ScheduledJobReconciler(ScheduledJobStore store, Clock clock, CronCalculator cron, ReconcilerConfig config) {
        this.store = store;
        this.clock = clock;
        this.config = config;
        this.classifier = new JobClassifier(config.scheduledAtAnnotation());
        this.pruner = new HistoryPruner(store);
        this.calculator = new ScheduleCalculator(cron, config.zone());
        this.enforcer = new ConcurrencyPolicyEnforcer(store);
        this.constructor = new JobConstructor(store, config);
    }

    public ReconcileResult reconcile(ObjectKey key) throws StoreException {
        // 1) 부모 조회. 없으면 삭제된 것 → 끝
        Optional<ScheduledJob> fetched = store.get(key);
        if (fetched.isEmpty()) {
            log.debug("scheduled job not found, ignoring scheduledJob={}", key);
            return ReconcileResult.noRequeue();
        }
        ScheduledJob scheduledJob = fetched.get();
        ScheduledJobSpec spec = scheduledJob.spec();

        // 2) 소유 인덱스로 자식 Job 조회
        List<ChildJob> children;
        try {
            children = store.listChildJobs(key.namespace(), config.ownerIndexKey(), key.name());
        } catch (StoreException e) {
            log.error("unable to list child jobs scheduledJob={}", key, e);
            throw e;
        }

        // 3) 분류 + status 갱신
        JobClassifier.Classification jobs = classifier.classify(children);
        List<ObjectRef> activeRefs = jobs.active().stream().map(j -> j.toRef(config.childKind())).toList();
        ScheduledJobStatus status = new ScheduledJobStatus(activeRefs,
                latest(scheduledJob.status().lastScheduleTime(), jobs.mostRecentScheduleTime()));
        log.debug("job count scheduledJob={} active={} successful={} failed={}",
                key, jobs.active().size(), jobs.succeeded().size(), jobs.failed().size());
        try {
            scheduledJob = store.updateStatus(scheduledJob.withStatus(status));
        } catch (StoreException e) {
            log.error("unable to update scheduled job status scheduledJob={}", key, e);
            throw e;
        }

        // 4) 이력 정리 (best effort, 실패해도 계속)
        pruner.prune(jobs.failed(), spec.failedJobsHistoryLimit(), "failed");
        pruner.prune(jobs.succeeded(), spec.successfulJobsHistoryLimit(), "successful");

        // 5) 일시정지: 타이머 없이 대기, spec 변경이 다시 깨운다
        if (spec.suspend()) {
            log.debug("scheduled job suspended, skipping scheduledJob={}", key);
            return ReconcileResult.noRequeue();
        }

        // 6) 놓친 슬롯/다음 슬롯 계산
        Instant now = clock.now();
        Instant bound = status.lastScheduleTime() != null ? status.lastScheduleTime() : scheduledJob.createdAt();
        if (bound == null) bound = now;
        ScheduleResult schedule;
        try {
            schedule = calculator.compute(spec.schedule(), bound, spec.startingDeadlineSeconds(), now);
        } catch (ScheduleException e) {
            // spec 을 고치기 전에는 풀리지 않으니 재시도 타이머를 걸지 않는다
            log.error("unable to figure out schedule scheduledJob={}", key, e);
            return ReconcileResult.noRequeue();
        }
        ReconcileResult scheduled = ReconcileResult.requeueAfter(schedule.untilNext(now));

        // 7) 놓친 슬롯 없음 → 다음 슬롯까지 대기
        if (schedule.missed().isEmpty()) {
            log.debug("no upcoming scheduled times, sleeping until next scheduledJob={} now={} nextRun={}",
                    key, now, schedule.nextRun());
            return scheduled;
        }
        Instant missedRun = schedule.missedRun();

        // 8) 시작 데드라인 초과
        Long deadline = spec.startingDeadlineSeconds();
        if (deadline != null && missedRun.plusSeconds(deadline).isBefore(now)) {
            log.debug("missed starting deadline for last run, sleeping till next scheduledJob={} currentRun={} nextRun={}",
                    key, missedRun, schedule.nextRun());
            return scheduled;
        }

        // 9) 동시성 정책
        if (enforcer.enforce(spec.concurrencyPolicy(), jobs.active()) == ConcurrencyPolicyEnforcer.Decision.SKIP) {
            return scheduled;
        }

        // 10) Job 구성. 템플릿이 깨졌으면 다음 슬롯까지 기다린다
        ChildJob job;
        try {
            job = constructor.construct(scheduledJob, missedRun);
        } catch (JobConstructionException e) {
            log.error("unable to construct job from template scheduledJob={} currentRun={}", key, missedRun, e);
            return scheduled;
        }

        // 11) 생성. 이미 있으면 이 슬롯은 실현된 것으로 본다 (결정적 이름)
        try {
            store.create(job);
            log.debug("created job for scheduled job run scheduledJob={} job={} currentRun={}",
                    key, job.key(), missedRun);
        } catch (AlreadyExistsException e) {
            log.info("job for run already exists scheduledJob={} job={}", key, job.key());
        } catch (StoreException e) {
            log.error("unable to create job for scheduled job scheduledJob={} job={}", key, job.key(), e);
            throw e;
        }

        // 12) 다음 슬롯에 다시 깨어난다 (생성된 Job 이벤트로 더 일찍 올 수도 있음)
        return scheduled;
    }

    // 정리된 Job 의 슬롯도 기억해야 하므로 lastScheduleTime 은 줄어들지 않는다
    private static Instant latest(Instant recorded, Instant observed) {
        if (recorded == null) return observed;
        if (observed == null) return recorded;
        return observed.isAfter(recorded) ? observed : recorded;
    }
}
