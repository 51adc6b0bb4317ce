package net.cronkeeper.integration.spring.sched;

import net.cronkeeper.core.model.ScheduledJob;
import net.cronkeeper.core.service.ReconcileResult;
import net.cronkeeper.core.service.ScheduledJobReconciler;
import net.cronkeeper.core.spi.Clock;
import net.cronkeeper.core.spi.ScheduledJobStore;
import net.cronkeeper.core.spi.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 최소한의 전달 계층. 고정 지연으로 돌면서 due 인 ScheduledJob 을 하나씩 재조정한다.
 * 한 스레드에서 순서대로 처리하므로 같은 객체에 대한 재조정이 겹치지 않는다.
 */
public class ReconcileLoop {
    private static final Logger log = LoggerFactory.getLogger(ReconcileLoop.class);

    private final ScheduledJobStore store;
    private final ScheduledJobReconciler reconciler;
    private final Clock clock;
    private final RequeueTracker tracker;

    public ReconcileLoop(ScheduledJobStore store, ScheduledJobReconciler reconciler, Clock clock, RequeueTracker tracker) {
        this.store = store;
        this.reconciler = reconciler;
        this.clock = clock;
        this.tracker = tracker;
    }

    @Scheduled(fixedDelayString = "${cronkeeper.loop.tick-delay-ms:1000}")
    public void tick() {
        List<ScheduledJob> jobs;
        try {
            jobs = store.listScheduledJobs();
        } catch (StoreException | RuntimeException e) {
            log.error("unable to list scheduled jobs, retrying next tick", e);
            return;
        }
        tracker.retainOnly(jobs.stream().map(ScheduledJob::key).toList());

        int reconciled = 0;
        for (ScheduledJob job : jobs) {
            Instant now = clock.now();
            if (!tracker.isDue(job.key(), job.spec(), now)) continue;
            reconciled++;
            try {
                ReconcileResult result = reconciler.reconcile(job.key());
                tracker.onResult(job.key(), job.spec(), result, now);
            } catch (StoreException | RuntimeException e) {
                // 한 객체의 실패가 루프를 멈추지 않는다
                Duration backoff = tracker.onError(job.key(), job.spec(), now);
                log.warn("reconcile failed, backing off scheduledJob={} backoff={}", job.key(), backoff, e);
            }
        }
        if (reconciled > 0) log.debug("tick reconciled={} known={}", reconciled, jobs.size());
    }
}
