package net.cronkeeper.core.service;

import net.cronkeeper.core.model.ChildJob;
import net.cronkeeper.core.model.ConcurrencyPolicy;
import net.cronkeeper.core.model.JobCondition;
import net.cronkeeper.core.model.JobTemplate;
import net.cronkeeper.core.model.ObjectKey;
import net.cronkeeper.core.model.ObjectRef;
import net.cronkeeper.core.model.ScheduledJob;
import net.cronkeeper.core.model.ScheduledJobSpec;
import net.cronkeeper.core.model.ScheduledJobStatus;
import net.cronkeeper.core.spi.StoreException;
import net.cronkeeper.core.support.InMemoryScheduledJobStore;
import net.cronkeeper.core.support.InMemoryScheduledJobStore.Op;
import net.cronkeeper.core.support.Jobs;
import net.cronkeeper.core.support.MutableClock;
import net.cronkeeper.core.support.StepCron;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ScheduledJobReconcilerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:30Z");
    private static final Instant SLOT = Instant.parse("2024-03-01T12:00:00Z");
    private static final ObjectKey KEY = ObjectKey.of("default", "report");

    private final ReconcilerConfig cfg = ReconcilerConfig.defaults();
    private InMemoryScheduledJobStore store;
    private MutableClock clock;
    private ScheduledJobReconciler reconciler;

    @BeforeEach
    void setUp() {
        store = new InMemoryScheduledJobStore(cfg);
        clock = new MutableClock(NOW);
        reconciler = new ScheduledJobReconciler(store, clock, new StepCron(), cfg);
    }

    @Test
    void missingObjectIsATerminalNoOp() throws Exception {
        ReconcileResult r = reconciler.reconcile(KEY);

        assertFalse(r.isRequeue());
        assertThat(store.ops).containsExactly("GET:" + KEY);
    }

    @Test
    @DisplayName("놓친 슬롯에 대해 Job 하나를 만들고 다음 슬롯까지 requeue")
    void createsJobForMissedSlot() throws Exception {
        var template = new JobTemplate(Map.of("app", "report"), Map.of(), "payload");
        store.putScheduledJob(KEY, ScheduledJobSpec.of(StepCron.EVERY_MINUTE).withJobTemplate(template),
                NOW.minusSeconds(90));

        ReconcileResult r = reconciler.reconcile(KEY);

        assertEquals(Duration.ofSeconds(30), r.requeueAfter());
        assertThat(store.created).hasSize(1);
        ChildJob job = store.created.get(0);
        assertEquals("report-" + SLOT.getEpochSecond(), job.name());
        assertEquals("payload", job.body());
        assertEquals("report", job.owner().name());
        assertThat(store.ops).containsExactly(
                "GET:" + KEY, "LIST:" + KEY, "UPDATE_STATUS:" + KEY, "CREATE:" + job.name());
    }

    @Test
    void rerunningAfterCreationDoesNotCreateAgain() throws Exception {
        store.putScheduledJob(KEY, ScheduledJobSpec.of(StepCron.EVERY_MINUTE), NOW.minusSeconds(90));

        reconciler.reconcile(KEY);
        clock.advance(Duration.ofSeconds(5));
        ReconcileResult second = reconciler.reconcile(KEY);

        assertThat(store.created).hasSize(1);
        assertEquals(Duration.ofSeconds(25), second.requeueAfter());
        ScheduledJobStatus status = store.scheduledJob(KEY).status();
        assertEquals(SLOT, status.lastScheduleTime());
        assertThat(status.active()).extracting(ObjectRef::name).containsExactly("report-" + SLOT.getEpochSecond());
    }

    @Test
    void existingJobForTheSlotIsTreatedAsCreated() throws Exception {
        ScheduledJob parent = store.putScheduledJob(KEY, ScheduledJobSpec.of(StepCron.EVERY_MINUTE), NOW.minusSeconds(90));
        // 같은 이름이지만 소유 링크가 없어 목록에 안 잡히는 Job
        store.putChild(Jobs.running(parent, SLOT, SLOT).withOwner(null));

        ReconcileResult r = reconciler.reconcile(KEY);

        assertEquals(Duration.ofSeconds(30), r.requeueAfter());
        assertThat(store.created).isEmpty();
        assertThat(store.ops).contains("CREATE:report-" + SLOT.getEpochSecond());
    }

    @Test
    @DisplayName("suspend + active 2개 → status 에 2개 반영, 생성 없음, NoRequeue")
    void suspendedReflectsActiveJobsAndStops() throws Exception {
        ScheduledJob parent = store.putScheduledJob(KEY,
                ScheduledJobSpec.of(StepCron.EVERY_MINUTE).withSuspend(true), NOW.minusSeconds(600));
        store.putChild(Jobs.running(parent, SLOT.minusSeconds(120), SLOT.minusSeconds(120)));
        store.putChild(Jobs.running(parent, SLOT.minusSeconds(60), SLOT.minusSeconds(60)));

        ReconcileResult r = reconciler.reconcile(KEY);

        assertFalse(r.isRequeue());
        assertThat(store.created).isEmpty();
        ScheduledJobStatus status = store.scheduledJob(KEY).status();
        assertThat(status.active()).hasSize(2);
        assertEquals(SLOT.minusSeconds(60), status.lastScheduleTime());
    }

    @Test
    void forbidWithActiveJobSkipsCreation() throws Exception {
        ScheduledJob parent = store.putScheduledJob(KEY,
                ScheduledJobSpec.of(StepCron.EVERY_MINUTE).withConcurrencyPolicy(ConcurrencyPolicy.FORBID),
                NOW.minusSeconds(600));
        store.putChild(Jobs.running(parent, SLOT.minusSeconds(60), SLOT.minusSeconds(60)));

        ReconcileResult r = reconciler.reconcile(KEY);

        assertEquals(Duration.ofSeconds(30), r.requeueAfter());
        assertThat(store.ops).noneMatch(op -> op.startsWith("CREATE"));
    }

    @Test
    void replaceDeletesActiveJobsBeforeCreating() throws Exception {
        ScheduledJob parent = store.putScheduledJob(KEY,
                ScheduledJobSpec.of(StepCron.EVERY_MINUTE).withConcurrencyPolicy(ConcurrencyPolicy.REPLACE),
                NOW.minusSeconds(600));
        ChildJob old = Jobs.running(parent, SLOT.minusSeconds(60), SLOT.minusSeconds(60));
        store.putChild(old);

        reconciler.reconcile(KEY);

        int deleteAt = store.ops.indexOf("DELETE:" + old.name());
        int createAt = store.ops.indexOf("CREATE:report-" + SLOT.getEpochSecond());
        assertTrue(deleteAt >= 0 && createAt > deleteAt, store.ops.toString());
        assertThat(store.created).hasSize(1);
    }

    @Test
    void replaceDeleteFailureIsPropagatedWithoutCreating() {
        ScheduledJob parent = store.putScheduledJob(KEY,
                ScheduledJobSpec.of(StepCron.EVERY_MINUTE).withConcurrencyPolicy(ConcurrencyPolicy.REPLACE),
                NOW.minusSeconds(600));
        ChildJob old = Jobs.running(parent, SLOT.minusSeconds(60), SLOT.minusSeconds(60));
        store.putChild(old);
        store.failDeleteOf(old.name());

        assertThrows(StoreException.class, () -> reconciler.reconcile(KEY));
        assertThat(store.created).isEmpty();
    }

    @Test
    void slotOlderThanStartingDeadlineIsNotStarted() throws Exception {
        store.putScheduledJob(KEY, ScheduledJobSpec.of(StepCron.EVERY_MINUTE).withStartingDeadlineSeconds(10L),
                NOW.minusSeconds(90));

        ReconcileResult r = reconciler.reconcile(KEY);

        assertEquals(Duration.ofSeconds(30), r.requeueAfter());
        assertThat(store.created).isEmpty();
    }

    @Test
    void unparseableScheduleParksWithoutTimer() throws Exception {
        store.putScheduledJob(KEY, ScheduledJobSpec.of("every now and then"), NOW.minusSeconds(90));

        ReconcileResult r = reconciler.reconcile(KEY);

        assertFalse(r.isRequeue());
        assertThat(store.created).isEmpty();
        assertThat(store.ops).contains("UPDATE_STATUS:" + KEY);
    }

    @Test
    void longDowntimeParksWithoutEnumeratingBacklog() throws Exception {
        store.putScheduledJob(KEY, ScheduledJobSpec.of(StepCron.EVERY_MINUTE), NOW.minus(Duration.ofDays(3)));

        ReconcileResult r = reconciler.reconcile(KEY);

        assertFalse(r.isRequeue());
        assertThat(store.created).isEmpty();
    }

    @Test
    void brokenOwnerLinkWaitsForNextSlot() throws Exception {
        store.put(new ScheduledJob(KEY, null, NOW.minusSeconds(90), 1,
                ScheduledJobSpec.of(StepCron.EVERY_MINUTE), ScheduledJobStatus.empty()));

        ReconcileResult r = reconciler.reconcile(KEY);

        assertEquals(Duration.ofSeconds(30), r.requeueAfter());
        assertThat(store.ops).noneMatch(op -> op.startsWith("CREATE"));
    }

    @Test
    void storeFailuresSurfaceAsErrors() {
        store.putScheduledJob(KEY, ScheduledJobSpec.of(StepCron.EVERY_MINUTE), NOW.minusSeconds(90));

        store.failOn(Op.LIST, new StoreException("list boom"));
        assertThrows(StoreException.class, () -> reconciler.reconcile(KEY));

        store.failOn(Op.LIST, null);
        store.failOn(Op.UPDATE_STATUS, new StoreException("update boom"));
        assertThrows(StoreException.class, () -> reconciler.reconcile(KEY));

        store.failOn(Op.UPDATE_STATUS, null);
        store.failOn(Op.CREATE, new StoreException("create boom"));
        assertThrows(StoreException.class, () -> reconciler.reconcile(KEY));
        assertThat(store.created).isEmpty();
    }

    @Test
    @DisplayName("failed 3개, failedHistoryLimit=1 → 오래된 2개 삭제")
    void prunesFailedHistoryAndStillSchedules() throws Exception {
        ScheduledJob parent = store.putScheduledJob(KEY,
                ScheduledJobSpec.of(StepCron.EVERY_MINUTE).withHistoryLimits(null, 1), NOW.minusSeconds(600));
        ChildJob f1 = Jobs.failed(parent, SLOT.minusSeconds(180), SLOT.minusSeconds(180));
        ChildJob f2 = Jobs.failed(parent, SLOT.minusSeconds(120), SLOT.minusSeconds(120));
        ChildJob f3 = Jobs.failed(parent, SLOT.minusSeconds(60), SLOT.minusSeconds(60));
        store.putChild(f1);
        store.putChild(f2);
        store.putChild(f3);
        store.failDeleteOf(f2.name()); // best effort: 실패해도 생성은 진행

        ReconcileResult r = reconciler.reconcile(KEY);

        assertThat(store.deleted).containsExactly(f1);
        assertThat(store.ops).contains("DELETE:" + f2.name());
        assertTrue(store.child(f3.key()).isPresent());
        assertThat(store.created).hasSize(1);
        assertEquals(Duration.ofSeconds(30), r.requeueAfter());
    }

    @Test
    void staleActiveEntriesAreDropped() throws Exception {
        ScheduledJob parent = store.putScheduledJob(KEY, ScheduledJobSpec.of(StepCron.EVERY_MINUTE), NOW.minusSeconds(600));
        store.put(parent.withStatus(new ScheduledJobStatus(
                List.of(new ObjectRef("Job", "default", "report-1", "gone")), SLOT.minusSeconds(60))));
        store.putChild(Jobs.succeeded(parent, SLOT.minusSeconds(60), SLOT.minusSeconds(60)));

        reconciler.reconcile(KEY);

        ScheduledJobStatus status = store.scheduledJob(KEY).status();
        assertThat(status.active()).isEmpty();
        assertEquals(SLOT.minusSeconds(60), status.lastScheduleTime());
        assertThat(store.created).hasSize(1);
    }

    @Test
    void foreignChildrenAreNotListed() throws Exception {
        ScheduledJob parent = store.putScheduledJob(KEY, ScheduledJobSpec.of(StepCron.EVERY_MINUTE), NOW.minusSeconds(30));
        ScheduledJob other = store.putScheduledJob(ObjectKey.of("default", "other"),
                ScheduledJobSpec.of(StepCron.EVERY_MINUTE), NOW.minusSeconds(30));
        store.putChild(Jobs.running(other, SLOT, SLOT));

        ReconcileResult r = reconciler.reconcile(KEY);

        assertThat(store.scheduledJob(parent.key()).status().active()).isEmpty();
        assertEquals(Duration.ofSeconds(30), r.requeueAfter());
    }

    @Test
    @DisplayName("이력이 정리돼도 같은 슬롯의 Job 을 다시 만들지 않는다")
    void prunedSlotIsNotCreatedAgain() throws Exception {
        store.putScheduledJob(KEY, ScheduledJobSpec.of(StepCron.EVERY_MINUTE).withHistoryLimits(0, 0),
                NOW.minusSeconds(90));

        reconciler.reconcile(KEY);
        ChildJob created = store.created.get(0);
        store.putChild(new ChildJob(created.key(), created.uid(), created.labels(), created.annotations(),
                created.body(), created.owner(), List.of(JobCondition.complete()),
                created.createdAt(), NOW, NOW.plusSeconds(1)));

        clock.advance(Duration.ofSeconds(5));
        reconciler.reconcile(KEY);   // 성공한 Job 정리
        assertThat(store.deleted).extracting(ChildJob::name).containsExactly(created.name());

        clock.advance(Duration.ofSeconds(5));
        ReconcileResult r = reconciler.reconcile(KEY);

        assertThat(store.created).hasSize(1);
        assertEquals(SLOT, store.scheduledJob(KEY).status().lastScheduleTime());
        assertEquals(Duration.ofSeconds(20), r.requeueAfter());
    }
}
