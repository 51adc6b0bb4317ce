package net.cronkeeper.integration.spring.sched;

import net.cronkeeper.core.model.ObjectKey;
import net.cronkeeper.core.model.ScheduledJobSpec;
import net.cronkeeper.core.service.ReconcileResult;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * 객체별 다음 재조정 시각.
 * NoRequeue 는 spec 이 바뀔 때까지 멈추고, 실패는 base 부터 두 배씩 max 까지 물러난다.
 * 단일 스레드(ReconcileLoop) 에서만 쓴다.
 */
public final class RequeueTracker {
    private final Duration backoffBase;
    private final Duration backoffMax;
    private final Map<ObjectKey, Entry> entries = new HashMap<>();

    private record Entry(ScheduledJobSpec spec, Instant dueAt, int failures) {}

    public RequeueTracker(Duration backoffBase, Duration backoffMax) {
        this.backoffBase = backoffBase;
        this.backoffMax = backoffMax;
    }

    public boolean isDue(ObjectKey key, ScheduledJobSpec spec, Instant now) {
        Entry e = entries.get(key);
        if (e == null || !e.spec().equals(spec)) return true;  // 처음 보거나 spec 변경
        if (e.dueAt() == null) return false;                   // 멈춤 (NoRequeue)
        return !now.isBefore(e.dueAt());
    }

    public void onResult(ObjectKey key, ScheduledJobSpec spec, ReconcileResult result, Instant now) {
        Instant dueAt = result.requeue().map(now::plus).orElse(null);
        entries.put(key, new Entry(spec, dueAt, 0));
    }

    /** @return 적용된 backoff */
    public Duration onError(ObjectKey key, ScheduledJobSpec spec, Instant now) {
        Entry prev = entries.get(key);
        int failures = (prev == null ? 0 : prev.failures()) + 1;
        Duration backoff = backoff(failures);
        entries.put(key, new Entry(spec, now.plus(backoff), failures));
        return backoff;
    }

    /** 삭제된 객체 정리 */
    public void retainOnly(Collection<ObjectKey> live) {
        entries.keySet().retainAll(live);
    }

    Duration backoff(int failures) {
        Duration d = backoffBase;
        for (int i = 1; i < failures; i++) {
            d = d.multipliedBy(2);
            if (d.compareTo(backoffMax) >= 0) return backoffMax;
        }
        return d.compareTo(backoffMax) > 0 ? backoffMax : d;
    }
}
