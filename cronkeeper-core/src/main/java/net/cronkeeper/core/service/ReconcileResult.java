package net.cronkeeper.core.service;

import java.time.Duration;
import java.util.Optional;

/** 재조정 한 번의 결과. requeueAfter 는 권고값이며 전달 계층이 앞당기거나 늦출 수 있다 */
public record ReconcileResult(Duration requeueAfter) {
    private static final ReconcileResult NO_REQUEUE = new ReconcileResult(null);

    public static ReconcileResult noRequeue() { return NO_REQUEUE; }

    public static ReconcileResult requeueAfter(Duration d) {
        return new ReconcileResult(d.isNegative() ? Duration.ZERO : d);
    }

    public Optional<Duration> requeue() { return Optional.ofNullable(requeueAfter); }

    public boolean isRequeue() { return requeueAfter != null; }
}
