package net.cronkeeper.core.service;

import net.cronkeeper.core.model.ChildJob;
import net.cronkeeper.core.spi.DeletePropagation;
import net.cronkeeper.core.spi.ScheduledJobStore;
import net.cronkeeper.core.spi.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 보존 한도를 넘은 완료 Job 삭제 (best effort).
 * 실패는 로그만 남기고 다음 재조정에서 다시 시도된다.
 */
public final class HistoryPruner {
    private static final Logger log = LoggerFactory.getLogger(HistoryPruner.class);

    /** startTime 없는 Job 이 가장 오래된 것으로 정렬된다 */
    static final Comparator<ChildJob> BY_START_TIME =
            Comparator.comparing(ChildJob::startTime, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final ScheduledJobStore store;

    public HistoryPruner(ScheduledJobStore store) {
        this.store = store;
    }

    /**
     * @param limit null 이면 무제한 (정리 안 함)
     * @param label 로그용 ("successful" / "failed")
     * @return 실제로 삭제된 Job
     */
    public List<ChildJob> prune(List<ChildJob> finished, Integer limit, String label) {
        if (limit == null || finished.size() <= limit) return List.of();

        List<ChildJob> sorted = new ArrayList<>(finished);
        sorted.sort(BY_START_TIME);

        int excess = sorted.size() - limit;
        List<ChildJob> deleted = new ArrayList<>(excess);
        for (ChildJob job : sorted.subList(0, excess)) {
            try {
                store.delete(job, DeletePropagation.BACKGROUND);
                deleted.add(job);
                log.info("deleted old {} job job={}", label, job.key());
            } catch (StoreException e) {
                log.error("unable to delete old {} job job={}", label, job.key(), e);
            }
        }
        return deleted;
    }
}
