package net.cronkeeper.core.service;

import net.cronkeeper.core.model.ChildJob;
import net.cronkeeper.core.model.ConcurrencyPolicy;
import net.cronkeeper.core.spi.DeletePropagation;
import net.cronkeeper.core.spi.NotFoundException;
import net.cronkeeper.core.spi.ScheduledJobStore;
import net.cronkeeper.core.spi.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/** Allow / Forbid / Replace 를 active 집합에 적용 */
public final class ConcurrencyPolicyEnforcer {
    private static final Logger log = LoggerFactory.getLogger(ConcurrencyPolicyEnforcer.class);

    public enum Decision { PROCEED, SKIP }

    private final ScheduledJobStore store;

    public ConcurrencyPolicyEnforcer(ScheduledJobStore store) {
        this.store = store;
    }

    /**
     * REPLACE 에서 삭제 실패는 그대로 던진다. 중복 실행이 남으면 정책 위반이므로.
     * 이미 지워진 Job(NotFound) 은 목적 달성으로 본다.
     */
    public Decision enforce(ConcurrencyPolicy policy, List<ChildJob> active) throws StoreException {
        switch (policy) {
            case FORBID:
                if (!active.isEmpty()) {
                    log.debug("concurrency policy blocks concurrent runs, skipping numActive={}", active.size());
                    return Decision.SKIP;
                }
                return Decision.PROCEED;
            case REPLACE:
                for (ChildJob job : active) {
                    try {
                        store.delete(job, DeletePropagation.BACKGROUND);
                        log.info("deleted active job for replacement job={}", job.key());
                    } catch (NotFoundException gone) {
                        log.debug("active job already gone job={}", job.key());
                    } catch (StoreException e) {
                        log.error("unable to delete active job job={}", job.key(), e);
                        throw e;
                    }
                }
                return Decision.PROCEED;
            case ALLOW:
            default:
                return Decision.PROCEED;
        }
    }
}
