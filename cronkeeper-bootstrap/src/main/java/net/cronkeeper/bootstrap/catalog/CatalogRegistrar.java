package net.cronkeeper.bootstrap.catalog;

import net.cronkeeper.bootstrap.props.CronkeeperProperties;
import net.cronkeeper.core.model.ConcurrencyPolicy;
import net.cronkeeper.core.model.JobTemplate;
import net.cronkeeper.core.model.ObjectKey;
import net.cronkeeper.core.model.ScheduledJob;
import net.cronkeeper.core.model.ScheduledJobSpec;
import net.cronkeeper.core.spi.ScheduledJobStore;
import net.cronkeeper.core.spi.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 설정에 선언된 ScheduledJob 을 스토어에 upsert 한다 (멱등).
 * status 는 건드리지 않으므로 재기동해도 lastScheduleTime 이 유지된다.
 */
public class CatalogRegistrar {
    private static final Logger log = LoggerFactory.getLogger(CatalogRegistrar.class);

    private final ScheduledJobStore store;

    public CatalogRegistrar(ScheduledJobStore store) {
        this.store = store;
    }

    public void register(CronkeeperProperties.Catalog catalog) throws StoreException {
        for (var def : catalog.getJobs()) {
            ScheduledJob saved = store.applySpec(ObjectKey.of(def.getNamespace(), def.getName()), toSpec(def));
            log.info("Catalog registered: scheduledJob={} schedule='{}' policy={} suspend={}",
                    saved.key(), saved.spec().schedule(), saved.spec().concurrencyPolicy(), saved.spec().suspend());
        }
    }

    static ScheduledJobSpec toSpec(CronkeeperProperties.ScheduledJobDef def) {
        if (def.getName() == null || def.getSchedule() == null) {
            throw new IllegalArgumentException("scheduledJob.name and scheduledJob.schedule are required: " + def);
        }
        var t = def.getTemplate();
        JobTemplate template = (t == null)
                ? JobTemplate.empty()
                : new JobTemplate(t.getLabels(), t.getAnnotations(), t.getBody());
        return new ScheduledJobSpec(
                def.getSchedule(),
                def.getStartingDeadlineSeconds(),
                ConcurrencyPolicy.from(def.getConcurrencyPolicy()),
                def.isSuspend(),
                template,
                def.getSuccessfulJobsHistoryLimit(),
                def.getFailedJobsHistoryLimit());
    }
}
