package net.cronkeeper.core.service;

import net.cronkeeper.core.model.ChildJob;
import net.cronkeeper.core.model.JobTemplate;
import net.cronkeeper.core.model.ObjectKey;
import net.cronkeeper.core.model.ScheduledJob;
import net.cronkeeper.core.spi.OwnerLinkException;
import net.cronkeeper.core.spi.ScheduledJobStore;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * 템플릿 + 슬롯 시각 → 새 자식 Job.
 * 이름은 {@code <부모이름>-<슬롯 epoch 초>} 로 결정적이라, 같은 슬롯을 두 번 만들면 스토어가 거부한다.
 */
public final class JobConstructor {
    private final ScheduledJobStore store;
    private final ReconcilerConfig config;

    public JobConstructor(ScheduledJobStore store, ReconcilerConfig config) {
        this.store = store;
        this.config = config;
    }

    public static String jobName(String parentName, Instant scheduledTime) {
        return parentName + "-" + scheduledTime.getEpochSecond();
    }

    public ChildJob construct(ScheduledJob parent, Instant scheduledTime) throws JobConstructionException {
        JobTemplate template = parent.spec().jobTemplate();

        Map<String, String> annotations = new HashMap<>(template.annotations());
        annotations.put(config.scheduledAtAnnotation(), ScheduledTimeAnnotation.format(scheduledTime));

        ChildJob job = ChildJob.ofNew(
                ObjectKey.of(parent.namespace(), jobName(parent.name(), scheduledTime)),
                template.labels(),
                annotations,
                template.body());
        try {
            return store.setOwnerLink(parent, job, config.ownerApiGroup(), config.ownerKind());
        } catch (OwnerLinkException e) {
            throw new JobConstructionException("unable to set owner link on " + job.key(), e);
        }
    }
}
