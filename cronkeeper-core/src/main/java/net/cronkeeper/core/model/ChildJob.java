package net.cronkeeper.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * ScheduledJob 이 만든 자식 Job.
 * 실행은 외부 실행기 몫이고, 여기서는 수명주기 메타데이터만 다룬다.
 */
public record ChildJob(
        ObjectKey key,
        String uid,
        Map<String, String> labels,
        Map<String, String> annotations,
        String body,
        OwnerRef owner,            // controller 소유자, 없으면 null
        List<JobCondition> conditions,
        Instant createdAt,
        Instant startTime,
        Instant completionTime
) {
    public enum FinishState { RUNNING, SUCCEEDED, FAILED }

    public ChildJob {
        Objects.requireNonNull(key, "key");
        labels = labels == null ? Map.of() : Map.copyOf(labels);
        annotations = annotations == null ? Map.of() : Map.copyOf(annotations);
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    /** 생성 직전의 새 Job (uid/시각은 스토어가 채운다) */
    public static ChildJob ofNew(ObjectKey key, Map<String, String> labels, Map<String, String> annotations, String body) {
        return new ChildJob(key, null, labels, annotations, body, null, List.of(), null, null, null);
    }

    /** 첫 번째 true 인 COMPLETE/FAILED 조건이 완료 상태를 결정한다 */
    public FinishState finishState() {
        for (JobCondition c : conditions) {
            if (!c.status()) continue;
            if (c.type() == JobCondition.Type.COMPLETE) return FinishState.SUCCEEDED;
            if (c.type() == JobCondition.Type.FAILED) return FinishState.FAILED;
        }
        return FinishState.RUNNING;
    }

    public Optional<String> annotation(String name) {
        return Optional.ofNullable(annotations.get(name));
    }

    public ChildJob withOwner(OwnerRef newOwner) {
        return new ChildJob(key, uid, labels, annotations, body, newOwner, conditions, createdAt, startTime, completionTime);
    }

    public ObjectRef toRef(String kind) {
        return new ObjectRef(kind, key.namespace(), key.name(), uid);
    }

    public String name() { return key.name(); }
}
