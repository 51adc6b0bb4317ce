package net.cronkeeper.core.service;

import java.time.ZoneId;
import java.util.Objects;

/**
 * 재조정 루프 설정. 한 번 만들어 Reconciler 에 넘긴다 (전역 상수 대신).
 *
 * @param ownerApiGroup         부모 타입의 API 그룹
 * @param ownerKind             부모 타입 이름 (소유 링크, 인덱스 필터)
 * @param childKind             status.active 참조에 기록할 자식 타입 이름
 * @param ownerIndexKey         자식 → 부모 이름 인덱스 키
 * @param scheduledAtAnnotation 자식 Job 의 슬롯 시각 어노테이션 키
 * @param zone                  cron 해석 타임존
 */
public record ReconcilerConfig(
        String ownerApiGroup,
        String ownerKind,
        String childKind,
        String ownerIndexKey,
        String scheduledAtAnnotation,
        ZoneId zone
) {
    public static final String DEFAULT_API_GROUP = "batch.cronkeeper.net/v1";
    public static final String DEFAULT_OWNER_KIND = "ScheduledJob";
    public static final String DEFAULT_CHILD_KIND = "Job";
    public static final String DEFAULT_OWNER_INDEX_KEY = ".metadata.controller";
    public static final String DEFAULT_SCHEDULED_AT_ANNOTATION = "batch.cronkeeper.net/scheduled-at";

    public ReconcilerConfig {
        Objects.requireNonNull(ownerApiGroup, "ownerApiGroup");
        Objects.requireNonNull(ownerKind, "ownerKind");
        Objects.requireNonNull(childKind, "childKind");
        Objects.requireNonNull(ownerIndexKey, "ownerIndexKey");
        Objects.requireNonNull(scheduledAtAnnotation, "scheduledAtAnnotation");
        Objects.requireNonNull(zone, "zone");
    }

    public static ReconcilerConfig defaults() {
        return new ReconcilerConfig(DEFAULT_API_GROUP, DEFAULT_OWNER_KIND, DEFAULT_CHILD_KIND,
                DEFAULT_OWNER_INDEX_KEY, DEFAULT_SCHEDULED_AT_ANNOTATION, ZoneId.of("UTC"));
    }

    public ReconcilerConfig withZone(ZoneId newZone) {
        return new ReconcilerConfig(ownerApiGroup, ownerKind, childKind, ownerIndexKey, scheduledAtAnnotation, newZone);
    }
}
