package net.cronkeeper.core.service;

import net.cronkeeper.core.model.ChildJob;
import net.cronkeeper.core.model.OwnerRef;

import java.util.Optional;

/** 자식 Job → 소유 부모 이름 인덱스 함수. 스토어 구현들이 같은 규칙을 쓴다 */
public final class OwnerIndex {
    private OwnerIndex() {}

    /** controller 소유자가 설정된 부모 타입일 때만 부모 이름을 돌려준다 */
    public static Optional<String> indexValue(ChildJob job, ReconcilerConfig config) {
        OwnerRef owner = job.owner();
        if (owner == null || !owner.controller()) return Optional.empty();
        if (!config.ownerApiGroup().equals(owner.apiGroup()) || !config.ownerKind().equals(owner.kind())) {
            return Optional.empty();
        }
        return Optional.of(owner.name());
    }
}
