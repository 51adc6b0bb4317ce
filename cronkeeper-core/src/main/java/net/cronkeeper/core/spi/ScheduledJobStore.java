package net.cronkeeper.core.spi;

import net.cronkeeper.core.model.ChildJob;
import net.cronkeeper.core.model.ObjectKey;
import net.cronkeeper.core.model.OwnerRef;
import net.cronkeeper.core.model.ScheduledJob;
import net.cronkeeper.core.model.ScheduledJobSpec;

import java.util.List;
import java.util.Optional;

/**
 * 선언형 스토어 클라이언트.
 * 모든 호출은 블로킹 I/O 이며 구현체가 설정된 타임아웃 안에서 끝내야 한다.
 */
public interface ScheduledJobStore {

    Optional<ScheduledJob> get(ObjectKey key) throws StoreException;

    /** 소유자 인덱스(indexKey = ownerName) 로 한 부모의 자식만 조회 */
    List<ChildJob> listChildJobs(String namespace, String indexKey, String ownerName) throws StoreException;

    ChildJob create(ChildJob job) throws StoreException;                // AlreadyExistsException 가능

    ScheduledJob updateStatus(ScheduledJob job) throws StoreException;  // ConflictException 가능

    void delete(ChildJob job, DeletePropagation propagation) throws StoreException; // NotFoundException 가능

    /** 루프 구동용: 전체 ScheduledJob 키와 resourceVersion */
    List<ScheduledJob> listScheduledJobs() throws StoreException;

    /** 카탈로그 등록용: spec 생성/갱신 (status 는 유지) */
    ScheduledJob applySpec(ObjectKey key, ScheduledJobSpec spec) throws StoreException;

    /**
     * child 에 controller 소유 링크를 단다.
     * 부모 uid 가 없거나 다른 controller 가 이미 있으면 실패.
     */
    default ChildJob setOwnerLink(ScheduledJob owner, ChildJob child, String apiGroup, String kind)
            throws OwnerLinkException {
        if (owner.uid() == null || owner.uid().isBlank()) {
            throw new OwnerLinkException("owner " + owner.key() + " has no uid (not persisted?)");
        }
        if (kind == null || kind.isBlank()) {
            throw new OwnerLinkException("owner kind is not registered");
        }
        OwnerRef existing = child.owner();
        if (existing != null && existing.controller() && !owner.uid().equals(existing.uid())) {
            throw new OwnerLinkException("job " + child.key() + " is already controlled by "
                    + existing.kind() + "/" + existing.name());
        }
        return child.withOwner(new OwnerRef(apiGroup, kind, owner.name(), owner.uid(), true));
    }
}
