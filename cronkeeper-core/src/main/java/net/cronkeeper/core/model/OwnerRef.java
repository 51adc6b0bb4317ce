package net.cronkeeper.core.model;

/**
 * 자식 → 부모 소유 링크.
 * controller=true 인 링크만 소유자 인덱스와 연쇄 삭제 대상이 된다.
 */
public record OwnerRef(String apiGroup, String kind, String name, String uid, boolean controller) {
}
