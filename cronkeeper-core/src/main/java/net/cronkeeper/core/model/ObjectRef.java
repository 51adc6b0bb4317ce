package net.cronkeeper.core.model;

/** status.active 에 기록되는 자식 Job 참조 */
public record ObjectRef(String kind, String namespace, String name, String uid) {
}
