package net.cronkeeper.core.model;

import java.util.Objects;

/** namespace + name. 스토어에서 객체를 식별하는 유일 키 */
public record ObjectKey(String namespace, String name) {
    public ObjectKey {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(name, "name");
    }

    public static ObjectKey of(String namespace, String name) {
        return new ObjectKey(namespace, name);
    }

    @Override
    public String toString() {
        return namespace + "/" + name;
    }
}
