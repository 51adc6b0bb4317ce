package net.cronkeeper.core.spi;

/** resourceVersion 불일치 (다른 쪽이 먼저 갱신함) */
public class ConflictException extends StoreException {
    public ConflictException(String message) { super(message); }
}
