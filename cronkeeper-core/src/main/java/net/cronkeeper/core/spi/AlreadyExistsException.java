package net.cronkeeper.core.spi;

public class AlreadyExistsException extends StoreException {
    public AlreadyExistsException(String message) { super(message); }
    public AlreadyExistsException(String message, Throwable cause) { super(message, cause); }
}
