package net.cronkeeper.core.spi;

public class NotFoundException extends StoreException {
    public NotFoundException(String message) { super(message); }
}
