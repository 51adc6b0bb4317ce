package net.cronkeeper.core.spi;

public class OwnerLinkException extends Exception {
    public OwnerLinkException(String message) { super(message); }
}
