package net.cronkeeper.core.service;

public class JobConstructionException extends Exception {
    public JobConstructionException(String message, Throwable cause) { super(message, cause); }
}
