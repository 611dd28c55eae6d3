package com.smartstream.transform.service;

public class StorageException extends RuntimeException {
    /**
     * Creates an exception describing a failed object storage call.
     */
    public StorageException(String m) { super(m); }
    /**
     * Creates an exception that preserves the originating cause.
     */
    public StorageException(String m, Throwable c) { super(m, c); }
}
