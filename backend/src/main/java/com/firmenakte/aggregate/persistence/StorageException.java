package com.firmenakte.aggregate.persistence;

public class StorageException extends Exception {
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
