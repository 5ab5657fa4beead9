package com.firmenakte.aggregate.service;

public class InvalidIdentityException extends RuntimeException {
    public InvalidIdentityException(String message) {
        super(message);
    }
}
