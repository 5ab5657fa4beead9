package com.firmenakte.aggregate.parse;

public class DocumentParseException extends Exception {
    public DocumentParseException(String message) {
        super(message);
    }

    public DocumentParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
