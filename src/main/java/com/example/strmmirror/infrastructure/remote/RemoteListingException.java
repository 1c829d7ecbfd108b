package com.example.strmmirror.infrastructure.remote;

public class RemoteListingException extends RuntimeException {

    public RemoteListingException(String message) {
        super(message);
    }

    public RemoteListingException(String message, Throwable cause) {
        super(message, cause);
    }
}
