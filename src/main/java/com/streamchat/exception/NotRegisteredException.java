package com.streamchat.exception;

/* Raised when a connection acts before establishing its identity. */
public class NotRegisteredException extends ChatException {

    public NotRegisteredException(String message) {
        super(ChatErrorCode.NOT_REGISTERED, message);
    }
}
