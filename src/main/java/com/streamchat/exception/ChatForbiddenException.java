package com.streamchat.exception;

/* Banned, muted, subscriber-only violation or missing moderator privilege. */
public class ChatForbiddenException extends ChatException {

    public ChatForbiddenException(String message) {
        super(ChatErrorCode.FORBIDDEN, message);
    }
}
