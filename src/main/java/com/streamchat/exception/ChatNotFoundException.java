package com.streamchat.exception;

/* Room, message or target user absent. */
public class ChatNotFoundException extends ChatException {

    public ChatNotFoundException(String message) {
        super(ChatErrorCode.NOT_FOUND, message);
    }
}
