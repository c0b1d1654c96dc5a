package com.streamchat.exception;

public class InvalidChatRequestException extends ChatException {

    public InvalidChatRequestException(String message) {
        super(ChatErrorCode.INVALID_REQUEST, message);
    }
}
