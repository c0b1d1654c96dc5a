package com.streamchat.exception;

/**
 * @class ChatException
 * @brief Base of every rejection raised by the chat engine.
 *        Recovered at the boundary of the operation that raised it and reported to the
 *        originating connection only; room state is never left half-mutated.
 */
public class ChatException extends RuntimeException {

    private final ChatErrorCode code;

    public ChatException(ChatErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ChatException(ChatErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ChatErrorCode getCode() {
        return code;
    }
}
