package com.streamchat.exception;

import org.springframework.http.HttpStatus;

/**
 * Stable error codes carried by every rejected chat request, on the WebSocket error frame
 * and in REST error bodies alike.
 */
public enum ChatErrorCode {

    NOT_REGISTERED(HttpStatus.UNAUTHORIZED),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    FORBIDDEN(HttpStatus.FORBIDDEN),
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST),
    UNKNOWN(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus httpStatus;

    ChatErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
