package com.streamchat.room.exceptionHandler;

import com.streamchat.exception.ChatErrorCode;
import com.streamchat.exception.ChatException;
import com.streamchat.exception.RateLimitedException;
import com.streamchat.room.dto.ErrorResponseDTO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice(basePackages = "com.streamchat.room.controller")
public class ChatApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ChatApiExceptionHandler.class);

    @ExceptionHandler(ChatException.class)
    public ResponseEntity<ErrorResponseDTO> handleChatException(ChatException ex) {
        Long retryAfter = ex instanceof RateLimitedException rate ? rate.getRetryAfterSeconds() : null;
        return respond(ex.getCode(), ex.getMessage(), retryAfter);
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponseDTO> handleBadRequest(Exception ex) {
        logger.info("[bad request] {}", ex.getMessage());
        return respond(ChatErrorCode.INVALID_REQUEST, "Invalid request body", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDTO> handleUnexpected(Exception ex) {
        logger.error("[unexpected error]", ex);
        return respond(ChatErrorCode.UNKNOWN, "Internal error", null);
    }

    private ResponseEntity<ErrorResponseDTO> respond(ChatErrorCode code, String message, Long retryAfter) {
        return ResponseEntity.status(code.getHttpStatus())
                .body(new ErrorResponseDTO(code, message, retryAfter));
    }
}
