package com.streamchat.auth.exception.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamchat.exception.ChatErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.web.access.AccessDeniedHandler;

import java.io.IOException;

/* authenticated caller who neither owns the room's stream nor is an admin */
public class JwtAccessDeniedHandler implements AccessDeniedHandler {

    private static final Logger logger = LoggerFactory.getLogger(JwtAccessDeniedHandler.class);

    public static final String MESSAGE = "Only the room owner can manage this room";

    private final ObjectMapper objectMapper;

    public JwtAccessDeniedHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void handle(HttpServletRequest request,
                       HttpServletResponse response,
                       AccessDeniedException accessDeniedException) throws IOException {

        logger.warn("[access denied] method={}, uri={}", request.getMethod(), request.getRequestURI());
        JwtAuthenticationFailureHandler.ErrorWriter.write(objectMapper, response, ChatErrorCode.FORBIDDEN, MESSAGE);
    }
}
