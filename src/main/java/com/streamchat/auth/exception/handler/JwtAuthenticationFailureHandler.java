package com.streamchat.auth.exception.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamchat.exception.ChatErrorCode;
import com.streamchat.room.dto.ErrorResponseDTO;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/* entry point of the room API chain: no valid token on a request that needs one */
public class JwtAuthenticationFailureHandler implements AuthenticationEntryPoint {

    private static final Logger logger = LoggerFactory.getLogger(JwtAuthenticationFailureHandler.class);

    public static final String MESSAGE = "Authentication required";

    private final ObjectMapper objectMapper;

    public JwtAuthenticationFailureHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request,
                         HttpServletResponse response,
                         AuthenticationException authException) throws IOException {

        logger.info("[unauthenticated] method={}, uri={}", request.getMethod(), request.getRequestURI());
        ErrorWriter.write(objectMapper, response, ChatErrorCode.NOT_REGISTERED, MESSAGE);
    }

    /* shared with the access denied handler */
    static final class ErrorWriter {

        private ErrorWriter() {
        }

        static void write(ObjectMapper objectMapper, HttpServletResponse response,
                          ChatErrorCode code, String message) throws IOException {
            response.setStatus(code.getHttpStatus().value());
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            response.setCharacterEncoding(StandardCharsets.UTF_8.name());
            objectMapper.writeValue(response.getWriter(), new ErrorResponseDTO(code, message, null));
        }
    }
}
