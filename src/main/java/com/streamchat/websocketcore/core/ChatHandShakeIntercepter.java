package com.streamchat.websocketcore.core;

import com.streamchat.auth.model.StreamIdentity;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

import java.util.Map;

/**
 * @class ChatHandShakeIntercepter
 * @brief Copies the identity verified by {@code JwtAuthProcessorFilter} into the WebSocket
 *        session attributes. The handshake is never refused: a connection without a valid
 *        token stays anonymous.
 */
public class ChatHandShakeIntercepter implements HandshakeInterceptor {

    private static final Logger logger = LogManager.getLogger(ChatHandShakeIntercepter.class);

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        if (request instanceof ServletServerHttpRequest servletServerRequest) {
            HttpServletRequest servletRequest = servletServerRequest.getServletRequest();
            Object identity = servletRequest.getAttribute(StreamIdentity.ATTRIBUTE);
            if (identity instanceof StreamIdentity) {
                attributes.put(StreamIdentity.ATTRIBUTE, identity);
            }
            logger.debug("[beforeHandshake] remote={}, authenticated={}",
                    servletRequest.getRemoteAddr(), identity != null);
        }
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        if (exception != null) {
            logger.warn("[afterHandshake] handshake failed: {}", exception.getMessage());
        }
    }
}
