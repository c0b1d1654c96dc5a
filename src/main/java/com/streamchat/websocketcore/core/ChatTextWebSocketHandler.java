package com.streamchat.websocketcore.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamchat.auth.model.StreamIdentity;
import com.streamchat.websocketcore.model.ChatConnection;
import com.streamchat.websocketcore.service.ChatCommandDispatcher;
import com.streamchat.websocketcore.service.ChatConnectionService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.task.TaskExecutor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Optional;

/**
 * @class ChatTextWebSocketHandler
 * @brief Transport edge of the chat: one {@link ChatConnection} per WebSocket session.
 *
 * - on connect: opens the connection behind a queued sink, so sends never block on a slow receiver
 * - on text frame: hands the payload to {@link ChatCommandDispatcher}
 * - on close: disconnect, which leaves every room of the user exactly once
 *
 * @called_by WebSocketConfig.registerWebSocketHandlers()
 */
public class ChatTextWebSocketHandler extends TextWebSocketHandler {

    private static final Logger logger = LogManager.getLogger(ChatTextWebSocketHandler.class);

    private final ChatConnectionService chatConnectionService;
    private final ChatCommandDispatcher chatCommandDispatcher;
    private final ObjectMapper objectMapper;
    private final TaskExecutor outboundExecutor;
    private final int sendTimeLimitMillis;
    private final int sendBufferSizeLimit;

    public ChatTextWebSocketHandler(
            ChatConnectionService chatConnectionService,
            ChatCommandDispatcher chatCommandDispatcher,
            ObjectMapper objectMapper,
            TaskExecutor outboundExecutor,
            int sendTimeLimitMillis,
            int sendBufferSizeLimit) {

        this.chatConnectionService = chatConnectionService;
        this.chatCommandDispatcher = chatCommandDispatcher;
        this.objectMapper = objectMapper;
        this.outboundExecutor = outboundExecutor;
        this.sendTimeLimitMillis = sendTimeLimitMillis;
        this.sendBufferSizeLimit = sendBufferSizeLimit;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        StreamIdentity identity = (StreamIdentity) session.getAttributes().get(StreamIdentity.ATTRIBUTE);

        WebSocketEventSink sink = new WebSocketEventSink(
                session, objectMapper, outboundExecutor, sendTimeLimitMillis, sendBufferSizeLimit);
        chatConnectionService.open(session.getId(), sink, identity);

        logger.info("[afterConnectionEstablished] sessionId={}, remote={}, authenticated={}",
                session.getId(), session.getRemoteAddress(), identity != null);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        Optional<ChatConnection> connection = chatConnectionService.find(session.getId());
        if (connection.isEmpty()) {
            logger.warn("[handleTextMessage] frame on unknown session, ignored: sessionId={}", session.getId());
            return;
        }
        chatCommandDispatcher.dispatch(connection.get(), message.getPayload());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        logger.info("[afterConnectionClosed] sessionId={}, status={}", session.getId(), status);
        chatConnectionService.disconnect(session.getId());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        logger.warn("[handleTransportError] sessionId={}, error={}", session.getId(), exception.getMessage());
    }
}
