package com.streamchat.websocketcore.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamchat.websocketcore.service.ChatCommandDispatcher;
import com.streamchat.websocketcore.service.ChatConnectionService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final ChatConnectionService chatConnectionService;
    private final ChatCommandDispatcher chatCommandDispatcher;
    private final ObjectMapper objectMapper;
    private final TaskExecutor outboundExecutor;

    @Value("${streamchat.websocket.endpoint:/chat}")
    private String endpoint;

    @Value("${streamchat.websocket.allowed-origins:*}")
    private String[] allowedOrigins;

    @Value("${streamchat.websocket.send-time-limit-millis:5000}")
    private int sendTimeLimitMillis;

    @Value("${streamchat.websocket.send-buffer-size-limit:524288}")
    private int sendBufferSizeLimit;

    @Value("${streamchat.websocket.max-text-message-size:8192}")
    private int maxTextMessageSize;

    public WebSocketConfig(
            ChatConnectionService chatConnectionService,
            ChatCommandDispatcher chatCommandDispatcher,
            ObjectMapper objectMapper,
            @Qualifier("chatOutboundExecutor") TaskExecutor outboundExecutor) {

        this.chatConnectionService = chatConnectionService;
        this.chatCommandDispatcher = chatCommandDispatcher;
        this.objectMapper = objectMapper;
        this.outboundExecutor = outboundExecutor;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(textWebSocketHandler(), endpoint)
                .addInterceptors(handshakeInterceptor())
                .setAllowedOriginPatterns(allowedOrigins);
    }

    @Bean
    public ChatTextWebSocketHandler textWebSocketHandler() {
        return new ChatTextWebSocketHandler(
                chatConnectionService, chatCommandDispatcher, objectMapper,
                outboundExecutor, sendTimeLimitMillis, sendBufferSizeLimit);
    }

    @Bean
    public HandshakeInterceptor handshakeInterceptor() {
        return new ChatHandShakeIntercepter();
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(maxTextMessageSize);
        return container;
    }
}
