package com.streamchat.websocketcore.core;

import com.streamchat.event.ChatEvent;
import com.streamchat.event.ChatEventPublisher;
import com.streamchat.websocketcore.model.ChatSessionRegistry;
import org.springframework.stereotype.Component;

/**
 * Fan-out over the connections held in {@link ChatSessionRegistry}. Each delivery is handed to
 * the connection's sink, which buffers instead of blocking.
 */
@Component
public class ChatSessionEventPublisher implements ChatEventPublisher {

    private final ChatSessionRegistry chatSessionRegistry;

    public ChatSessionEventPublisher(ChatSessionRegistry chatSessionRegistry) {
        this.chatSessionRegistry = chatSessionRegistry;
    }

    @Override
    public void subscribe(String roomId, String userId) {
        chatSessionRegistry.subscribe(roomId, userId);
    }

    @Override
    public void unsubscribe(String roomId, String userId) {
        chatSessionRegistry.unsubscribe(roomId, userId);
    }

    @Override
    public void broadcast(String roomId, ChatEvent event) {
        for (String userId : chatSessionRegistry.subscribersOf(roomId)) {
            sendToUser(userId, event);
        }
    }

    @Override
    public void broadcastExcept(String roomId, String excludedUserId, ChatEvent event) {
        for (String userId : chatSessionRegistry.subscribersOf(roomId)) {
            if (!userId.equals(excludedUserId)) {
                sendToUser(userId, event);
            }
        }
    }

    @Override
    public void sendToUser(String userId, ChatEvent event) {
        chatSessionRegistry.connectionOf(userId).ifPresent(connection -> connection.deliver(event));
    }
}
