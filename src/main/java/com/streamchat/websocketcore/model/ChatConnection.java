package com.streamchat.websocketcore.model;

import com.streamchat.auth.model.StreamIdentity;
import com.streamchat.event.ChatEvent;
import lombok.Getter;

/**
 * @class ChatConnection
 * @brief One client connection and the identity bound to it by {@code register}.
 *        The verified identity, if any, comes from the bearer token seen at handshake time.
 */
@Getter
public class ChatConnection {

    private final String id;
    private final StreamIdentity verifiedIdentity;

    @Getter(lombok.AccessLevel.NONE)
    private final EventSink sink;

    private volatile String userId;
    private volatile String username;
    private volatile String displayName;

    public ChatConnection(String id, EventSink sink, StreamIdentity verifiedIdentity) {
        this.id = id;
        this.sink = sink;
        this.verifiedIdentity = verifiedIdentity;
    }

    public boolean isRegistered() {
        return userId != null;
    }

    public boolean isAuthenticated() {
        return verifiedIdentity != null;
    }

    public void bindIdentity(String userId, String username, String displayName) {
        this.userId = userId;
        this.username = username;
        this.displayName = displayName;
    }

    public void deliver(ChatEvent event) {
        sink.deliver(event);
    }

    public void close(int code, String reason) {
        sink.close(code, reason);
    }

    @Override
    public String toString() {
        return "ChatConnection{id='" + id + "', userId='" + userId + "', authenticated=" + isAuthenticated() + '}';
    }
}
